package io.spelunk.session;

import io.spelunk.syntax.api.SourceSpan;

/**
 * A statement found by {@link PathQueryService#findStatements} and registered for later reference.
 *
 * @param statementId registry id ({@code stmt-N})
 * @param typeTag statement type tag
 * @param text rendered source text
 * @param span source location
 * @param containingMethod enclosing method name, {@code Main} for top-level statements
 * @param containingClass enclosing type name, {@code Program} for top-level statements
 * @param depth nesting depth below the enclosing declaration
 * @param stablePath stable path of the statement
 */
public record StatementInfo(
    String statementId,
    String typeTag,
    String text,
    SourceSpan span,
    String containingMethod,
    String containingClass,
    int depth,
    String stablePath) {}
