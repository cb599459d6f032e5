package io.spelunk.path;

import io.spelunk.syntax.api.NodeKinds;
import io.spelunk.syntax.api.SyntaxNode;
import java.util.Objects;
import java.util.Optional;

/**
 * Scope lookups for statements: enclosing method and type, nesting, and class/method filters.
 *
 * <p>Statements outside any type and method (top-level statements) are reported as belonging to
 * class {@value #TOP_LEVEL_CLASS} and method {@value #TOP_LEVEL_METHOD}.
 */
public final class StatementScope {

  public static final String TOP_LEVEL_CLASS = "Program";
  public static final String TOP_LEVEL_METHOD = "Main";

  private final NodeKinds kinds;

  public StatementScope() {
    this(NodeKinds.standard());
  }

  public StatementScope(NodeKinds kinds) {
    this.kinds = Objects.requireNonNull(kinds, "kinds");
  }

  public Optional<SyntaxNode> containingMethod(SyntaxNode node) {
    for (SyntaxNode p = node.parent(); p != null; p = p.parent()) {
      if (kinds.isMethodDeclaration(p)) {
        return Optional.of(p);
      }
    }
    return Optional.empty();
  }

  public Optional<SyntaxNode> containingType(SyntaxNode node) {
    for (SyntaxNode p = node.parent(); p != null; p = p.parent()) {
      if (kinds.isTypeDeclaration(p)) {
        return Optional.of(p);
      }
    }
    return Optional.empty();
  }

  public boolean isTopLevel(SyntaxNode node) {
    return containingMethod(node).isEmpty() && containingType(node).isEmpty();
  }

  /** Name of the enclosing method, {@code Main} for top-level statements, else empty. */
  public String methodName(SyntaxNode node) {
    Optional<SyntaxNode> method = containingMethod(node);
    if (method.isPresent()) {
      return method.get().declaredName().orElse("");
    }
    return isTopLevel(node) ? TOP_LEVEL_METHOD : "";
  }

  /** Name of the enclosing type, {@code Program} for top-level statements, else empty. */
  public String className(SyntaxNode node) {
    Optional<SyntaxNode> type = containingType(node);
    if (type.isPresent()) {
      return type.get().declaredName().orElse("");
    }
    return isTopLevel(node) ? TOP_LEVEL_CLASS : "";
  }

  /** True if another statement lies between {@code node} and its enclosing declaration. */
  public boolean isNested(SyntaxNode node) {
    for (SyntaxNode p = node.parent(); p != null && !kinds.isBoundary(p); p = p.parent()) {
      if (kinds.isStatement(p)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Tests whether {@code node} lies in the given class and method.
   *
   * @param className required enclosing type name, or null for any
   * @param methodName required enclosing method name, or null for any
   */
  public boolean isInScope(SyntaxNode node, String className, String methodName) {
    if (className != null && !className.equals(className(node))) {
      return false;
    }
    return methodName == null || methodName.equals(methodName(node));
  }
}
