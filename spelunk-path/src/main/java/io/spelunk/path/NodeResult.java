package io.spelunk.path;

import io.spelunk.syntax.api.SourceSpan;
import io.spelunk.syntax.api.SyntaxNode;

/**
 * A query match together with its location.
 *
 * @param node the matched node
 * @param text rendered source text of the node
 * @param span source location
 * @param nodeType the node's type tag
 * @param path stable path of the node
 */
public record NodeResult(
    SyntaxNode node, String text, SourceSpan span, String nodeType, String path) {

  public static NodeResult of(SyntaxNode node, StablePathBuilder paths) {
    return new NodeResult(
        node, node.text(), node.span(), node.typeTag(), paths.buildPath(node, null));
  }
}
