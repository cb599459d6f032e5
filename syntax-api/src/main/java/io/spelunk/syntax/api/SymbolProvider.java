package io.spelunk.syntax.api;

import java.util.Optional;

/**
 * Optional semantic lookup hook supplied by the compiler service. Only attribute predicates that
 * query semantic properties use it; purely syntactic queries never call it.
 */
@FunctionalInterface
public interface SymbolProvider {

  /**
   * Resolves the symbol declared or referenced by a node.
   *
   * @param node the node to resolve
   * @return the symbol, or empty when the node has none
   */
  Optional<SymbolInfo> resolve(SyntaxNode node);
}
