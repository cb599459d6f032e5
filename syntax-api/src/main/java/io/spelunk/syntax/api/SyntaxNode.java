package io.spelunk.syntax.api;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A node of an immutable syntax tree owned by the compiler front-end. The path engine only reads
 * nodes; it never creates or mutates them.
 *
 * <p>Within one snapshot the parent/child relation is acyclic and fixed. Node identity is reference
 * identity: two handles denote the same node only if they are the same object.
 */
public interface SyntaxNode {

  /** Returns the short, lower-case type tag of this node (e.g. {@code class}, {@code if}). */
  String typeTag();

  /**
   * Returns the intrinsic declared name of this node, if it has one. Declarations (types, methods,
   * fields) carry a name; statements and expressions usually do not.
   */
  Optional<String> declaredName();

  /** Returns the children of this node in document order. Never null. */
  List<SyntaxNode> children();

  /**
   * Returns the parent of this node.
   *
   * @return the parent, or null for the root of the tree
   */
  SyntaxNode parent();

  /** Returns the source location of this node. */
  SourceSpan span();

  /** Returns the modifiers of this node (e.g. {@code public}, {@code async}). Never null. */
  Set<String> modifiers();

  /** Returns the source language of the tree this node belongs to. */
  String language();

  /** Returns the rendered source text of this node. */
  String text();
}
