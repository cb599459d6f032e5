package io.spelunk.path;

import io.spelunk.syntax.api.SyntaxNode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/** Identity-based set operations over ordered node sequences. */
final class NodeSets {

  private NodeSets() {}

  static Set<SyntaxNode> identitySet(Collection<SyntaxNode> nodes) {
    Set<SyntaxNode> set = Collections.newSetFromMap(new IdentityHashMap<>());
    set.addAll(nodes);
    return set;
  }

  /** Concatenation of both sequences keeping the first occurrence of each node. */
  static List<SyntaxNode> union(List<SyntaxNode> first, List<SyntaxNode> second) {
    Set<SyntaxNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    List<SyntaxNode> result = new ArrayList<>(first.size() + second.size());
    for (SyntaxNode n : first) {
      if (seen.add(n)) {
        result.add(n);
      }
    }
    for (SyntaxNode n : second) {
      if (seen.add(n)) {
        result.add(n);
      }
    }
    return result;
  }

  /** Elements of {@code nodes} absent from {@code removed}, in original order. */
  static List<SyntaxNode> difference(List<SyntaxNode> nodes, List<SyntaxNode> removed) {
    Set<SyntaxNode> drop = identitySet(removed);
    List<SyntaxNode> result = new ArrayList<>(nodes.size());
    for (SyntaxNode n : nodes) {
      if (!drop.contains(n)) {
        result.add(n);
      }
    }
    return result;
  }
}
