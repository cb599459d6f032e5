package io.spelunk.path;

import io.spelunk.path.SpelunkPath.*;
import io.spelunk.syntax.api.SymbolProvider;
import io.spelunk.syntax.api.SyntaxNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Evaluates SpelunkPath queries against a syntax tree.
 *
 * <p>Evaluation is a pure function of the query and the tree: it never mutates nodes and keeps no
 * state between calls, so concurrent evaluations need no synchronization.
 */
public final class SpelunkPathEvaluator {

  private SpelunkPathEvaluator() {}

  /** Evaluates a path string against the tree rooted at {@code root}. */
  public static List<SyntaxNode> evaluate(String path, SyntaxNode root) {
    return evaluate(SpelunkPathParser.parse(path), root, null);
  }

  public static List<SyntaxNode> evaluate(Query query, SyntaxNode root) {
    return evaluate(query, root, null);
  }

  /**
   * Evaluates a parsed query.
   *
   * <p>The working set starts as {@code root} (the topmost ancestor of {@code root} for absolute
   * paths). Each step replaces it with the de-duplicated union of the step's expansion over every
   * node in the set, then narrows that union with the step's predicates in declared order.
   *
   * @param query the parsed query
   * @param root the context node
   * @param symbols semantic lookup used by {@code @returns}; may be null
   * @return matching nodes, first-seen order, no duplicates
   */
  public static List<SyntaxNode> evaluate(Query query, SyntaxNode root, SymbolProvider symbols) {
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(root, "root");
    PredicateEngine predicates = new PredicateEngine(symbols);

    SyntaxNode start = query.absolute() ? treeRoot(root) : root;
    List<SyntaxNode> current = List.of(start);
    for (Step step : query.steps()) {
      current = applyStep(step, current, predicates);
      if (current.isEmpty()) {
        break;
      }
    }
    return current;
  }

  private static List<SyntaxNode> applyStep(
      Step step, List<SyntaxNode> context, PredicateEngine predicates) {
    Set<SyntaxNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    List<SyntaxNode> expanded = new ArrayList<>();
    for (SyntaxNode node : context) {
      for (SyntaxNode candidate : expand(step, node)) {
        if (seen.add(candidate)) {
          expanded.add(candidate);
        }
      }
    }
    List<SyntaxNode> result = expanded;
    for (SpelunkPath.Predicate p : step.predicates()) {
      result = predicates.apply(p, result);
    }
    return result;
  }

  private static List<SyntaxNode> expand(Step step, SyntaxNode node) {
    List<SyntaxNode> out = new ArrayList<>();
    switch (step.type()) {
      case CHILD -> {
        for (SyntaxNode child : node.children()) {
          addIfMatches(step, child, out);
        }
      }
      case DESCENDANT -> collectDescendants(step, node, out);
      case PARENT -> {
        SyntaxNode parent = node.parent();
        if (parent != null) {
          addIfMatches(step, parent, out);
        }
      }
      case AXIS -> expandAxis(step, node, out);
    }
    return out;
  }

  private static void expandAxis(Step step, SyntaxNode node, List<SyntaxNode> out) {
    switch (step.axis()) {
      case SELF -> addIfMatches(step, node, out);
      case DESCENDANT_OR_SELF -> collectSubtree(step, node, out);
      case ANCESTOR_OR_SELF -> {
        addIfMatches(step, node, out);
        collectAncestors(step, node, out);
      }
      case ANCESTOR -> collectAncestors(step, node, out);
      case FOLLOWING_SIBLING -> {
        List<SyntaxNode> siblings = siblings(node);
        int idx = indexOf(siblings, node);
        for (int i = idx + 1; i < siblings.size(); i++) {
          addIfMatches(step, siblings.get(i), out);
        }
      }
      case PRECEDING_SIBLING -> {
        List<SyntaxNode> siblings = siblings(node);
        int idx = indexOf(siblings, node);
        for (int i = idx - 1; i >= 0; i--) {
          addIfMatches(step, siblings.get(i), out);
        }
      }
      case FOLLOWING -> collectFollowing(step, node, out);
      case PRECEDING -> collectPreceding(step, node, out);
    }
  }

  /** Later siblings of the node and of each ancestor, with their subtrees, in document order. */
  private static void collectFollowing(Step step, SyntaxNode node, List<SyntaxNode> out) {
    for (SyntaxNode n = node; n.parent() != null; n = n.parent()) {
      List<SyntaxNode> siblings = n.parent().children();
      for (int i = indexOf(siblings, n) + 1; i < siblings.size(); i++) {
        collectSubtree(step, siblings.get(i), out);
      }
    }
  }

  /** Earlier siblings of each ancestor and of the node, with their subtrees, in document order. */
  private static void collectPreceding(Step step, SyntaxNode node, List<SyntaxNode> out) {
    Deque<SyntaxNode> chain = new ArrayDeque<>();
    for (SyntaxNode n = node; n.parent() != null; n = n.parent()) {
      chain.push(n);
    }
    for (SyntaxNode n : chain) {
      List<SyntaxNode> siblings = n.parent().children();
      int idx = indexOf(siblings, n);
      for (int i = 0; i < idx; i++) {
        collectSubtree(step, siblings.get(i), out);
      }
    }
  }

  private static void collectSubtree(Step step, SyntaxNode node, List<SyntaxNode> out) {
    addIfMatches(step, node, out);
    collectDescendants(step, node, out);
  }

  /** Pre-order, excluding {@code node} itself. Iterative to keep deep trees off the call stack. */
  private static void collectDescendants(Step step, SyntaxNode node, List<SyntaxNode> out) {
    Deque<SyntaxNode> stack = new ArrayDeque<>();
    pushChildren(node, stack);
    while (!stack.isEmpty()) {
      SyntaxNode n = stack.pop();
      addIfMatches(step, n, out);
      pushChildren(n, stack);
    }
  }

  private static void pushChildren(SyntaxNode node, Deque<SyntaxNode> stack) {
    List<SyntaxNode> children = node.children();
    for (int i = children.size() - 1; i >= 0; i--) {
      stack.push(children.get(i));
    }
  }

  private static void collectAncestors(Step step, SyntaxNode node, List<SyntaxNode> out) {
    for (SyntaxNode p = node.parent(); p != null; p = p.parent()) {
      addIfMatches(step, p, out);
    }
  }

  private static List<SyntaxNode> siblings(SyntaxNode node) {
    SyntaxNode parent = node.parent();
    return parent == null ? List.of() : parent.children();
  }

  private static int indexOf(List<SyntaxNode> siblings, SyntaxNode node) {
    for (int i = 0; i < siblings.size(); i++) {
      if (siblings.get(i) == node) {
        return i;
      }
    }
    return -1;
  }

  private static void addIfMatches(Step step, SyntaxNode node, List<SyntaxNode> out) {
    if (step.matchesAnyNode() || step.nodeTest().equalsIgnoreCase(node.typeTag())) {
      out.add(node);
    }
  }

  static SyntaxNode treeRoot(SyntaxNode node) {
    SyntaxNode n = node;
    while (n.parent() != null) {
      n = n.parent();
    }
    return n;
  }
}
