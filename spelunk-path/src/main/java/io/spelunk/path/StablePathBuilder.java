package io.spelunk.path;

import io.spelunk.syntax.api.NodeKinds;
import io.spelunk.syntax.api.SyntaxNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds deterministic string addresses for nodes of one tree snapshot.
 *
 * <p>Two forms are produced:
 *
 * <ul>
 *   <li>the <em>stable path</em> ({@link #buildPath}), a readable address made of declaration and
 *       statement segments only, e.g. {@code /A/Bar/if[1]};
 *   <li>the <em>structural path</em> ({@link #buildStructuralPath}), which names every node from
 *       the root down and can be walked back with {@link #resolveStructuralPath}.
 * </ul>
 *
 * <p>Positions count same-tagged preceding siblings, so neither form survives edits that insert or
 * remove such siblings before the addressed node.
 */
public final class StablePathBuilder {

  private final NodeKinds kinds;
  private final AddressStyle style;

  public StablePathBuilder() {
    this(NodeKinds.standard(), AddressStyle.COMPACT);
  }

  public StablePathBuilder(NodeKinds kinds, AddressStyle style) {
    this.kinds = Objects.requireNonNull(kinds, "kinds");
    this.style = Objects.requireNonNull(style, "style");
  }

  public NodeKinds kinds() {
    return kinds;
  }

  public AddressStyle style() {
    return style;
  }

  /**
   * Builds the stable path of {@code node}.
   *
   * @param node the addressed node
   * @param boundary exclusive upper bound of the walk; null (or a node that is not an ancestor)
   *     walks to the tree root
   * @return root-to-node segments joined by {@code /}, or {@code /} when no segment applies
   */
  public String buildPath(SyntaxNode node, SyntaxNode boundary) {
    Objects.requireNonNull(node, "node");
    List<String> segments = new ArrayList<>();
    for (SyntaxNode current = node;
        current != null && current != boundary;
        current = current.parent()) {
      String segment = segment(current);
      if (segment != null) {
        segments.add(segment);
      }
    }
    Collections.reverse(segments);
    return "/" + String.join("/", segments);
  }

  /**
   * Counts statement and block ancestors of {@code node} up to {@code boundary}. With a null
   * boundary the nearest enclosing method-like or type declaration is used, or the root if there
   * is none.
   */
  public int nestingDepth(SyntaxNode node, SyntaxNode boundary) {
    Objects.requireNonNull(node, "node");
    int depth = 0;
    for (SyntaxNode p = node.parent(); p != null && p != boundary; p = p.parent()) {
      if (boundary == null && kinds.isBoundary(p)) {
        break;
      }
      if (kinds.isStatement(p) || kinds.isBlock(p)) {
        depth++;
      }
    }
    return depth;
  }

  private String segment(SyntaxNode node) {
    if (!kinds.isAddressable(node)) {
      return null;
    }
    Optional<String> name = node.declaredName();
    if (kinds.isDeclaration(node) && name.isPresent()) {
      return style == AddressStyle.COMPACT
          ? name.get()
          : node.typeTag() + "[" + name.get() + "]";
    }
    return node.typeTag() + "[" + positionAmongSiblings(node) + "]";
  }

  /** 1-based position of {@code node} among its parent's children with the same type tag. */
  public static int positionAmongSiblings(SyntaxNode node) {
    SyntaxNode parent = node.parent();
    if (parent == null) {
      return 1;
    }
    int position = 1;
    for (SyntaxNode sibling : parent.children()) {
      if (sibling == node) {
        break;
      }
      if (sibling.typeTag().equalsIgnoreCase(node.typeTag())) {
        position++;
      }
    }
    return position;
  }

  // === Structural paths ===

  /**
   * Builds the structural path of {@code node}: one segment per node below the root, rendered as
   * {@code type[name]}, {@code type[name;k]} for the k-th same-named sibling, or {@code
   * type[position]} for anonymous nodes. The root itself renders as {@code /}.
   */
  public static String buildStructuralPath(SyntaxNode node) {
    Objects.requireNonNull(node, "node");
    List<String> segments = new ArrayList<>();
    for (SyntaxNode current = node; current.parent() != null; current = current.parent()) {
      segments.add(structuralSegment(current));
    }
    Collections.reverse(segments);
    return "/" + String.join("/", segments);
  }

  /**
   * Walks a structural path from {@code root}.
   *
   * @return the addressed node, or empty when any segment no longer exists
   * @throws IllegalArgumentException if the path is malformed
   */
  public static Optional<SyntaxNode> resolveStructuralPath(SyntaxNode root, String path) {
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(path, "path");
    if (!path.startsWith("/")) {
      throw new IllegalArgumentException("Structural path must start with '/': " + path);
    }
    SyntaxNode current = root;
    for (String segment : splitSegments(path.substring(1))) {
      current = resolveSegment(current, segment, path);
      if (current == null) {
        return Optional.empty();
      }
    }
    return Optional.of(current);
  }

  private static String structuralSegment(SyntaxNode node) {
    String tag = escape(node.typeTag());
    Optional<String> name = node.declaredName();
    if (name.isEmpty()) {
      return tag + "[" + positionAmongSiblings(node) + "]";
    }
    int k = 1;
    for (SyntaxNode sibling : node.parent().children()) {
      if (sibling == node) {
        break;
      }
      if (sibling.typeTag().equalsIgnoreCase(node.typeTag())
          && name.equals(sibling.declaredName())) {
        k++;
      }
    }
    String key = escape(name.get());
    return tag + "[" + (k > 1 ? key + ";" + k : key) + "]";
  }

  private static SyntaxNode resolveSegment(SyntaxNode parent, String segment, String path) {
    int open = indexOfUnescaped(segment, '[');
    if (open <= 0 || !segment.endsWith("]")) {
      throw new IllegalArgumentException("Malformed segment '" + segment + "' in " + path);
    }
    String tag = unescape(segment.substring(0, open));
    String key = segment.substring(open + 1, segment.length() - 1);

    if (!key.isEmpty() && key.chars().allMatch(Character::isDigit)) {
      int position = Integer.parseInt(key);
      int seen = 0;
      for (SyntaxNode child : parent.children()) {
        if (child.typeTag().equalsIgnoreCase(tag) && ++seen == position) {
          return child;
        }
      }
      return null;
    }

    int ordinal = 1;
    int semi = indexOfUnescaped(key, ';');
    if (semi >= 0) {
      try {
        ordinal = Integer.parseInt(key.substring(semi + 1));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Malformed segment '" + segment + "' in " + path, e);
      }
      key = key.substring(0, semi);
    }
    String name = unescape(key);
    int seen = 0;
    for (SyntaxNode child : parent.children()) {
      if (child.typeTag().equalsIgnoreCase(tag)
          && child.declaredName().map(name::equals).orElse(false)
          && ++seen == ordinal) {
        return child;
      }
    }
    return null;
  }

  private static List<String> splitSegments(String path) {
    List<String> segments = new ArrayList<>();
    if (path.isEmpty()) {
      return segments;
    }
    int start = 0;
    for (int i = 0; i < path.length(); i++) {
      char c = path.charAt(i);
      if (c == '\\') {
        i++;
      } else if (c == '/') {
        segments.add(path.substring(start, i));
        start = i + 1;
      }
    }
    segments.add(path.substring(start));
    return segments;
  }

  private static int indexOfUnescaped(String s, char target) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\\') {
        i++;
      } else if (c == target) {
        return i;
      }
    }
    return -1;
  }

  private static String escape(String s) {
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\\' || c == '/' || c == '[' || c == ']' || c == ';') {
        sb.append('\\');
      }
      sb.append(c);
    }
    return sb.toString();
  }

  private static String unescape(String s) {
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == '\\' && i + 1 < s.length()) {
        c = s.charAt(++i);
      }
      sb.append(c);
    }
    return sb.toString();
  }
}
