package io.spelunk.syntax.api;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Classifies type tags into the categories the path engine cares about: declarations, declaration
 * boundaries, statements and blocks. Tags are compared case-insensitively.
 *
 * <p>{@link #standard()} covers the tags produced by the bundled C# and Visual Basic front-ends.
 * Hosts with a different tag vocabulary construct their own instance.
 */
public record NodeKinds(
    Set<String> typeDeclarations,
    Set<String> methodDeclarations,
    Set<String> otherDeclarations,
    Set<String> statements,
    Set<String> blocks) {

  private static final NodeKinds STANDARD =
      new NodeKinds(
          Set.of("class", "interface", "struct", "record", "enum", "module"),
          Set.of("method", "constructor", "destructor", "operator"),
          Set.of("namespace", "property", "field", "event"),
          Set.of(
              "if", "while", "for", "foreach", "do", "switch", "select", "try", "expression",
              "local", "return", "throw", "using", "lock", "synclock", "break", "continue",
              "yield", "goto", "labeled", "checked", "unsafe", "fixed", "empty", "statement"),
          Set.of("block"));

  public NodeKinds {
    typeDeclarations = normalize(typeDeclarations);
    methodDeclarations = normalize(methodDeclarations);
    otherDeclarations = normalize(otherDeclarations);
    statements = normalize(statements);
    blocks = normalize(blocks);
  }

  /** Returns the default classification. */
  public static NodeKinds standard() {
    return STANDARD;
  }

  public boolean isTypeDeclaration(SyntaxNode node) {
    return node != null && typeDeclarations.contains(tagOf(node));
  }

  public boolean isMethodDeclaration(SyntaxNode node) {
    return node != null && methodDeclarations.contains(tagOf(node));
  }

  public boolean isDeclaration(SyntaxNode node) {
    if (node == null) {
      return false;
    }
    String tag = tagOf(node);
    return typeDeclarations.contains(tag)
        || methodDeclarations.contains(tag)
        || otherDeclarations.contains(tag);
  }

  /** A declaration boundary is a method-like or type declaration. */
  public boolean isBoundary(SyntaxNode node) {
    return isMethodDeclaration(node) || isTypeDeclaration(node);
  }

  public boolean isStatement(SyntaxNode node) {
    return node != null && statements.contains(tagOf(node));
  }

  public boolean isBlock(SyntaxNode node) {
    return node != null && blocks.contains(tagOf(node));
  }

  /** True for nodes that receive a segment in a stable path. */
  public boolean isAddressable(SyntaxNode node) {
    return isDeclaration(node) || isStatement(node) || isBlock(node);
  }

  private static String tagOf(SyntaxNode node) {
    return node.typeTag().toLowerCase(Locale.ROOT);
  }

  private static Set<String> normalize(Set<String> tags) {
    return tags == null
        ? Set.of()
        : tags.stream()
            .map(t -> t.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
  }
}
