package io.spelunk.path;

import static io.spelunk.syntax.impl.SimpleSyntaxNode.node;

import io.spelunk.syntax.api.SyntaxNode;

/** Shared test trees. */
final class Fixtures {

  private Fixtures() {}

  /**
   * <pre>
   * unit
   *   class A (public)
   *     method M (public, async)
   *       block
   *         if
   *           block
   *             return
   *         while
   *     method N (private, static)
   *       block
   *         if
   *   class Foo
   *   class FooBar
   * </pre>
   */
  static SyntaxNode sample() {
    return node("unit")
        .children(
            node("class")
                .name("A")
                .modifiers("public")
                .children(
                    node("method")
                        .name("M")
                        .modifiers("public", "async")
                        .child(
                            node("block")
                                .children(
                                    node("if")
                                        .text("if (x) { return 1; }")
                                        .child(
                                            node("block")
                                                .child(node("return").text("return 1;"))),
                                    node("while").text("while (y) { }"))),
                    node("method")
                        .name("N")
                        .modifiers("private", "static")
                        .child(node("block").child(node("if").text("if (z) { }")))),
            node("class").name("Foo"),
            node("class").name("FooBar"))
        .build();
  }

  static SyntaxNode find(SyntaxNode root, String path) {
    var result = SpelunkPathEvaluator.evaluate(path, root);
    if (result.size() != 1) {
      throw new AssertionError("Expected exactly one match for " + path + " but got " + result);
    }
    return result.get(0);
  }
}
