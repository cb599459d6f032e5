package io.spelunk.path;

import static io.spelunk.syntax.impl.SimpleSyntaxNode.node;
import static org.junit.jupiter.api.Assertions.*;

import io.spelunk.syntax.api.SyntaxNode;
import io.spelunk.syntax.impl.SimpleSyntaxNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

/**
 * Property-based tests for evaluation determinism, set semantics of predicates, and wildcard
 * matching laws, over randomly shaped trees.
 */
@PropertyDefaults(tries = 200)
class SpelunkPathPropertyTests {

  private static final String[] TAGS = {"class", "method", "block", "if", "while", "return"};

  @Property
  void evaluationIsDeterministic(@ForAll("shapes") List<Integer> shape) {
    SyntaxNode root = tree(shape);
    for (String path : List.of("//*", "//if/ancestor::*", "//block/*[last()]", "//*[not(if)]")) {
      assertEquals(
          SpelunkPathEvaluator.evaluate(path, root), SpelunkPathEvaluator.evaluate(path, root));
    }
  }

  @Property
  void descendantsVisitEveryNodeOnce(@ForAll("shapes") List<Integer> shape) {
    SyntaxNode root = tree(shape);
    List<SyntaxNode> all = SpelunkPathEvaluator.evaluate("//*", root);
    assertEquals(shape.size(), all.size());
    Set<SyntaxNode> unique = Collections.newSetFromMap(new IdentityHashMap<>());
    unique.addAll(all);
    assertEquals(all.size(), unique.size());
  }

  @Property
  void notPartitionsCandidates(
      @ForAll("shapes") List<Integer> shape, @ForAll("tags") String tag) {
    SyntaxNode root = tree(shape);
    List<SyntaxNode> all = SpelunkPathEvaluator.evaluate("//*", root);
    List<SyntaxNode> hits = SpelunkPathEvaluator.evaluate("//*[@type='" + tag + "']", root);
    List<SyntaxNode> rest = SpelunkPathEvaluator.evaluate("//*[not(@type='" + tag + "')]", root);
    assertEquals(all.size(), hits.size() + rest.size());
    assertEquals(SpelunkPathEvaluator.evaluate("//" + tag, root), hits);
  }

  @Property
  void orOfComplementaryPredicatesIsEverything(
      @ForAll("shapes") List<Integer> shape, @ForAll("tags") String tag) {
    SyntaxNode root = tree(shape);
    List<SyntaxNode> all = SpelunkPathEvaluator.evaluate("//*", root);
    List<SyntaxNode> both =
        SpelunkPathEvaluator.evaluate(
            "//*[@type='" + tag + "' or not(@type='" + tag + "')]", root);
    assertEquals(Set.copyOf(tags(all)), Set.copyOf(tags(both)));
    assertEquals(all.size(), both.size());
  }

  @Property
  void lastSelectsFinalCandidate(@ForAll("shapes") List<Integer> shape) {
    SyntaxNode root = tree(shape);
    List<SyntaxNode> all = SpelunkPathEvaluator.evaluate("//*", root);
    List<SyntaxNode> last = SpelunkPathEvaluator.evaluate("//*[last()]", root);
    if (all.isEmpty()) {
      assertTrue(last.isEmpty());
    } else {
      assertEquals(List.of(all.get(all.size() - 1)), last);
    }
  }

  @Property
  void literalPatternMatchesItself(@ForAll @AlphaChars @StringLength(min = 1, max = 20) String s) {
    assertTrue(WildcardMatcher.matches(s, s));
    assertTrue(WildcardMatcher.matches("*", s));
    assertTrue(WildcardMatcher.matches(s + "*", s));
    assertTrue(WildcardMatcher.matches("*" + s.substring(s.length() - 1), s));
  }

  @Property
  void questionMarkMatchesExactlyOneCharacter(
      @ForAll @AlphaChars @StringLength(min = 1, max = 20) String s) {
    String pattern = "?".repeat(s.length());
    assertTrue(WildcardMatcher.matches(pattern, s));
    assertFalse(WildcardMatcher.matches(pattern + "?", s));
    assertFalse(WildcardMatcher.matches(s + "?", s));
  }

  @Property
  void followingAndPrecedingSliceDocumentOrder(
      @ForAll("shapes") List<Integer> shape, @ForAll @IntRange(min = 0, max = 40) int pick) {
    SyntaxNode root = tree(shape);
    List<SyntaxNode> document = new ArrayList<>();
    document.add(root);
    document.addAll(SpelunkPathEvaluator.evaluate("//*", root));
    int idx = pick % document.size();
    SyntaxNode node = document.get(idx);

    int subtree = 1 + SpelunkPathEvaluator.evaluate(".//*", node).size();
    assertEquals(
        document.subList(idx + subtree, document.size()),
        SpelunkPathEvaluator.evaluate("following::*", node));

    List<SyntaxNode> expected = new ArrayList<>(document.subList(0, idx));
    expected.removeAll(SpelunkPathEvaluator.evaluate("ancestor::*", node));
    assertEquals(expected, SpelunkPathEvaluator.evaluate("preceding::*", node));
  }

  @Property
  void wildcardMatchingIgnoresCase(@ForAll @AlphaChars @StringLength(min = 1, max = 20) String s) {
    assertTrue(WildcardMatcher.matches(s.toUpperCase() + "*", s.toLowerCase()));
  }

  @Provide
  Arbitrary<List<Integer>> shapes() {
    return Arbitraries.integers().between(0, 10_000).list().ofMinSize(0).ofMaxSize(40);
  }

  @Provide
  Arbitrary<String> tags() {
    return Arbitraries.of(TAGS);
  }

  /**
   * Builds a tree with one node per element: element i picks its tag and attaches to one of the
   * nodes created before it.
   */
  private static SyntaxNode tree(List<Integer> shape) {
    List<SimpleSyntaxNode.Builder> builders = new ArrayList<>();
    builders.add(node("unit"));
    for (int seed : shape) {
      SimpleSyntaxNode.Builder b = node(TAGS[seed % TAGS.length]);
      builders.get(seed % builders.size()).child(b);
      builders.add(b);
    }
    return builders.get(0).build();
  }

  private static List<String> tags(List<SyntaxNode> nodes) {
    List<String> out = new ArrayList<>();
    for (SyntaxNode n : nodes) {
      out.add(n.typeTag());
    }
    return out;
  }
}
