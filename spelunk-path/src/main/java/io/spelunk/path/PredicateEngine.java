package io.spelunk.path;

import io.spelunk.path.SpelunkPath.*;
import io.spelunk.syntax.api.SymbolInfo;
import io.spelunk.syntax.api.SymbolProvider;
import io.spelunk.syntax.api.SyntaxNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies bracketed predicates to ordered candidate sequences. Filters are stable: survivors keep
 * their relative order. Nodes are never modified.
 */
public final class PredicateEngine {

  private static final Logger LOG = LoggerFactory.getLogger(PredicateEngine.class);

  /** Visual Basic modifier spellings mapped to their C# equivalents. */
  private static final Map<String, String> FLAG_SYNONYMS =
      Map.of(
          "shared", "static",
          "mustinherit", "abstract",
          "overridable", "virtual",
          "overrides", "override",
          "notinheritable", "sealed",
          "friend", "internal");

  private final SymbolProvider symbols;

  /**
   * @param symbols semantic lookup for {@code @returns}; may be null
   */
  public PredicateEngine(SymbolProvider symbols) {
    this.symbols = symbols;
  }

  /** Applies the predicate to the whole candidate sequence. */
  public List<SyntaxNode> apply(SpelunkPath.Predicate predicate, List<SyntaxNode> nodes) {
    if (nodes.isEmpty()) {
      return List.of();
    }
    if (predicate instanceof NamePredicate np) {
      return filter(nodes, n -> matchesName(np, n));
    } else if (predicate instanceof PositionPredicate pp) {
      int index = pp.resolve(nodes.size());
      return index >= 0 && index < nodes.size() ? List.of(nodes.get(index)) : List.of();
    } else if (predicate instanceof AttributePredicate ap) {
      return filter(nodes, n -> matchesAttribute(ap, n));
    } else if (predicate instanceof BooleanPredicate bp) {
      return filter(nodes, n -> hasFlag(n, bp.flag()));
    } else if (predicate instanceof CompoundPredicate cp) {
      if (cp.op() == LogicalOp.AND) {
        return apply(cp.right(), apply(cp.left(), nodes));
      }
      return NodeSets.union(apply(cp.left(), nodes), apply(cp.right(), nodes));
    } else if (predicate instanceof NotPredicate np) {
      return NodeSets.difference(nodes, apply(np.inner(), nodes));
    } else if (predicate instanceof PathPredicate pp) {
      return filter(nodes, n -> !SpelunkPathEvaluator.evaluate(pp.query(), n, symbols).isEmpty());
    }
    throw new IllegalStateException("Unknown predicate: " + predicate);
  }

  private static List<SyntaxNode> filter(List<SyntaxNode> nodes, Predicate<SyntaxNode> test) {
    List<SyntaxNode> result = new ArrayList<>();
    for (SyntaxNode n : nodes) {
      if (test.test(n)) {
        result.add(n);
      }
    }
    return result;
  }

  private static boolean matchesName(NamePredicate np, SyntaxNode node) {
    Optional<String> name = node.declaredName();
    if (name.isEmpty()) {
      return false;
    }
    return np.hasWildcard()
        ? WildcardMatcher.matches(np.name(), name.get())
        : np.name().equals(name.get());
  }

  private boolean matchesAttribute(AttributePredicate ap, SyntaxNode node) {
    return switch (ap.name()) {
      case Attributes.TYPE -> compare(
          ap, WildcardMatcher.matchesIgnoreCase(ap.value(), node.typeTag()), node.typeTag());
      case Attributes.CONTAINS -> compare(
          ap, node.text() != null && node.text().contains(ap.value()), node.text());
      case Attributes.MATCHES -> {
        Pattern pattern = ap.pattern() != null ? ap.pattern() : Pattern.compile(ap.value());
        yield compare(ap, node.text() != null && pattern.matcher(node.text()).find(), node.text());
      }
      case Attributes.LANGUAGE -> compare(
          ap, ap.value().equalsIgnoreCase(node.language()), node.language());
      case Attributes.MODIFIERS -> matchesModifiers(ap, node);
      case Attributes.RETURNS -> matchesReturns(ap, node);
      default -> {
        LOG.debug("Unknown attribute '@{}' evaluates to no match", ap.name());
        yield false;
      }
    };
  }

  /**
   * Combines the equality outcome with the operator. {@code ~=} is a case-insensitive substring
   * test on the raw value.
   */
  private static boolean compare(AttributePredicate ap, boolean equal, String actual) {
    return switch (ap.op()) {
      case EQ -> equal;
      case NE -> actual != null && !equal;
      case CONTAINS -> actual != null
          && actual.toLowerCase(Locale.ROOT).contains(ap.value().toLowerCase(Locale.ROOT));
    };
  }

  /** Modifiers are a set: {@code =} and {@code ~=} both test membership of one flag. */
  private static boolean matchesModifiers(AttributePredicate ap, SyntaxNode node) {
    return switch (ap.op()) {
      case EQ, CONTAINS -> hasFlag(node, ap.value());
      case NE -> !hasFlag(node, ap.value());
    };
  }

  private boolean matchesReturns(AttributePredicate ap, SyntaxNode node) {
    if (symbols == null) {
      return false;
    }
    Optional<String> returnType = symbols.resolve(node).map(SymbolInfo::returnType);
    if (returnType.isEmpty() || returnType.get() == null) {
      return false;
    }
    String actual = returnType.get();
    return compare(ap, WildcardMatcher.matchesIgnoreCase(ap.value(), actual), actual);
  }

  static boolean hasFlag(SyntaxNode node, String flag) {
    String wanted = canonicalFlag(flag);
    Set<String> modifiers = node.modifiers();
    for (String m : modifiers) {
      if (canonicalFlag(m).equals(wanted)) {
        return true;
      }
    }
    return false;
  }

  private static String canonicalFlag(String flag) {
    String lower = flag.toLowerCase(Locale.ROOT);
    return FLAG_SYNONYMS.getOrDefault(lower, lower);
  }
}
