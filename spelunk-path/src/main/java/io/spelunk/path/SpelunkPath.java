package io.spelunk.path;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * AST model for the SpelunkPath query language, an XPath-like language for locating nodes in a
 * syntax tree.
 *
 * <p>Query syntax examples:
 *
 * <pre>
 * # All async methods of classes whose name ends with Service
 * //class[@name='*Service']/method[async]
 *
 * # The last if statement of method M
 * //method[@name='M']//if[last()]
 *
 * # Statements following a return, within the same block
 * //return/following-sibling::*
 *
 * # Public, non-static members
 * //method[public and not(static)]
 *
 * # If statements that contain a return
 * //if[.//return]
 * </pre>
 */
public final class SpelunkPath {

  private SpelunkPath() {}

  /** How a step expands a node into candidates. */
  public enum StepType {
    /** Direct children ({@code /}). */
    CHILD,
    /** Transitive descendants in pre-order ({@code //}). */
    DESCENDANT,
    /** The single parent ({@code ..}). */
    PARENT,
    /** A named axis ({@code ancestor::}, {@code following-sibling::}, ...). */
    AXIS
  }

  /** Named axes usable with {@link StepType#AXIS}. */
  public enum Axis {
    ANCESTOR("ancestor"),
    ANCESTOR_OR_SELF("ancestor-or-self"),
    FOLLOWING_SIBLING("following-sibling"),
    PRECEDING_SIBLING("preceding-sibling"),
    SELF("self"),
    DESCENDANT_OR_SELF("descendant-or-self"),
    /** Nodes after the context node in document order, excluding its descendants. */
    FOLLOWING("following"),
    /** Nodes before the context node in document order, excluding its ancestors. */
    PRECEDING("preceding");

    private final String axisName;

    Axis(String axisName) {
      this.axisName = axisName;
    }

    public String axisName() {
      return axisName;
    }

    /** Returns the axis with the given name, or null if there is none. */
    public static Axis fromName(String name) {
      for (Axis axis : values()) {
        if (axis.axisName.equals(name)) {
          return axis;
        }
      }
      return null;
    }
  }

  /** Attribute comparison operators. */
  public enum AttrOp {
    EQ("="),
    NE("!="),
    CONTAINS("~=");

    private final String symbol;

    AttrOp(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }

  /** Logical operators for combining predicates. */
  public enum LogicalOp {
    AND,
    OR
  }

  // === Query structure ===

  /** A complete parsed path expression: an ordered sequence of steps. */
  public record Query(boolean absolute, List<Step> steps) {
    public Query {
      steps = List.copyOf(steps);
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < steps.size(); i++) {
        Step step = steps.get(i);
        if (step.type() == StepType.DESCENDANT) {
          sb.append("//");
        } else if (i > 0 || absolute) {
          sb.append('/');
        }
        sb.append(step);
      }
      return sb.toString();
    }
  }

  /**
   * One step of a path.
   *
   * @param type expansion kind
   * @param axis the named axis for {@link StepType#AXIS} steps, otherwise null
   * @param nodeTest type tag filter; null or {@code *} matches any node
   * @param predicates predicates applied in declared order
   */
  public record Step(StepType type, Axis axis, String nodeTest, List<Predicate> predicates) {
    public Step {
      Objects.requireNonNull(type, "type");
      if (type == StepType.AXIS && axis == null) {
        throw new IllegalArgumentException("Axis step without axis");
      }
      predicates = predicates == null ? List.of() : List.copyOf(predicates);
    }

    public Step(StepType type, String nodeTest) {
      this(type, null, nodeTest, List.of());
    }

    /** True if the node test accepts every node. */
    public boolean matchesAnyNode() {
      return nodeTest == null || "*".equals(nodeTest);
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder();
      if (type == StepType.PARENT) {
        sb.append("..");
      } else {
        if (type == StepType.AXIS) {
          sb.append(axis.axisName()).append("::");
        }
        sb.append(nodeTest == null ? "*" : nodeTest);
      }
      for (Predicate p : predicates) {
        sb.append('[').append(p).append(']');
      }
      return sb.toString();
    }
  }

  // === Predicates ===

  /** Base interface for bracketed predicates. */
  public sealed interface Predicate
      permits NamePredicate,
          PositionPredicate,
          AttributePredicate,
          BooleanPredicate,
          CompoundPredicate,
          NotPredicate,
          PathPredicate {}

  /** Matches a node's declared name, exactly or by {@code *}/{@code ?} wildcard pattern. */
  public record NamePredicate(String name, boolean hasWildcard) implements Predicate {
    public NamePredicate {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
      return "@name='" + name + "'";
    }
  }

  /**
   * Selects one element of the candidate sequence by position.
   *
   * @param expression the source form ({@code 2}, {@code last()}, {@code last()-1})
   * @param fromEnd whether {@code offset} counts back from the last element
   * @param offset 1-based index when counting from the start, distance from the last element
   *     otherwise
   */
  public record PositionPredicate(String expression, boolean fromEnd, int offset)
      implements Predicate {

    public static PositionPredicate index(int position) {
      return new PositionPredicate(Integer.toString(position), false, position);
    }

    public static PositionPredicate last(int back) {
      return new PositionPredicate(back == 0 ? "last()" : "last()-" + back, true, back);
    }

    /** Resolves this predicate to a 0-based index into a sequence of the given size. */
    public int resolve(int size) {
      return fromEnd ? size - 1 - offset : offset - 1;
    }

    @Override
    public String toString() {
      return expression;
    }
  }

  /**
   * Compares a node attribute with a value.
   *
   * @param pattern compiled regular expression for {@link Attributes#MATCHES}, otherwise null
   */
  public record AttributePredicate(String name, AttrOp op, String value, Pattern pattern)
      implements Predicate {
    public AttributePredicate {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(op, "op");
      Objects.requireNonNull(value, "value");
    }

    public AttributePredicate(String name, AttrOp op, String value) {
      this(name, op, value, null);
    }

    @Override
    public String toString() {
      return "@" + name + op.symbol() + "'" + value + "'";
    }
  }

  /** Tests membership of a flag in the node's modifier set. */
  public record BooleanPredicate(String flag) implements Predicate {
    public BooleanPredicate {
      flag = flag.toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
      return flag;
    }
  }

  /** {@code left and right} or {@code left or right}. */
  public record CompoundPredicate(LogicalOp op, Predicate left, Predicate right)
      implements Predicate {
    @Override
    public String toString() {
      return "(" + left + " " + op.name().toLowerCase(Locale.ROOT) + " " + right + ")";
    }
  }

  /** Complement of the inner predicate within the candidate sequence. */
  public record NotPredicate(Predicate inner) implements Predicate {
    @Override
    public String toString() {
      return "not(" + inner + ")";
    }
  }

  /** Keeps a node when the relative query evaluated from it finds at least one node. */
  public record PathPredicate(Query query) implements Predicate {
    public PathPredicate {
      Objects.requireNonNull(query, "query");
      if (query.absolute()) {
        throw new IllegalArgumentException("Path predicate must be relative: " + query);
      }
    }

    @Override
    public String toString() {
      Step first = query.steps().get(0);
      boolean bareSelf =
          first.type() == StepType.AXIS
              && first.axis() == Axis.SELF
              && first.matchesAnyNode()
              && first.predicates().isEmpty();
      if (!bareSelf) {
        return query.toString();
      }
      List<Step> rest = query.steps().subList(1, query.steps().size());
      return rest.isEmpty() ? "." : "." + new Query(true, rest);
    }
  }

  // === Attribute and flag vocabularies ===

  /** Attribute names understood by {@link AttributePredicate}. */
  public static final class Attributes {
    public static final String NAME = "name";
    public static final String TYPE = "type";
    public static final String CONTAINS = "contains";
    public static final String MATCHES = "matches";
    public static final String LANGUAGE = "language";
    public static final String MODIFIERS = "modifiers";
    public static final String RETURNS = "returns";

    public static final Set<String> KNOWN =
        Set.of(NAME, TYPE, CONTAINS, MATCHES, LANGUAGE, MODIFIERS, RETURNS);

    private Attributes() {}
  }

  /** Bare words inside brackets that denote modifier flags rather than names. */
  public static final Set<String> FLAGS =
      Set.of(
          "async", "public", "private", "protected", "internal", "static", "abstract", "virtual",
          "override", "sealed", "readonly", "const", "extern", "partial");
}
