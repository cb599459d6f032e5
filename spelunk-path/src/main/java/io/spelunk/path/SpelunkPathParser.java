package io.spelunk.path;

import io.spelunk.path.SpelunkPath.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Recursive descent parser for the SpelunkPath query language.
 *
 * <p>Grammar (simplified):
 *
 * <pre>
 * path       := ('/' | '//')? step (('/' | '//') step)*
 * step       := ('..' | '.' | (axis '::')? node_test) ('[' or_expr ']')*
 * node_test  := identifier | '*'
 * or_expr    := and_expr ('or' and_expr)*
 * and_expr   := not_expr ('and' not_expr)*
 * not_expr   := 'not' not_expr | primary
 * primary    := '(' or_expr ')' | '@' identifier (op value)? | number
 *             | 'first()' | 'last()' ('-' number)? | string | name_pattern | rel_path
 * rel_path   := ('.' | '..') (('/' | '//') step)*
 * op         := '=' | '!=' | '~='
 * </pre>
 */
public final class SpelunkPathParser {

  private final String input;
  private final ParseOptions options;
  private int pos;

  private SpelunkPathParser(String input, ParseOptions options) {
    this.input = input;
    this.options = options;
    this.pos = 0;
  }

  /**
   * Parses a path expression with lenient attribute handling.
   *
   * @param input the path string
   * @return parsed Query object
   * @throws SpelunkPathParseException if parsing fails
   */
  public static Query parse(String input) {
    return parse(input, ParseOptions.lenient());
  }

  /**
   * Parses a path expression.
   *
   * @param input the path string
   * @param options parser options
   * @return parsed Query object
   * @throws SpelunkPathParseException if parsing fails
   */
  public static Query parse(String input, ParseOptions options) {
    Objects.requireNonNull(options, "options");
    if (input == null || input.isBlank()) {
      throw new SpelunkPathParseException("Empty path");
    }
    return new SpelunkPathParser(input.trim(), options).parseQuery();
  }

  private Query parseQuery() {
    boolean absolute = false;
    StepType pending = StepType.CHILD;

    if (match("//")) {
      absolute = true;
      pending = StepType.DESCENDANT;
    } else if (match("/")) {
      absolute = true;
    }

    List<Step> steps = parseSteps(pending, false);
    return new Query(absolute, steps);
  }

  /**
   * Parses separator-joined steps. A nested path (inside a predicate) ends at the first character
   * that is not a separator; a top-level path must consume the whole input.
   */
  private List<Step> parseSteps(StepType first, boolean nested) {
    List<Step> steps = new ArrayList<>();
    StepType pending = first;
    while (true) {
      skipWs();
      if (isAtEnd()) {
        throw new SpelunkPathParseException("Expected step", pos);
      }
      steps.add(parseStep(pending));
      skipWs();
      if (match("//")) {
        pending = StepType.DESCENDANT;
      } else if (match("/")) {
        pending = StepType.CHILD;
      } else if (nested || isAtEnd()) {
        return steps;
      } else {
        throw new SpelunkPathParseException("Unexpected '" + peek() + "'", pos);
      }
    }
  }

  private Step parseStep(StepType separatorType) {
    int start = pos;
    StepType type = separatorType;
    Axis axis = null;
    String nodeTest;

    if (match("..")) {
      if (separatorType == StepType.DESCENDANT) {
        throw new SpelunkPathParseException("'..' cannot follow '//'", start);
      }
      type = StepType.PARENT;
      nodeTest = null;
    } else if (peek() == '.' && !isIdentifierStart(peekAt(1))) {
      advance();
      type = StepType.AXIS;
      axis = separatorType == StepType.DESCENDANT ? Axis.DESCENDANT_OR_SELF : Axis.SELF;
      nodeTest = null;
    } else if (peek() == '*') {
      advance();
      nodeTest = "*";
    } else if (isIdentifierStart(peek())) {
      String name = parseIdentifier();
      if (match("::")) {
        if (separatorType == StepType.DESCENDANT) {
          throw new SpelunkPathParseException(
              "Axis step '" + name + "::' cannot follow '//'", start);
        }
        switch (name) {
          case "child" -> type = StepType.CHILD;
          case "descendant" -> type = StepType.DESCENDANT;
          case "parent" -> type = StepType.PARENT;
          default -> {
            axis = Axis.fromName(name);
            if (axis == null) {
              throw new SpelunkPathParseException("Unknown axis '" + name + "'", start);
            }
            type = StepType.AXIS;
          }
        }
        nodeTest = parseNodeTest(name);
      } else {
        nodeTest = name;
      }
    } else {
      throw new SpelunkPathParseException("Expected node test, found '" + peek() + "'", pos);
    }

    List<Predicate> predicates = new ArrayList<>();
    skipWs();
    while (peek() == '[') {
      int open = pos;
      advance();
      skipWs();
      if (peek() == ']') {
        throw new SpelunkPathParseException("Empty predicate", open);
      }
      predicates.add(parseOrExpr());
      skipWs();
      if (isAtEnd()) {
        throw new SpelunkPathParseException("Unclosed '['", open);
      }
      expect(']');
      skipWs();
    }
    return new Step(type, axis, nodeTest, predicates);
  }

  private String parseNodeTest(String axisName) {
    if (peek() == '*') {
      advance();
      return "*";
    }
    if (!isIdentifierStart(peek())) {
      throw new SpelunkPathParseException("Expected node test after '" + axisName + "::'", pos);
    }
    return parseIdentifier();
  }

  // === Predicates ===

  private Predicate parseOrExpr() {
    Predicate left = parseAndExpr();
    while (true) {
      skipWs();
      if (matchKeyword("or")) {
        Predicate right = parseAndExpr();
        left = new CompoundPredicate(LogicalOp.OR, left, right);
      } else {
        return left;
      }
    }
  }

  private Predicate parseAndExpr() {
    Predicate left = parseNotExpr();
    while (true) {
      skipWs();
      if (matchKeyword("and")) {
        Predicate right = parseNotExpr();
        left = new CompoundPredicate(LogicalOp.AND, left, right);
      } else {
        return left;
      }
    }
  }

  private Predicate parseNotExpr() {
    skipWs();
    if (matchKeyword("not")) {
      skipWs();
      return new NotPredicate(parseNotExpr());
    }
    return parsePrimary();
  }

  private Predicate parsePrimary() {
    skipWs();
    char c = peek();
    if (c == '(') {
      int open = pos;
      advance();
      Predicate inner = parseOrExpr();
      skipWs();
      if (peek() != ')') {
        throw new SpelunkPathParseException("Unclosed '('", open);
      }
      advance();
      return inner;
    }
    if (c == '@') {
      advance();
      return parseAttribute();
    }
    if (startsRelativePath()) {
      return new PathPredicate(new Query(false, parseSteps(StepType.CHILD, true)));
    }
    if (Character.isDigit(c)) {
      return PositionPredicate.index(parseInt());
    }
    if (c == '\'' || c == '"') {
      String name = parseStringLiteral();
      return new NamePredicate(name, WildcardMatcher.hasWildcard(name));
    }
    if (isPatternChar(c)) {
      int start = pos;
      String word = parsePattern();
      skipWs();
      if (peek() == '(') {
        return parseFunction(word, start);
      }
      String lower = word.toLowerCase(Locale.ROOT);
      if (SpelunkPath.FLAGS.contains(lower)) {
        return new BooleanPredicate(lower);
      }
      return new NamePredicate(word, WildcardMatcher.hasWildcard(word));
    }
    if (isAtEnd()) {
      throw new SpelunkPathParseException("Unexpected end of path inside predicate", pos);
    }
    throw new SpelunkPathParseException("Unexpected '" + c + "' in predicate", pos);
  }

  private Predicate parseFunction(String name, int start) {
    expect('(');
    expect(')');
    return switch (name) {
      case "first" -> PositionPredicate.index(1);
      case "last" -> {
        skipWs();
        if (peek() != '-') {
          yield PositionPredicate.last(0);
        }
        advance();
        skipWs();
        if (!Character.isDigit(peek())) {
          throw new SpelunkPathParseException("Expected number after 'last()-'", pos);
        }
        yield PositionPredicate.last(parseInt());
      }
      default -> throw new SpelunkPathParseException("Unknown function '" + name + "()'", start);
    };
  }

  private Predicate parseAttribute() {
    int start = pos;
    if (!isIdentifierStart(peek())) {
      throw new SpelunkPathParseException("Expected attribute name after '@'", pos);
    }
    String name = parseIdentifier().toLowerCase(Locale.ROOT);
    skipWs();
    AttrOp op = parseOp();
    if (op == null) {
      if (options.strictAttributes()
          && !SpelunkPath.FLAGS.contains(name)
          && !Attributes.KNOWN.contains(name)) {
        throw new SpelunkPathParseException("Unknown flag '@" + name + "'", start);
      }
      return new BooleanPredicate(name);
    }
    skipWs();
    int valuePos = pos;
    String value = parseValue(op);

    if (Attributes.NAME.equals(name)) {
      return switch (op) {
        case EQ -> new NamePredicate(value, WildcardMatcher.hasWildcard(value));
        case NE -> new NotPredicate(new NamePredicate(value, WildcardMatcher.hasWildcard(value)));
        case CONTAINS -> new NamePredicate("*" + value + "*", true);
      };
    }
    if (Attributes.MATCHES.equals(name)) {
      try {
        return new AttributePredicate(name, op, value, Pattern.compile(value));
      } catch (PatternSyntaxException e) {
        throw new SpelunkPathParseException(
            "Invalid pattern '" + value + "': " + e.getDescription(), valuePos, e);
      }
    }
    if (options.strictAttributes() && !Attributes.KNOWN.contains(name)) {
      throw new SpelunkPathParseException("Unknown attribute '@" + name + "'", start);
    }
    return new AttributePredicate(name, op, value);
  }

  private AttrOp parseOp() {
    if (match("!=")) {
      return AttrOp.NE;
    }
    if (match("~=")) {
      return AttrOp.CONTAINS;
    }
    if (match("=")) {
      return AttrOp.EQ;
    }
    return null;
  }

  private String parseValue(AttrOp op) {
    char c = peek();
    if (c == '\'' || c == '"') {
      return parseStringLiteral();
    }
    int start = pos;
    while (!isAtEnd() && !Character.isWhitespace(peek()) && peek() != ']' && peek() != ')') {
      pos++;
    }
    if (pos == start) {
      throw new SpelunkPathParseException("Expected value after '" + op.symbol() + "'", start);
    }
    return input.substring(start, pos);
  }

  // === Lexical helpers ===

  /** {@code .} or {@code ..} alone or before a separator. A name such as {@code .ctor} is not. */
  private boolean startsRelativePath() {
    if (peek() != '.') {
      return false;
    }
    int next = peekAt(1) == '.' ? 2 : 1;
    char c = peekAt(next);
    return c == '\0' || c == '/' || c == ']' || c == ')' || c == '[' || Character.isWhitespace(c);
  }

  private String parseIdentifier() {
    int start = pos;
    while (!isAtEnd()) {
      char c = peek();
      if (Character.isLetterOrDigit(c) || c == '_') {
        pos++;
      } else if (c == '-' && pos > start && isIdentifierStart(peekAt(1))) {
        pos++;
      } else {
        break;
      }
    }
    if (pos == start) {
      throw new SpelunkPathParseException("Expected identifier", pos);
    }
    return input.substring(start, pos);
  }

  private String parsePattern() {
    int start = pos;
    while (!isAtEnd() && isPatternChar(peek())) {
      pos++;
    }
    return input.substring(start, pos);
  }

  private String parseStringLiteral() {
    char quote = advance();
    int start = pos - 1;
    StringBuilder sb = new StringBuilder();
    while (!isAtEnd() && peek() != quote) {
      char c = advance();
      if (c == '\\' && !isAtEnd()) {
        sb.append(advance());
      } else {
        sb.append(c);
      }
    }
    if (isAtEnd()) {
      throw new SpelunkPathParseException("Unterminated string literal", start);
    }
    advance();
    return sb.toString();
  }

  private int parseInt() {
    int start = pos;
    while (!isAtEnd() && Character.isDigit(peek())) {
      pos++;
    }
    try {
      return Integer.parseInt(input.substring(start, pos));
    } catch (NumberFormatException e) {
      throw new SpelunkPathParseException("Invalid number", start, e);
    }
  }

  private static boolean isIdentifierStart(char c) {
    return Character.isLetter(c) || c == '_';
  }

  private static boolean isPatternChar(char c) {
    return Character.isLetterOrDigit(c)
        || c == '_'
        || c == '*'
        || c == '?'
        || c == '.'
        || c == '-'
        || c == '<'
        || c == '>'
        || c == '`';
  }

  private char peek() {
    return isAtEnd() ? '\0' : input.charAt(pos);
  }

  private char peekAt(int offset) {
    int i = pos + offset;
    return i < input.length() ? input.charAt(i) : '\0';
  }

  private char advance() {
    return input.charAt(pos++);
  }

  private boolean isAtEnd() {
    return pos >= input.length();
  }

  private void skipWs() {
    while (!isAtEnd() && Character.isWhitespace(peek())) {
      pos++;
    }
  }

  private boolean match(String expected) {
    if (input.startsWith(expected, pos)) {
      pos += expected.length();
      return true;
    }
    return false;
  }

  private boolean matchKeyword(String keyword) {
    if (input.startsWith(keyword, pos)) {
      int endPos = pos + keyword.length();
      // Ensure it's not part of a longer name
      if (endPos >= input.length() || !isPatternChar(input.charAt(endPos))) {
        pos = endPos;
        return true;
      }
    }
    return false;
  }

  private void expect(char c) {
    skipWs();
    if (peek() != c) {
      throw new SpelunkPathParseException(
          "Expected '" + c + "', found '" + (isAtEnd() ? "end of path" : peek()) + "'", pos);
    }
    advance();
  }
}
