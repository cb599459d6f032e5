package io.spelunk.path;

/**
 * Parser options.
 *
 * @param strictAttributes reject unknown attribute names at parse time instead of letting them
 *     evaluate to no match
 */
public record ParseOptions(boolean strictAttributes) {

  private static final ParseOptions LENIENT = new ParseOptions(false);
  private static final ParseOptions STRICT = new ParseOptions(true);

  public static ParseOptions lenient() {
    return LENIENT;
  }

  public static ParseOptions strict() {
    return STRICT;
  }
}
