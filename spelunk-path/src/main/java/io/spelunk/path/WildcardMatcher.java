package io.spelunk.path;

import java.util.regex.Pattern;

/**
 * Glob-style name matching: {@code *} matches any run of characters, {@code ?} exactly one.
 * Wildcard patterns compare case-insensitively; patterns without wildcards compare exactly.
 */
public final class WildcardMatcher {

  private WildcardMatcher() {}

  public static boolean hasWildcard(String pattern) {
    return pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0;
  }

  /**
   * Matches {@code text} against {@code pattern}.
   *
   * @param pattern the pattern, possibly containing {@code *} and {@code ?}
   * @param text the text to test; null never matches
   */
  public static boolean matches(String pattern, String text) {
    if (text == null) {
      return false;
    }
    if (!hasWildcard(pattern)) {
      return pattern.equals(text);
    }
    return toRegex(pattern).matcher(text).matches();
  }

  /** Like {@link #matches} but case-insensitive even without wildcards. */
  public static boolean matchesIgnoreCase(String pattern, String text) {
    if (text == null) {
      return false;
    }
    if (!hasWildcard(pattern)) {
      return pattern.equalsIgnoreCase(text);
    }
    return toRegex(pattern).matcher(text).matches();
  }

  static Pattern toRegex(String pattern) {
    StringBuilder regex = new StringBuilder(pattern.length() + 8);
    StringBuilder literal = new StringBuilder();
    for (int i = 0; i < pattern.length(); i++) {
      char c = pattern.charAt(i);
      if (c == '*' || c == '?') {
        if (literal.length() > 0) {
          regex.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        regex.append(c == '*' ? ".*" : ".");
      } else {
        literal.append(c);
      }
    }
    if (literal.length() > 0) {
      regex.append(Pattern.quote(literal.toString()));
    }
    return Pattern.compile(
        regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
  }
}
