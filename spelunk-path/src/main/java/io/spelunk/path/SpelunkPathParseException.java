package io.spelunk.path;

/** Exception thrown when a SpelunkPath expression is malformed. */
public final class SpelunkPathParseException extends RuntimeException {

  private final int position;

  public SpelunkPathParseException(String message) {
    this(message, -1);
  }

  public SpelunkPathParseException(String message, int position) {
    super(position >= 0 ? message + " at position " + position : message);
    this.position = position;
  }

  public SpelunkPathParseException(String message, int position, Throwable cause) {
    super(position >= 0 ? message + " at position " + position : message, cause);
    this.position = position;
  }

  /** Returns the 0-based input position of the error, or -1 if unknown. */
  public int position() {
    return position;
  }
}
