package io.spelunk.syntax.api;

/**
 * Location of a node in its source file. Offsets are 0-based and end-exclusive; line and column are
 * 1-based.
 */
public record SourceSpan(int startOffset, int endOffset, int startLine, int startColumn) {

  /** Span used for synthetic nodes that have no source location. */
  public static final SourceSpan NONE = new SourceSpan(0, 0, 0, 0);

  public SourceSpan {
    if (startOffset < 0 || endOffset < startOffset) {
      throw new IllegalArgumentException(
          "Invalid offsets: [" + startOffset + ", " + endOffset + ")");
    }
  }

  public static SourceSpan at(int line, int column) {
    return new SourceSpan(0, 0, line, column);
  }

  public int length() {
    return endOffset - startOffset;
  }

  @Override
  public String toString() {
    return startLine + ":" + startColumn;
  }
}
