package io.spelunk.syntax.api;

import java.util.Objects;
import java.util.UUID;

/**
 * One immutable version of the syntax tree of a file. A node handle is only meaningful together
 * with the snapshot it was obtained from.
 */
public record SyntaxTreeSnapshot(String id, String file, SyntaxNode root) {

  public SyntaxTreeSnapshot {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(root, "root");
  }

  /** Creates a snapshot with a freshly generated id. */
  public static SyntaxTreeSnapshot of(String file, SyntaxNode root) {
    return new SyntaxTreeSnapshot(UUID.randomUUID().toString(), file, root);
  }
}
