package io.spelunk.session;

import io.spelunk.path.StablePathBuilder;
import io.spelunk.syntax.api.SyntaxNode;
import io.spelunk.syntax.api.SyntaxTreeSnapshot;
import java.util.Objects;

/**
 * Snapshot-independent handle to a node: the snapshot it was taken from plus the node's structural
 * path. Re-resolve it with {@link NodeLocator} instead of holding raw node handles across edits.
 *
 * @param snapshotId id of the snapshot the reference was taken from
 * @param file file of that snapshot, may be null
 * @param structuralPath structural path of the node within the snapshot
 * @param typeTag type tag of the node, checked on re-resolution
 */
public record NodeReference(String snapshotId, String file, String structuralPath, String typeTag) {

  public NodeReference {
    Objects.requireNonNull(snapshotId, "snapshotId");
    Objects.requireNonNull(structuralPath, "structuralPath");
    Objects.requireNonNull(typeTag, "typeTag");
  }

  /** Creates a reference to {@code node}, which must belong to {@code snapshot}. */
  public static NodeReference of(SyntaxTreeSnapshot snapshot, SyntaxNode node) {
    return new NodeReference(
        snapshot.id(),
        snapshot.file(),
        StablePathBuilder.buildStructuralPath(node),
        node.typeTag());
  }
}
