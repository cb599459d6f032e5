package io.spelunk.session;

import io.spelunk.path.StablePathBuilder;
import io.spelunk.syntax.api.SyntaxNode;
import io.spelunk.syntax.api.SyntaxTreeSnapshot;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Re-attaches {@link NodeReference}s to the nodes of a (possibly newer) snapshot. */
public final class NodeLocator {

  private static final Logger LOG = LoggerFactory.getLogger(NodeLocator.class);

  /**
   * Walks the reference's structural path in {@code snapshot}.
   *
   * @return the node, or empty if the snapshot belongs to another file, the path no longer exists,
   *     or the node found there has a different type tag
   */
  public Optional<SyntaxNode> resolve(NodeReference reference, SyntaxTreeSnapshot snapshot) {
    Objects.requireNonNull(reference, "reference");
    Objects.requireNonNull(snapshot, "snapshot");
    if (reference.file() != null
        && snapshot.file() != null
        && !reference.file().equals(snapshot.file())) {
      LOG.debug(
          "Reference to {} cannot resolve against snapshot of {}",
          reference.file(),
          snapshot.file());
      return Optional.empty();
    }
    Optional<SyntaxNode> node =
        StablePathBuilder.resolveStructuralPath(snapshot.root(), reference.structuralPath())
            .filter(n -> n.typeTag().equalsIgnoreCase(reference.typeTag()));
    if (node.isEmpty()) {
      LOG.debug(
          "Reference {} not resolvable in snapshot {}",
          reference.structuralPath(),
          snapshot.id());
    }
    return node;
  }
}
