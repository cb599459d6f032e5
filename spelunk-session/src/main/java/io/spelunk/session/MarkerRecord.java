package io.spelunk.session;

import java.time.Instant;

/**
 * An active marker.
 *
 * @param markerId id of the form {@code mark-N}
 * @param label optional caller-supplied label
 * @param createdAt creation time
 * @param reference the marked node, null until attached
 */
public record MarkerRecord(
    String markerId, String label, Instant createdAt, NodeReference reference) {

  public boolean isAttached() {
    return reference != null;
  }

  MarkerRecord withReference(NodeReference newReference) {
    return new MarkerRecord(markerId, label, createdAt, newReference);
  }
}
