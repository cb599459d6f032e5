package io.spelunk.session;

/** Thrown when a marker is created while the marker store is full. */
public final class MarkerCapacityExceededException extends RuntimeException {

  private final int capacity;

  public MarkerCapacityExceededException(int capacity) {
    super(
        "Marker capacity exceeded: "
            + capacity
            + " markers are active. Remove or clear markers first.");
    this.capacity = capacity;
  }

  public int capacity() {
    return capacity;
  }
}
