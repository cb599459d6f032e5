package io.spelunk.session;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Capacity-bounded store of markers. When the store is full, creation fails with {@link
 * MarkerCapacityExceededException}; markers are never evicted implicitly.
 *
 * <p>All operations synchronize on the lock passed at construction, so a store can share one lock
 * with the other registries of its session.
 */
public final class MarkerStore {

  private static final Logger LOG = LoggerFactory.getLogger(MarkerStore.class);

  public static final int DEFAULT_CAPACITY = 100;
  static final String ID_PREFIX = "mark-";

  private final Object lock;
  private final int capacity;
  private final Clock clock;
  private final Map<String, MarkerRecord> markers = new LinkedHashMap<>();
  private int nextId = 1;

  public MarkerStore() {
    this(DEFAULT_CAPACITY);
  }

  public MarkerStore(int capacity) {
    this(capacity, new Object(), Clock.systemUTC());
  }

  MarkerStore(int capacity, Object lock, Clock clock) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
    this.lock = Objects.requireNonNull(lock, "lock");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Creates an unattached marker.
   *
   * @param label optional label
   * @return the new marker id
   * @throws MarkerCapacityExceededException if {@link #capacity()} markers are already active
   */
  public String createMarker(String label) {
    synchronized (lock) {
      return create(label, null).markerId();
    }
  }

  /**
   * Attaches a marker to a node, replacing any previous attachment.
   *
   * @throws IllegalArgumentException if no marker has the given id
   */
  public MarkerRecord attach(String markerId, NodeReference reference) {
    Objects.requireNonNull(reference, "reference");
    synchronized (lock) {
      MarkerRecord existing = markers.get(markerId);
      if (existing == null) {
        throw new IllegalArgumentException("Marker not found: " + markerId);
      }
      MarkerRecord updated = existing.withReference(reference);
      markers.put(markerId, updated);
      LOG.debug("Attached marker {} to {}", markerId, reference.structuralPath());
      return updated;
    }
  }

  /** Creates a marker already attached to {@code reference}. */
  public MarkerRecord mark(String label, NodeReference reference) {
    Objects.requireNonNull(reference, "reference");
    synchronized (lock) {
      return create(label, reference);
    }
  }

  public Optional<MarkerRecord> get(String markerId) {
    synchronized (lock) {
      return Optional.ofNullable(markers.get(markerId));
    }
  }

  /**
   * Finds markers in creation order.
   *
   * @param markerId only this marker, or null for any
   * @param file only markers attached to nodes of this file, or null for any
   */
  public List<MarkerRecord> find(String markerId, String file) {
    synchronized (lock) {
      List<MarkerRecord> result = new ArrayList<>();
      for (MarkerRecord m : markers.values()) {
        if (markerId != null && !markerId.equals(m.markerId())) {
          continue;
        }
        if (file != null && (m.reference() == null || !file.equals(m.reference().file()))) {
          continue;
        }
        result.add(m);
      }
      return result;
    }
  }

  public boolean remove(String markerId) {
    synchronized (lock) {
      boolean removed = markers.remove(markerId) != null;
      if (removed) {
        LOG.debug("Removed marker {}", markerId);
      }
      return removed;
    }
  }

  /** Removes every marker and restarts id numbering. Returns the number removed. */
  public int clearAll() {
    synchronized (lock) {
      int count = markers.size();
      markers.clear();
      nextId = 1;
      LOG.info("Cleared {} markers", count);
      return count;
    }
  }

  public int size() {
    synchronized (lock) {
      return markers.size();
    }
  }

  public boolean hasCapacity() {
    synchronized (lock) {
      return markers.size() < capacity;
    }
  }

  public int capacity() {
    return capacity;
  }

  private MarkerRecord create(String label, NodeReference reference) {
    if (markers.size() >= capacity) {
      throw new MarkerCapacityExceededException(capacity);
    }
    String id = ID_PREFIX + nextId++;
    MarkerRecord record = new MarkerRecord(id, label, clock.instant(), reference);
    markers.put(id, record);
    LOG.debug("Created marker {} ({})", id, label);
    return record;
  }
}
