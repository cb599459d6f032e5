package io.spelunk.session;

import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of statements materialized by queries, so callers can refer to them again by id.
 *
 * <p>Registration is additive. The registry holds at most {@link #capacity()} entries; beyond that
 * the least recently registered or looked up statement is evicted.
 */
public final class StatementRegistry {

  private static final Logger LOG = LoggerFactory.getLogger(StatementRegistry.class);

  public static final int DEFAULT_CAPACITY = 10_000;
  static final String ID_PREFIX = "stmt-";

  private final Object lock;
  private final LruCache<String, StatementRecord> statements;
  private long nextId = 1;

  public StatementRegistry() {
    this(DEFAULT_CAPACITY);
  }

  public StatementRegistry(int capacity) {
    this(capacity, new Object());
  }

  StatementRegistry(int capacity, Object lock) {
    this.lock = Objects.requireNonNull(lock, "lock");
    this.statements =
        new LruCache<>(capacity, (id, record) -> LOG.debug("Evicted statement {}", id));
  }

  /** Registers a statement and returns its new id. */
  public String register(NodeReference reference, String file, String sessionId) {
    Objects.requireNonNull(reference, "reference");
    synchronized (lock) {
      String id = ID_PREFIX + nextId++;
      statements.put(id, new StatementRecord(id, reference, file, sessionId));
      return id;
    }
  }

  public Optional<StatementRecord> lookup(String id) {
    if (id == null) {
      return Optional.empty();
    }
    synchronized (lock) {
      return Optional.ofNullable(statements.get(id));
    }
  }

  /** Removes every statement. Ids keep increasing so stale ids never alias new statements. */
  public int clearAll() {
    synchronized (lock) {
      int count = statements.size();
      statements.clear();
      LOG.info("Cleared {} statements", count);
      return count;
    }
  }

  public int size() {
    synchronized (lock) {
      return statements.size();
    }
  }

  public int capacity() {
    return statements.maxSize();
  }
}
