package io.spelunk.session;

import io.spelunk.syntax.api.SyntaxNode;
import io.spelunk.syntax.api.SyntaxTreeSnapshot;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * State of one client session: markers, registered statements and the latest snapshot of each
 * file. Every mutation synchronizes on {@link #lock()}, which the marker store and statement
 * registry share.
 */
public final class SessionContext {

  private final String id;
  private final String alias;
  private final Instant openedAt;
  private final Clock clock;
  private final Object lock = new Object();
  private final MarkerStore markers;
  private final StatementRegistry statements;
  private final Map<String, SyntaxTreeSnapshot> latestByFile = new HashMap<>();
  private final NodeLocator locator = new NodeLocator();
  private volatile Instant lastAccess;

  SessionContext(String id, String alias, SpelunkConfig config, Clock clock) {
    this.id = Objects.requireNonNull(id, "id");
    this.alias = alias;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.openedAt = clock.instant();
    this.lastAccess = openedAt;
    this.markers = new MarkerStore(config.markerCapacity(), lock, clock);
    this.statements = new StatementRegistry(config.statementCapacity(), lock);
  }

  /** Creates a standalone session, not tracked by any {@link SessionRegistry}. */
  public static SessionContext create(String id, SpelunkConfig config) {
    return new SessionContext(id, null, config, Clock.systemUTC());
  }

  public String id() {
    return id;
  }

  public String alias() {
    return alias;
  }

  public Instant openedAt() {
    return openedAt;
  }

  public Instant lastAccess() {
    return lastAccess;
  }

  public Duration age() {
    return Duration.between(openedAt, clock.instant());
  }

  /** Records activity on this session. */
  public void touch() {
    lastAccess = clock.instant();
  }

  /** The lock guarding all mutable state of this session. */
  public Object lock() {
    return lock;
  }

  public MarkerStore markers() {
    return markers;
  }

  public StatementRegistry statements() {
    return statements;
  }

  /** Makes {@code snapshot} the latest version of its file. */
  public void updateSnapshot(SyntaxTreeSnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    synchronized (lock) {
      latestByFile.put(snapshot.file(), snapshot);
    }
    touch();
  }

  public Optional<SyntaxTreeSnapshot> latestSnapshot(String file) {
    synchronized (lock) {
      return Optional.ofNullable(latestByFile.get(file));
    }
  }

  /** Resolves a reference against the latest snapshot of its file. */
  public Optional<SyntaxNode> resolve(NodeReference reference) {
    touch();
    return latestSnapshot(reference.file()).flatMap(s -> locator.resolve(reference, s));
  }

  /** Drops all markers, statements and snapshots. */
  void clear() {
    synchronized (lock) {
      markers.clearAll();
      statements.clearAll();
      latestByFile.clear();
    }
  }
}
