package io.spelunk.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manages query sessions.
 *
 * <p>Thread-safe registry for opening, tracking, and closing sessions. Sessions are identified by
 * unique integer IDs and optional aliases. Each session owns its own markers and statement
 * registry, so independent clients never see each other's ids.
 */
public final class SessionRegistry {

  private static final Logger LOG = LoggerFactory.getLogger(SessionRegistry.class);

  private final SpelunkConfig config;
  private final Clock clock;
  private final AtomicInteger nextId = new AtomicInteger(1);
  private final Map<String, SessionContext> sessionsById = new LinkedHashMap<>();
  private final Map<String, String> idsByAlias = new HashMap<>();
  private String currentSessionId = null;

  public SessionRegistry() {
    this(SpelunkConfig.defaults());
  }

  public SessionRegistry(SpelunkConfig config) {
    this(config, Clock.systemUTC());
  }

  public SessionRegistry(SpelunkConfig config, Clock clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Opens a new session.
   *
   * @param alias Optional alias for the session
   * @return the opened session, which also becomes the current one
   * @throws IllegalArgumentException if the alias is already in use
   */
  public synchronized SessionContext open(String alias) {
    // Validate alias uniqueness
    if (alias != null && !alias.isBlank()) {
      if (idsByAlias.containsKey(alias)) {
        throw new IllegalArgumentException("Alias already in use: " + alias);
      }
      if (isNumeric(alias)) {
        throw new IllegalArgumentException("Alias must not be numeric: " + alias);
      }
    } else {
      alias = null; // Normalize empty to null
    }

    String id = Integer.toString(nextId.getAndIncrement());
    SessionContext session = new SessionContext(id, alias, config, clock);
    sessionsById.put(id, session);
    if (alias != null) {
      idsByAlias.put(alias, id);
    }
    currentSessionId = id;

    LOG.info("Opened session {}{}", id, alias != null ? " (" + alias + ")" : "");
    return session;
  }

  /**
   * Gets a session by ID or alias.
   *
   * @param idOrAlias Session ID or alias
   * @return The session, or empty if not found
   */
  public synchronized Optional<SessionContext> get(String idOrAlias) {
    if (idOrAlias == null || idOrAlias.isBlank()) {
      return Optional.empty();
    }
    SessionContext byId = sessionsById.get(idOrAlias);
    if (byId != null) {
      return Optional.of(byId);
    }
    String id = idsByAlias.get(idOrAlias);
    return id == null ? Optional.empty() : Optional.ofNullable(sessionsById.get(id));
  }

  /**
   * Gets the current (most recently opened) session.
   *
   * @return The current session, or empty if none
   */
  public synchronized Optional<SessionContext> getCurrent() {
    if (currentSessionId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(sessionsById.get(currentSessionId));
  }

  /**
   * Gets a session, defaulting to current if not specified.
   *
   * @param idOrAlias Session ID/alias, or null to use current
   * @return The session
   * @throws IllegalArgumentException if session not found or no current session
   */
  public synchronized SessionContext getOrCurrent(String idOrAlias) {
    if (idOrAlias == null || idOrAlias.isBlank()) {
      return getCurrent().orElseThrow(() -> new IllegalArgumentException("No session open"));
    }
    return get(idOrAlias)
        .orElseThrow(() -> new IllegalArgumentException("Session not found: " + idOrAlias));
  }

  /** Lists all open sessions in opening order. */
  public synchronized List<SessionContext> list() {
    return new ArrayList<>(sessionsById.values());
  }

  /**
   * Closes a session by ID or alias, dropping its markers and statements.
   *
   * @return true if session was closed, false if not found
   */
  public synchronized boolean close(String idOrAlias) {
    Optional<SessionContext> session = get(idOrAlias);
    if (session.isEmpty()) {
      return false;
    }
    closeSession(session.get());
    LOG.info("Closed session {}", session.get().id());
    return true;
  }

  /** Closes all open sessions. */
  public synchronized void closeAll() {
    LOG.info("Closing {} sessions", sessionsById.size());
    for (SessionContext session : new ArrayList<>(sessionsById.values())) {
      closeSession(session);
    }
  }

  /**
   * Closes every session idle for longer than {@code maxIdle}. Intended to be called periodically
   * by the host. Each idle check and close runs under the session's own lock, so it cannot
   * interleave with a request mutating that session.
   *
   * @return number of sessions evicted
   */
  public synchronized int evictIdle(Duration maxIdle) {
    Objects.requireNonNull(maxIdle, "maxIdle");
    Instant cutoff = clock.instant().minus(maxIdle);
    int evicted = 0;
    for (SessionContext session : new ArrayList<>(sessionsById.values())) {
      synchronized (session.lock()) {
        if (session.lastAccess().isBefore(cutoff)) {
          closeSession(session);
          evicted++;
          LOG.info("Evicted idle session {} (last access {})", session.id(), session.lastAccess());
        }
      }
    }
    return evicted;
  }

  private void closeSession(SessionContext session) {
    sessionsById.remove(session.id());
    if (session.alias() != null) {
      idsByAlias.remove(session.alias());
    }
    session.clear();

    // Update current session
    if (session.id().equals(currentSessionId)) {
      currentSessionId = sessionsById.isEmpty() ? null : sessionsById.keySet().iterator().next();
    }
  }

  /** Returns the number of open sessions. */
  public synchronized int size() {
    return sessionsById.size();
  }

  /** Checks if there are any open sessions. */
  public synchronized boolean isEmpty() {
    return sessionsById.isEmpty();
  }

  private static boolean isNumeric(String s) {
    return !s.isEmpty() && s.chars().allMatch(Character::isDigit);
  }
}
