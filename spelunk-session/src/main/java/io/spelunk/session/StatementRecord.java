package io.spelunk.session;

/**
 * A registered statement.
 *
 * @param id id of the form {@code stmt-N}
 * @param reference the statement node
 * @param file containing file, may be null
 * @param sessionId id of the owning session, may be null
 */
public record StatementRecord(String id, NodeReference reference, String file, String sessionId) {}
