package org.javai.springai.intent.store;

import java.util.List;
import java.util.Optional;

/**
 * Durable persistence of turns, keyed by session id.
 *
 * <p>Implementations serialize appends to the same session and let appends to
 * different sessions proceed independently. Every failure surfaces as a
 * {@link StorageException}; a failed append leaves nothing visible.</p>
 */
public interface SessionStore {

	/**
	 * Appends a turn, creating the session on first write, and applies retention.
	 *
	 * @return the sequence number assigned to the turn
	 */
	long append(String sessionId, Turn turn);

	/**
	 * Up to {@code limit} most recent turns, oldest first. Empty for unknown sessions.
	 */
	List<Turn> readRecent(String sessionId, int limit);

	/**
	 * Every retained turn of the session, oldest first.
	 */
	List<Turn> history(String sessionId);

	/**
	 * All sessions, most recently active first.
	 */
	List<SessionInfo> listSessions();

	Optional<SessionInfo> findSession(String sessionId);

	/**
	 * Removes the session and its turns. A no-op for unknown sessions.
	 */
	void deleteSession(String sessionId);

	/**
	 * Removes the turns but keeps the session record. Sequence numbers are not reused.
	 */
	void clearSession(String sessionId);

	StoreSummary summary();
}
