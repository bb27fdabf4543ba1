package org.javai.springai.intent.store;

import java.time.Instant;
import java.util.Objects;

/**
 * Registry entry for one session.
 *
 * @param id caller-chosen session identifier
 * @param createdAt first write to the session
 * @param lastActivityAt most recent append or clear
 * @param retentionLimit turns the session retains
 * @param turnCount turns currently stored
 */
public record SessionInfo(
		String id,
		Instant createdAt,
		Instant lastActivityAt,
		int retentionLimit,
		int turnCount
) {

	public SessionInfo {
		Objects.requireNonNull(id, "id must not be null");
	}
}
