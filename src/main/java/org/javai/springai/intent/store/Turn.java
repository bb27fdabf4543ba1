package org.javai.springai.intent.store;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.javai.springai.intent.IntentCategory;
import org.javai.springai.intent.IntentResult;

/**
 * One message within a session.
 *
 * <p>A turn handed to {@link SessionStore#append(String, Turn)} has no sequence
 * number yet ({@link #UNASSIGNED}); the store assigns one and stamps the creation
 * time. Turns read back from the store are immutable.</p>
 *
 * @param sequence position within the session, or {@link #UNASSIGNED}
 * @param role who wrote the turn
 * @param content message text
 * @param intent detected category for human turns, null for assistant turns
 * @param confidence classification confidence for human turns, may be null
 * @param metadata opaque key-value data (entities, reasoning, degraded flag, ...)
 * @param createdAt commit time, null until stored
 */
public record Turn(
		long sequence,
		Role role,
		String content,
		IntentCategory intent,
		Double confidence,
		Map<String, Object> metadata,
		Instant createdAt
) {

	public static final long UNASSIGNED = 0L;

	public Turn {
		Objects.requireNonNull(role, "role must not be null");
		Objects.requireNonNull(content, "content must not be null");
		if (sequence < 0) {
			throw new IllegalArgumentException("sequence must be >= 0");
		}
		if (role == Role.ASSISTANT && intent != null) {
			throw new IllegalArgumentException("assistant turns carry no intent");
		}
		if (intent == IntentCategory.UNKNOWN) {
			throw new IllegalArgumentException("intent must be a known category");
		}
		if (confidence != null && (confidence < 0.0 || confidence > 1.0)) {
			throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got " + confidence);
		}
		metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
	}

	/**
	 * A human turn annotated with its classification.
	 */
	public static Turn human(String content, IntentResult intent) {
		Objects.requireNonNull(intent, "intent must not be null");
		return new Turn(UNASSIGNED, Role.HUMAN, content, intent.category(), intent.confidence(),
				intent.toTurnMetadata(), null);
	}

	/**
	 * A human turn without classification data.
	 */
	public static Turn human(String content) {
		return new Turn(UNASSIGNED, Role.HUMAN, content, null, null, Map.of(), null);
	}

	public static Turn assistant(String content, Map<String, Object> metadata) {
		return new Turn(UNASSIGNED, Role.ASSISTANT, content, null, null, metadata, null);
	}

	public static Turn assistant(String content) {
		return assistant(content, Map.of());
	}

	/**
	 * Copy stamped with the store-assigned sequence number and commit time.
	 */
	public Turn committedAs(long assignedSequence, Instant committedAt) {
		if (assignedSequence < 1) {
			throw new IllegalArgumentException("assigned sequence must be >= 1");
		}
		return new Turn(assignedSequence, role, content, intent, confidence, metadata, committedAt);
	}

	public boolean isCommitted() {
		return sequence != UNASSIGNED;
	}
}
