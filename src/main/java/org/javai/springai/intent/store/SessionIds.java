package org.javai.springai.intent.store;

import java.util.Map;
import java.util.regex.Pattern;
import org.javai.springai.intent.ConversationException;
import org.javai.springai.intent.ErrorCode;

/**
 * Session id format: 1 to {@value #MAX_LENGTH} characters from {@code [A-Za-z0-9_-]}.
 * Canonical UUIDs satisfy the format.
 */
public final class SessionIds {

	public static final int MAX_LENGTH = 100;

	private static final Pattern VALID = Pattern.compile("[A-Za-z0-9_-]+");

	private SessionIds() {
	}

	/**
	 * Returns {@code sessionId} unchanged if it is well formed.
	 *
	 * @throws ConversationException with {@link ErrorCode#INVALID_SESSION_ID} otherwise
	 */
	public static String requireValid(String sessionId) {
		if (sessionId == null || sessionId.isBlank()) {
			throw new ConversationException(ErrorCode.INVALID_SESSION_ID, "Session ID cannot be empty");
		}
		if (sessionId.length() > MAX_LENGTH) {
			throw new ConversationException(ErrorCode.INVALID_SESSION_ID,
					"Session ID exceeds maximum length of " + MAX_LENGTH + " characters",
					Map.of("length", sessionId.length(), "max_length", MAX_LENGTH), null);
		}
		if (!VALID.matcher(sessionId).matches()) {
			throw new ConversationException(ErrorCode.INVALID_SESSION_ID,
					"Session ID must be a UUID or alphanumeric with hyphens/underscores",
					Map.of("session_id", sessionId), null);
		}
		return sessionId;
	}
}
