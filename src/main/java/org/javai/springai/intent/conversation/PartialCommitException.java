package org.javai.springai.intent.conversation;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.javai.springai.intent.ConversationException;
import org.javai.springai.intent.ErrorCode;
import org.javai.springai.intent.store.Role;

/**
 * The human turn was stored but the matching assistant turn could not be.
 *
 * <p>The stored human turn stays in the history; this exception records
 * which turn is missing so callers can detect and repair the gap.</p>
 */
public class PartialCommitException extends ConversationException {

	private final String sessionId;
	private final long committedSequence;
	private final Role missingRole;

	public PartialCommitException(String sessionId, long committedSequence, Role missingRole, Throwable cause) {
		super(ErrorCode.PARTIAL_COMMIT,
				"Turn " + committedSequence + " of session '" + sessionId + "' was stored without its "
						+ missingRole.name().toLowerCase(Locale.ROOT) + " reply",
				details(sessionId, committedSequence, missingRole), cause);
		this.sessionId = sessionId;
		this.committedSequence = committedSequence;
		this.missingRole = missingRole;
	}

	public String sessionId() {
		return sessionId;
	}

	public long committedSequence() {
		return committedSequence;
	}

	public Role missingRole() {
		return missingRole;
	}

	private static Map<String, Object> details(String sessionId, long committedSequence, Role missingRole) {
		Map<String, Object> details = new LinkedHashMap<>();
		details.put("session_id", sessionId);
		details.put("committed_sequence", committedSequence);
		details.put("missing_role", missingRole.name());
		return details;
	}
}
