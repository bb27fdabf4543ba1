package org.javai.springai.intent.store;

import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.springai.intent.ConversationException;
import org.javai.springai.intent.ErrorCode;

/**
 * A storage-layer failure: I/O, lock timeout, corruption.
 *
 * <p>{@link #isTransient()} marks failures worth retrying (busy database,
 * lock contention). Everything else is treated as permanent.</p>
 */
public class StorageException extends ConversationException {

	private final String operation;
	private final boolean transientFailure;

	public StorageException(String message, String operation, String sessionId, boolean transientFailure,
			Throwable cause) {
		super(ErrorCode.STORAGE_ERROR, message, details(operation, sessionId, transientFailure), cause);
		this.operation = operation;
		this.transientFailure = transientFailure;
	}

	public StorageException(String message, String operation, boolean transientFailure) {
		this(message, operation, null, transientFailure, null);
	}

	public String operation() {
		return operation;
	}

	public boolean isTransient() {
		return transientFailure;
	}

	private static Map<String, Object> details(String operation, String sessionId, boolean transientFailure) {
		Map<String, Object> details = new LinkedHashMap<>();
		details.put("operation", operation);
		details.put("session_id", sessionId);
		details.put("transient", transientFailure);
		return details;
	}
}
