package org.javai.springai.intent;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base type for every failure the library reports.
 *
 * <p>Each exception carries a stable {@link ErrorCode} and a small map of details
 * (session id, operation, offending key, ...) that callers can log or show.</p>
 */
public class ConversationException extends RuntimeException {

	private final ErrorCode errorCode;
	private final Map<String, Object> details;

	public ConversationException(ErrorCode errorCode, String message) {
		this(errorCode, message, Map.of(), null);
	}

	public ConversationException(ErrorCode errorCode, String message, Throwable cause) {
		this(errorCode, message, Map.of(), cause);
	}

	public ConversationException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
		super(message, cause);
		this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
		this.details = details != null ? Map.copyOf(withoutNulls(details)) : Map.of();
	}

	public ErrorCode errorCode() {
		return errorCode;
	}

	public Map<String, Object> details() {
		return details;
	}

	@Override
	public String toString() {
		return "[" + errorCode + "] " + getMessage();
	}

	private static Map<String, Object> withoutNulls(Map<String, Object> source) {
		Map<String, Object> copy = new LinkedHashMap<>();
		source.forEach((key, value) -> {
			if (key != null && value != null) {
				copy.put(key, value);
			}
		});
		return copy;
	}
}
