package org.javai.springai.intent.oracle;

import java.util.Map;
import org.javai.springai.intent.ConversationException;
import org.javai.springai.intent.ErrorCode;

/**
 * Common parent of oracle failures. Never fatal: the classifier falls back and
 * the orchestrator degrades.
 */
public abstract class OracleException extends ConversationException {

	protected OracleException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
		super(errorCode, message, details, cause);
	}
}
