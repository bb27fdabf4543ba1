package org.javai.springai.intent.classify;

import java.util.Map;
import org.javai.springai.intent.ConversationException;
import org.javai.springai.intent.ErrorCode;

/**
 * Classification could not produce any result, not even a fallback one.
 * The input that could not be classified is preserved.
 */
public class ClassificationFailedException extends ConversationException {

	private final String rawInput;

	public ClassificationFailedException(String rawInput, Throwable cause) {
		super(ErrorCode.CLASSIFICATION_FAILED,
				"Intent classification failed" + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""),
				rawInput != null ? Map.of("raw_input", rawInput) : Map.of(), cause);
		this.rawInput = rawInput;
	}

	public String rawInput() {
		return rawInput;
	}
}
