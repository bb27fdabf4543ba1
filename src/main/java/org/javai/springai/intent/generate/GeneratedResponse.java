package org.javai.springai.intent.generate;

import java.util.Map;
import java.util.Objects;

/**
 * Answer produced for one turn.
 *
 * @param content the answer text
 * @param degraded true when the oracle failed and a canned answer was used
 * @param usage token usage reported by the oracle, empty when degraded
 * @param modelId model that answered, null when degraded or unreported
 */
public record GeneratedResponse(String content, boolean degraded, Map<String, Object> usage, String modelId) {

	public GeneratedResponse {
		Objects.requireNonNull(content, "content must not be null");
		usage = usage != null ? Map.copyOf(usage) : Map.of();
	}

	public static GeneratedResponse degraded(String content) {
		return new GeneratedResponse(content, true, Map.of(), null);
	}
}
