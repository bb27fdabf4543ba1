package org.javai.springai.intent.oracle;

import java.util.Map;

/**
 * Raw oracle answer.
 *
 * @param content the text the model produced
 * @param usage token usage reported by the provider (prompt, completion, total)
 * @param modelId model that answered, if reported
 */
public record OracleResponse(String content, Map<String, Object> usage, String modelId) {

	public OracleResponse {
		content = content != null ? content : "";
		usage = usage != null ? Map.copyOf(usage) : Map.of();
	}

	public static OracleResponse of(String content) {
		return new OracleResponse(content, Map.of(), null);
	}
}
