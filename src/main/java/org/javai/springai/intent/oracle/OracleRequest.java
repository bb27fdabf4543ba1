package org.javai.springai.intent.oracle;

import java.util.List;
import java.util.Objects;
import org.javai.springai.intent.store.Turn;

/**
 * Input for one oracle call.
 *
 * @param systemPrompt instructions for the model, may be empty
 * @param history prior turns sent as chat messages, oldest first
 * @param userText the utterance being handled
 * @param options sampling parameters
 */
public record OracleRequest(
		String systemPrompt,
		List<Turn> history,
		String userText,
		OracleOptions options
) {

	public OracleRequest {
		systemPrompt = systemPrompt != null ? systemPrompt : "";
		history = history != null ? List.copyOf(history) : List.of();
		Objects.requireNonNull(userText, "userText must not be null");
		options = options != null ? options : OracleOptions.defaults();
	}
}
