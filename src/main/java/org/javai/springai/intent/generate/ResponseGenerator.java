package org.javai.springai.intent.generate;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.javai.springai.intent.IntentCategory;
import org.javai.springai.intent.IntentResult;
import org.javai.springai.intent.oracle.LanguageOracle;
import org.javai.springai.intent.oracle.OracleOptions;
import org.javai.springai.intent.oracle.OracleProtocolException;
import org.javai.springai.intent.oracle.OracleRequest;
import org.javai.springai.intent.oracle.OracleResponse;
import org.javai.springai.intent.oracle.OracleUnavailableException;
import org.javai.springai.intent.store.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces the assistant's answer, conditioned on the detected intent and the
 * context window.
 *
 * <p>Failures are not absorbed here: callers decide whether to degrade.</p>
 */
public class ResponseGenerator {

	private static final Logger logger = LoggerFactory.getLogger(ResponseGenerator.class);

	private static final String BASE_PROMPT = """
			You are a helpful AI assistant engaged in a natural conversation. You maintain context from previous messages and provide thoughtful, relevant responses.

			CONVERSATION GUIDELINES:
			- Be conversational and engaging
			- Reference previous context when relevant
			- Ask clarifying questions when needed
			- Provide helpful and accurate information
			- Maintain a friendly, professional tone
			- Stay focused on the user's intent
			""";

	private static final Map<IntentCategory, String> GUIDANCE = new EnumMap<>(IntentCategory.class);

	static {
		GUIDANCE.put(IntentCategory.GENERAL_CHAT,
				"Engage in natural conversation. Be friendly and show interest in what the user is sharing.");
		GUIDANCE.put(IntentCategory.QUESTION_ANSWERING,
				"Provide clear, accurate answers. If you're unsure, say so and suggest alternatives.");
		GUIDANCE.put(IntentCategory.TASK_REQUEST,
				"Acknowledge the task request. Explain what you understand and discuss next steps.");
		GUIDANCE.put(IntentCategory.INFORMATION_SEEKING,
				"Provide helpful information on the requested topic. Be thorough but concise.");
		GUIDANCE.put(IntentCategory.CLARIFICATION,
				"Provide clear explanations and examples. Reference the conversation context appropriately.");
		GUIDANCE.put(IntentCategory.GREETING,
				"Respond warmly to greetings. Set a positive tone for the conversation.");
		GUIDANCE.put(IntentCategory.GOODBYE,
				"Acknowledge farewells appropriately. Offer to help again in the future.");
	}

	private final LanguageOracle oracle;
	private final OracleOptions options;

	/**
	 * @param oracle the oracle to ask, or null to always fail with {@link OracleUnavailableException}
	 * @param options sampling parameters for answers
	 */
	public ResponseGenerator(LanguageOracle oracle, OracleOptions options) {
		this.oracle = oracle;
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	/**
	 * @throws OracleUnavailableException if no oracle is configured or the call fails
	 * @throws OracleProtocolException if the oracle returns an unusable answer
	 */
	public GeneratedResponse generate(String text, IntentResult intent, List<Turn> history) {
		if (oracle == null) {
			throw new OracleUnavailableException("No oracle configured for response generation", null);
		}
		String systemPrompt = systemPrompt(intent);
		logger.debug("Generating {} response with {} history turn(s)", intent.category().wireName(),
				history != null ? history.size() : 0);
		OracleResponse response = oracle.complete(new OracleRequest(systemPrompt, history, text, options));
		if (response.content().isBlank()) {
			throw new OracleProtocolException("Oracle returned an empty answer", response.content());
		}
		return new GeneratedResponse(response.content().strip(), false, response.usage(), response.modelId());
	}

	/**
	 * Base conversation guidance plus the guidance for the detected intent.
	 */
	public static String systemPrompt(IntentResult intent) {
		StringBuilder sb = new StringBuilder(BASE_PROMPT);
		sb.append("\nSPECIFIC GUIDANCE: ").append(GUIDANCE.getOrDefault(intent.category(),
				"Respond appropriately to the user's message with consideration for their intent."));
		if (intent.contextDependent()) {
			sb.append("\n\nIMPORTANT: This message depends on previous conversation context. Review the conversation history carefully.");
		}
		if (intent.followUpNeeded()) {
			sb.append("\n\nNOTE: The user's intent may need clarification. Consider asking follow-up questions.");
		}
		sb.append("\n\nINTENT DETECTED: ").append(intent.category().wireName())
				.append(String.format(Locale.ROOT, " (confidence: %.2f)", intent.confidence()));
		if (!intent.reasoning().isBlank()) {
			sb.append("\nREASONING: ").append(intent.reasoning());
		}
		return sb.toString();
	}
}
