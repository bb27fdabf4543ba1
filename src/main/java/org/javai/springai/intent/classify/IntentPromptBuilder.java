package org.javai.springai.intent.classify;

import java.util.List;
import java.util.Set;
import java.util.StringJoiner;
import org.javai.springai.intent.IntentCategory;
import org.javai.springai.intent.store.Role;
import org.javai.springai.intent.store.Turn;

/**
 * Builds the prompts sent to the oracle for intent classification.
 */
public final class IntentPromptBuilder {

	static final int CONTEXT_PREVIEW_LENGTH = 100;

	private IntentPromptBuilder() {
	}

	/**
	 * System prompt listing the allowed categories, the JSON answer format and a few examples.
	 * Categories are listed in declaration order.
	 */
	public static String systemPrompt(Set<IntentCategory> categories) {
		StringBuilder sb = new StringBuilder();
		sb.append("You are an expert intent analysis system. Analyze user input and determine their intent with high accuracy.\n\n");

		sb.append("INTENT CATEGORIES:\n");
		for (IntentCategory category : IntentCategory.knownValues()) {
			if (categories.contains(category)) {
				sb.append("- ").append(category.wireName()).append(": ").append(category.description()).append("\n");
			}
		}

		sb.append("""

				RESPONSE FORMAT:
				Respond with ONLY a valid JSON object in this exact format:
				{
				    "category": "intent_category",
				    "confidence": 0.85,
				    "reasoning": "Clear explanation of why this intent was chosen",
				    "entities": {"key": "value"},
				    "follow_up_needed": false,
				    "context_dependent": false,
				    "suggested_actions": ["action1", "action2"]
				}

				GUIDELINES:
				- Use only the categories listed above
				- Higher confidence for clear, specific requests
				- Lower confidence for ambiguous or unclear input
				- Extract all relevant entities mentioned
				- Set context_dependent when the input only makes sense given earlier turns

				EXAMPLES:

				Input: "Hello there!"
				Output: {"category": "greeting", "confidence": 0.95, "reasoning": "Clear greeting with friendly tone", "entities": {}, "follow_up_needed": false, "context_dependent": false, "suggested_actions": ["respond_warmly", "ask_how_to_help"]}

				Input: "What's the weather like?"
				Output: {"category": "information_seeking", "confidence": 0.90, "reasoning": "Direct request for weather information", "entities": {"topic": "weather"}, "follow_up_needed": true, "context_dependent": false, "suggested_actions": ["ask_location", "provide_weather_info"]}

				Input: "Can you explain what we discussed earlier?"
				Output: {"category": "clarification", "confidence": 0.88, "reasoning": "Request for clarification about previous conversation", "entities": {"reference": "earlier discussion"}, "follow_up_needed": false, "context_dependent": true, "suggested_actions": ["review_context", "summarize_previous"]}
				""");
		return sb.toString();
	}

	/**
	 * One-line summary of the last {@code maxTurns} turns, each truncated to
	 * {@value #CONTEXT_PREVIEW_LENGTH} characters. Empty when there is no context.
	 */
	public static String contextSummary(List<Turn> context, int maxTurns) {
		if (context == null || context.isEmpty() || maxTurns <= 0) {
			return "";
		}
		List<Turn> tail = context.subList(Math.max(0, context.size() - maxTurns), context.size());
		StringJoiner joiner = new StringJoiner(" | ");
		for (Turn turn : tail) {
			String speaker = turn.role() == Role.HUMAN ? "User" : "Assistant";
			String content = turn.content();
			String preview = content.length() > CONTEXT_PREVIEW_LENGTH
					? content.substring(0, CONTEXT_PREVIEW_LENGTH) + "..."
					: content;
			joiner.add(speaker + ": " + preview);
		}
		return joiner.toString();
	}

	/**
	 * System prompt with the context summary appended, if there is one.
	 */
	public static String systemPromptWithContext(Set<IntentCategory> categories, List<Turn> context, int maxTurns) {
		String summary = contextSummary(context, maxTurns);
		String prompt = systemPrompt(categories);
		return summary.isEmpty() ? prompt : prompt + "\nCONVERSATION CONTEXT: " + summary + "\n";
	}

	public static String userMessage(String text) {
		return "ANALYZE THIS INPUT: " + text;
	}
}
