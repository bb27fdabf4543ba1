package org.javai.springai.intent.generate;

import java.util.EnumMap;
import java.util.Map;
import org.javai.springai.intent.IntentCategory;

/**
 * Canned answers used when the oracle cannot produce one.
 */
public final class DegradedResponses {

	static final String GENERIC = "I'm here to help! Could you tell me more about what you're looking for?";

	private static final Map<IntentCategory, String> RESPONSES = new EnumMap<>(IntentCategory.class);

	static {
		RESPONSES.put(IntentCategory.GENERAL_CHAT,
				"I'd be happy to chat! Could you tell me more about what's on your mind?");
		RESPONSES.put(IntentCategory.QUESTION_ANSWERING,
				"I'd like to help answer your question, but I'm having trouble processing it right now. Could you rephrase it?");
		RESPONSES.put(IntentCategory.TASK_REQUEST,
				"I understand you're looking for assistance with a task. Let me know more details about what you need help with.");
		RESPONSES.put(IntentCategory.INFORMATION_SEEKING,
				"I'd be glad to help you find information. What specific topic are you interested in?");
		RESPONSES.put(IntentCategory.CLARIFICATION,
				"I want to make sure I give you a clear explanation. Could you help me understand what specifically needs clarification?");
		RESPONSES.put(IntentCategory.GREETING,
				"Hello! It's great to meet you. How can I help you today?");
		RESPONSES.put(IntentCategory.GOODBYE,
				"Thank you for our conversation! Feel free to reach out anytime you need assistance.");
	}

	private DegradedResponses() {
	}

	public static String forCategory(IntentCategory category) {
		return RESPONSES.getOrDefault(category, GENERIC);
	}
}
