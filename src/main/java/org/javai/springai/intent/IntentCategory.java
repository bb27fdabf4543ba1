package org.javai.springai.intent;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Closed set of intent categories.
 *
 * <p>{@link #UNKNOWN} is never a classification outcome. It is what
 * {@link #fromWireName(String)} yields for a name outside the set, and it always
 * sends the classifier down the fallback path.</p>
 */
public enum IntentCategory {

	GENERAL_CHAT("general_chat", "Casual conversation and small talk"),
	QUESTION_ANSWERING("question_answering", "Direct factual questions seeking specific answers"),
	TASK_REQUEST("task_request", "Requests to perform specific actions or tasks"),
	INFORMATION_SEEKING("information_seeking", "Looking for information on particular topics"),
	CLARIFICATION("clarification", "Asking for clarification or explanation of previous content"),
	GREETING("greeting", "Greetings, introductions, and conversation starters"),
	GOODBYE("goodbye", "Farewells, conversation endings, and sign-offs"),
	UNKNOWN("unknown", "Not a member of the category set");

	private final String wireName;
	private final String description;

	IntentCategory(String wireName, String description) {
		this.wireName = wireName;
		this.description = description;
	}

	public String wireName() {
		return wireName;
	}

	public String description() {
		return description;
	}

	public boolean isKnown() {
		return this != UNKNOWN;
	}

	/**
	 * Resolves a wire name (case-insensitive, surrounding whitespace ignored).
	 *
	 * @return the matching category, or {@link #UNKNOWN}
	 */
	public static IntentCategory fromWireName(String name) {
		if (name == null) {
			return UNKNOWN;
		}
		String normalized = name.trim().toLowerCase(Locale.ROOT);
		for (IntentCategory category : values()) {
			if (category.isKnown() && category.wireName.equals(normalized)) {
				return category;
			}
		}
		return UNKNOWN;
	}

	/**
	 * All categories except {@link #UNKNOWN}, in declaration order.
	 */
	public static List<IntentCategory> knownValues() {
		return Arrays.stream(values()).filter(IntentCategory::isKnown).toList();
	}
}
