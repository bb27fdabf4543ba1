package org.javai.springai.intent.classify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.javai.springai.intent.IntentCategory;

/**
 * Immutable keyword snapshot used by the {@link FallbackClassifier}.
 *
 * <p>Iteration order of {@link #keywords()} is the priority order used to break
 * ties. Keywords are stored lower-cased ({@link Locale#ROOT}). A table is never
 * mutated; a new version replaces it through {@link KeywordTableRegistry}.</p>
 *
 * @param version monotonically increasing snapshot version
 * @param keywords category to ordered keyword list, in priority order
 * @param defaultCategory category used when nothing matches
 */
public record KeywordTable(
		long version,
		Map<IntentCategory, List<String>> keywords,
		IntentCategory defaultCategory
) {

	public KeywordTable {
		if (version < 0) {
			throw new IllegalArgumentException("version must be >= 0");
		}
		if (defaultCategory == null || !defaultCategory.isKnown()) {
			throw new IllegalArgumentException("defaultCategory must be a known intent category");
		}
		Objects.requireNonNull(keywords, "keywords must not be null");
		Map<IntentCategory, List<String>> copy = new LinkedHashMap<>();
		keywords.forEach((category, words) -> {
			if (category == null || !category.isKnown()) {
				throw new IllegalArgumentException("keyword table contains an unknown category");
			}
			List<String> normalized = new ArrayList<>();
			for (String word : words) {
				if (word == null || word.isEmpty()) {
					throw new IllegalArgumentException("keywords for " + category.wireName() + " must not be empty");
				}
				normalized.add(word.toLowerCase(Locale.ROOT));
			}
			copy.put(category, List.copyOf(normalized));
		});
		keywords = Collections.unmodifiableMap(copy);
	}

	/**
	 * Version 1 of the built-in table, default category {@code general_chat}.
	 */
	public static KeywordTable defaults() {
		return builder()
				.version(1)
				.category(IntentCategory.GREETING,
						"hello", "hi ", "hi!", "hi,", "hey", "good morning", "good afternoon", "good evening", "greetings")
				.category(IntentCategory.GOODBYE,
						"goodbye", "bye", "see you", "farewell", "take care")
				.category(IntentCategory.CLARIFICATION,
						"what do you mean", "explain", "clarify", "example", "elaborate", "in other words", "simpler")
				.category(IntentCategory.TASK_REQUEST,
						"please", "could you", "help me", "create", "write", "generate", "set up")
				.category(IntentCategory.INFORMATION_SEEKING,
						"tell me about", "information on", "information about", "learn about", "looking for", "details on")
				.category(IntentCategory.QUESTION_ANSWERING,
						"what is", "who is", "when did", "where is", "why", "how do", "?")
				.defaultCategory(IntentCategory.GENERAL_CHAT)
				.build();
	}

	/**
	 * Copy of this table under a new version number.
	 */
	public KeywordTable withVersion(long newVersion) {
		return new KeywordTable(newVersion, keywords, defaultCategory);
	}

	public static Builder builder() {
		return new Builder();
	}

	public static final class Builder {
		private long version = 1;
		private final Map<IntentCategory, List<String>> keywords = new LinkedHashMap<>();
		private IntentCategory defaultCategory = IntentCategory.GENERAL_CHAT;

		private Builder() {
		}

		public Builder version(long version) {
			this.version = version;
			return this;
		}

		/**
		 * Adds a category after those already added; earlier categories win ties.
		 */
		public Builder category(IntentCategory category, String... words) {
			return category(category, List.of(words));
		}

		public Builder category(IntentCategory category, List<String> words) {
			this.keywords.put(category, List.copyOf(words));
			return this;
		}

		public Builder defaultCategory(IntentCategory defaultCategory) {
			this.defaultCategory = defaultCategory;
			return this;
		}

		public KeywordTable build() {
			return new KeywordTable(version, keywords, defaultCategory);
		}
	}
}
