package org.javai.springai.intent.classify;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.javai.springai.intent.IntentCategory;
import org.javai.springai.intent.IntentResult;

/**
 * Deterministic keyword classifier used whenever the oracle cannot be trusted.
 *
 * <p>Matching is a case-insensitive substring search. The category whose first
 * matching keyword occurs earliest in the text wins; equal positions go to the
 * category listed first in the table. No I/O, no clock, no randomness.</p>
 */
public class FallbackClassifier {

	/**
	 * Confidence of a keyword match. Deliberately below the default threshold of 0.7.
	 */
	public static final double FALLBACK_CONFIDENCE = 0.6;

	/**
	 * Confidence when no keyword matches.
	 */
	public static final double MIN_CONFIDENCE = 0.0;

	private final KeywordTableRegistry registry;

	public FallbackClassifier(KeywordTableRegistry registry) {
		this.registry = Objects.requireNonNull(registry, "registry must not be null");
	}

	public FallbackClassifier() {
		this(KeywordTableRegistry.withDefaults());
	}

	/**
	 * Classifies against the registry's current table.
	 */
	public IntentResult classify(String text) {
		return classify(text, registry.current());
	}

	/**
	 * Classifies against an explicit table snapshot.
	 */
	public IntentResult classify(String text, KeywordTable table) {
		Objects.requireNonNull(table, "table must not be null");
		String haystack = text != null ? text.toLowerCase(Locale.ROOT) : "";

		IntentCategory best = null;
		String bestKeyword = null;
		int bestIndex = Integer.MAX_VALUE;
		for (Map.Entry<IntentCategory, List<String>> entry : table.keywords().entrySet()) {
			for (String keyword : entry.getValue()) {
				int index = haystack.indexOf(keyword);
				// strict comparison keeps the earlier category on ties
				if (index >= 0 && index < bestIndex) {
					bestIndex = index;
					best = entry.getKey();
					bestKeyword = keyword;
				}
			}
		}

		if (best == null) {
			return IntentResult.fallback(table.defaultCategory(), MIN_CONFIDENCE,
					"Fallback classification: no keyword matched, defaulting to " + table.defaultCategory().wireName());
		}
		return IntentResult.fallback(best, FALLBACK_CONFIDENCE,
				"Fallback classification: matched keyword '" + bestKeyword.strip() + "'");
	}

	public KeywordTableRegistry registry() {
		return registry;
	}
}
