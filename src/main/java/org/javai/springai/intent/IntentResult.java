package org.javai.springai.intent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of classifying one human utterance.
 *
 * <p>{@link Source} tells callers where the answer came from. An oracle answer
 * below the confidence threshold is still an oracle answer; it is flagged with
 * {@code lowConfidence} rather than replaced.</p>
 *
 * @param category the detected category, never {@link IntentCategory#UNKNOWN}
 * @param confidence confidence in [0.0, 1.0]
 * @param reasoning advisory, human-readable explanation
 * @param entities extracted entities (opaque)
 * @param followUpNeeded whether the intent likely needs a follow-up question
 * @param contextDependent whether the meaning depends on prior turns
 * @param suggestedActions optional hints for the answering step
 * @param source oracle or fallback
 * @param lowConfidence true when an oracle answer fell below the threshold
 * @param modelId model reported by the oracle (null for fallback results)
 * @param processingTimeMillis time spent classifying
 */
public record IntentResult(
		IntentCategory category,
		double confidence,
		String reasoning,
		Map<String, Object> entities,
		boolean followUpNeeded,
		boolean contextDependent,
		List<String> suggestedActions,
		Source source,
		boolean lowConfidence,
		String modelId,
		long processingTimeMillis
) {

	/**
	 * Where a classification came from.
	 */
	public enum Source {
		ORACLE,
		FALLBACK
	}

	public IntentResult {
		if (category == null || !category.isKnown()) {
			throw new IllegalArgumentException("category must be a known intent category");
		}
		if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
			throw new IllegalArgumentException("confidence must be between 0.0 and 1.0, got " + confidence);
		}
		if (source == null) {
			throw new IllegalArgumentException("source must not be null");
		}
		reasoning = reasoning != null ? reasoning : "";
		entities = entities != null ? Collections.unmodifiableMap(new LinkedHashMap<>(entities)) : Map.of();
		suggestedActions = suggestedActions != null ? List.copyOf(suggestedActions) : List.of();
		if (processingTimeMillis < 0) {
			processingTimeMillis = 0;
		}
	}

	/**
	 * Creates a fallback result with no entities or hints.
	 */
	public static IntentResult fallback(IntentCategory category, double confidence, String reasoning) {
		return new IntentResult(category, confidence, reasoning, Map.of(), false, false, List.of(),
				Source.FALLBACK, false, null, 0);
	}

	public boolean isFallback() {
		return source == Source.FALLBACK;
	}

	public IntentResult withContextDependent(boolean dependent) {
		return new IntentResult(category, confidence, reasoning, entities, followUpNeeded, dependent,
				suggestedActions, source, lowConfidence, modelId, processingTimeMillis);
	}

	public IntentResult withProcessingTime(long millis) {
		return new IntentResult(category, confidence, reasoning, entities, followUpNeeded, contextDependent,
				suggestedActions, source, lowConfidence, modelId, millis);
	}

	/**
	 * Flattens the result into the metadata stored with a human turn.
	 */
	public Map<String, Object> toTurnMetadata() {
		Map<String, Object> metadata = new LinkedHashMap<>();
		metadata.put("reasoning", reasoning);
		metadata.put("entities", entities);
		metadata.put("follow_up_needed", followUpNeeded);
		metadata.put("context_dependent", contextDependent);
		metadata.put("suggested_actions", suggestedActions);
		metadata.put("source", source.name());
		metadata.put("low_confidence", lowConfidence);
		if (modelId != null) {
			metadata.put("model_id", modelId);
		}
		metadata.put("processing_time_ms", processingTimeMillis);
		return metadata;
	}
}
