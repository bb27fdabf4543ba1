package org.javai.springai.intent.classify;

import java.util.List;
import java.util.Set;
import org.javai.springai.intent.IntentCategory;
import org.javai.springai.intent.IntentResult;
import org.javai.springai.intent.config.ConfigurationException;
import org.javai.springai.intent.config.ConversationConfig;
import org.javai.springai.intent.oracle.LanguageOracle;
import org.javai.springai.intent.oracle.OracleException;
import org.javai.springai.intent.oracle.OracleRequest;
import org.javai.springai.intent.oracle.OracleResponse;
import org.javai.springai.intent.store.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps an utterance plus its context window to an {@link IntentResult}.
 *
 * <p>The oracle is asked first. Its answer is used when it parses and names a
 * configured category; an answer below the confidence threshold is returned
 * with {@code lowConfidence} set. Every other outcome (oracle unreachable,
 * timed out, malformed answer, unknown category) is answered by the
 * {@link FallbackClassifier} using the current keyword snapshot.</p>
 *
 * <p>Without an oracle every call goes straight to the fallback.</p>
 */
public class IntentClassifier {

	private static final Logger logger = LoggerFactory.getLogger(IntentClassifier.class);

	private final LanguageOracle oracle;
	private final FallbackClassifier fallback;
	private final IntentResponseParser parser;
	private final ConversationConfig config;

	/**
	 * @param oracle the oracle to consult, or null for fallback-only classification
	 * @param fallback keyword classifier used when the oracle cannot be trusted
	 * @param config categories, threshold and oracle options
	 * @throws ConfigurationException if a required collaborator or setting is missing
	 */
	public IntentClassifier(LanguageOracle oracle, FallbackClassifier fallback, ConversationConfig config) {
		this(oracle, fallback, new IntentResponseParser(), config);
	}

	public IntentClassifier(LanguageOracle oracle, FallbackClassifier fallback, IntentResponseParser parser,
			ConversationConfig config) {
		if (config == null) {
			throw ConfigurationException.missing("intent");
		}
		if (fallback == null) {
			throw ConfigurationException.missing("keywords");
		}
		if (parser == null) {
			throw ConfigurationException.missing("intent.parser");
		}
		IntentCategory tableDefault = fallback.registry().current().defaultCategory();
		if (!config.categories().contains(tableDefault)) {
			throw ConfigurationException.invalid("keywords.default_category", "one of the configured categories",
					tableDefault.wireName());
		}
		this.oracle = oracle;
		this.fallback = fallback;
		this.parser = parser;
		this.config = config;
	}

	/**
	 * Classifier that never consults an oracle.
	 */
	public static IntentClassifier fallbackOnly(FallbackClassifier fallback, ConversationConfig config) {
		return new IntentClassifier(null, fallback, config);
	}

	/**
	 * Classifies {@code text} in the light of {@code contextWindow} (oldest turn first).
	 *
	 * @throws ClassificationFailedException if even the fallback cannot classify the text
	 */
	public IntentResult classify(String text, List<Turn> contextWindow) {
		long start = System.nanoTime();
		List<Turn> context = contextWindow != null ? contextWindow : List.of();

		if (oracle == null) {
			return fallback(text, context, start);
		}

		try {
			OracleRequest request = new OracleRequest(
					IntentPromptBuilder.systemPromptWithContext(config.categories(), context,
							config.classificationContextTurns()),
					List.of(),
					IntentPromptBuilder.userMessage(text),
					config.intentOptions());
			OracleResponse response = oracle.complete(request);
			IntentResponseParser.ParsedIntent parsed = parser.parse(response.content());

			if (!parsed.category().isKnown() || !config.categories().contains(parsed.category())) {
				logger.warn("Oracle returned category '{}' outside the configured set; using fallback", parsed.rawCategory());
				return fallback(text, context, start);
			}

			boolean lowConfidence = parsed.confidence() < config.confidenceThreshold();
			if (lowConfidence) {
				logger.info("Low-confidence classification: {} ({} < {})",
						parsed.category().wireName(), parsed.confidence(), config.confidenceThreshold());
			}
			IntentResult result = new IntentResult(
					parsed.category(),
					parsed.confidence(),
					parsed.reasoning(),
					parsed.entities(),
					parsed.followUpNeeded(),
					parsed.contextDependent(),
					parsed.suggestedActions(),
					IntentResult.Source.ORACLE,
					lowConfidence,
					response.modelId(),
					elapsedMillis(start));
			logger.debug("Intent classified: {} (confidence: {})", result.category().wireName(), result.confidence());
			return result;
		} catch (OracleException e) {
			logger.warn("Oracle classification failed [{}]: {}; using fallback", e.errorCode(), e.getMessage());
			return fallback(text, context, start);
		}
	}

	public Set<IntentCategory> categories() {
		return config.categories();
	}

	public boolean hasOracle() {
		return oracle != null;
	}

	private IntentResult fallback(String text, List<Turn> context, long start) {
		IntentResult result;
		try {
			result = fallback.classify(text);
		} catch (RuntimeException e) {
			throw new ClassificationFailedException(text, e);
		}
		if (!config.categories().contains(result.category())) {
			result = IntentResult.fallback(config.defaultCategory(), FallbackClassifier.MIN_CONFIDENCE,
					"Fallback classification: " + result.category().wireName()
							+ " is not configured, defaulting to " + config.defaultCategory().wireName());
		}
		if (result.category() == IntentCategory.CLARIFICATION && !context.isEmpty()) {
			result = result.withContextDependent(true);
		}
		return result.withProcessingTime(elapsedMillis(start));
	}

	private static long elapsedMillis(long startNanos) {
		return (System.nanoTime() - startNanos) / 1_000_000;
	}
}
