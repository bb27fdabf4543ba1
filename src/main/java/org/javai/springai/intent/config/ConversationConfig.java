package org.javai.springai.intent.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import org.javai.springai.intent.IntentCategory;
import org.javai.springai.intent.context.ContextBudget;
import org.javai.springai.intent.oracle.OracleOptions;
import org.javai.springai.intent.store.RetentionPolicy;

/**
 * Settings for classification, history retention, context selection and commit behaviour.
 *
 * <p>Immutable and validated on construction; an invalid value raises a
 * {@link ConfigurationException} naming the offending key.</p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Use defaults
 * ConversationConfig config = ConversationConfig.defaults();
 *
 * // Custom configuration
 * ConversationConfig config = ConversationConfig.builder()
 *         .confidenceThreshold(0.8)
 *         .maxTurnsPerSession(50)
 *         .build();
 * }</pre>
 *
 * @param categories categories the classifier may return
 * @param confidenceThreshold oracle answers below this are flagged low confidence
 * @param defaultCategory category used when classification has nothing better
 * @param maxTurnsPerSession retention limit per session
 * @param contextMaxTurns turn budget of the context window
 * @param contextMaxChars character budget of the context window
 * @param classificationContextTurns turns summarized into the classification prompt
 * @param oracleTimeout upper bound on a single oracle call
 * @param commitRetries extra attempts for the assistant turn after the human turn is stored
 * @param retryBackoff pause between commit attempts
 * @param defaultSessionId session used when the caller supplies none
 * @param maxInputLength longest accepted utterance, in characters
 * @param intentTemperature sampling temperature for classification
 * @param intentMaxTokens completion budget for classification
 * @param responseTemperature sampling temperature for answers
 * @param responseMaxTokens completion budget for answers
 * @param storePath SQLite database file
 */
public record ConversationConfig(
		Set<IntentCategory> categories,
		double confidenceThreshold,
		IntentCategory defaultCategory,
		int maxTurnsPerSession,
		int contextMaxTurns,
		int contextMaxChars,
		int classificationContextTurns,
		Duration oracleTimeout,
		int commitRetries,
		Duration retryBackoff,
		String defaultSessionId,
		int maxInputLength,
		double intentTemperature,
		int intentMaxTokens,
		double responseTemperature,
		int responseMaxTokens,
		Path storePath
) {

	public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;
	public static final int DEFAULT_CLASSIFICATION_CONTEXT_TURNS = 6;
	public static final Duration DEFAULT_ORACLE_TIMEOUT = Duration.ofSeconds(30);
	public static final int DEFAULT_COMMIT_RETRIES = 3;
	public static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofMillis(25);
	public static final String DEFAULT_SESSION_ID = "main_session";
	public static final int DEFAULT_MAX_INPUT_LENGTH = 10_000;
	public static final double DEFAULT_INTENT_TEMPERATURE = 0.1;
	public static final int DEFAULT_INTENT_MAX_TOKENS = 500;
	public static final double DEFAULT_RESPONSE_TEMPERATURE = 0.3;
	public static final int DEFAULT_RESPONSE_MAX_TOKENS = 1500;
	public static final Path DEFAULT_STORE_PATH = Path.of("intent_conversations.db");

	public ConversationConfig {
		if (categories == null || categories.isEmpty()) {
			throw ConfigurationException.missing("intent.categories");
		}
		if (categories.contains(IntentCategory.UNKNOWN)) {
			throw ConfigurationException.invalid("intent.categories", "known categories only", categories);
		}
		categories = Set.copyOf(categories);
		if (Double.isNaN(confidenceThreshold) || confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
			throw ConfigurationException.invalid("intent.confidence_threshold", "a value in [0.0, 1.0]", confidenceThreshold);
		}
		if (defaultCategory == null) {
			throw ConfigurationException.missing("intent.default_category");
		}
		if (!categories.contains(defaultCategory)) {
			throw ConfigurationException.invalid("intent.default_category", "one of the configured categories",
					defaultCategory.wireName());
		}
		if (maxTurnsPerSession < 1) {
			throw ConfigurationException.invalid("storage.max_turns_per_session", ">= 1", maxTurnsPerSession);
		}
		if (contextMaxTurns < 0) {
			throw ConfigurationException.invalid("context.max_turns", ">= 0", contextMaxTurns);
		}
		if (contextMaxChars < 0) {
			throw ConfigurationException.invalid("context.max_chars", ">= 0", contextMaxChars);
		}
		if (classificationContextTurns < 0) {
			throw ConfigurationException.invalid("intent.context_turns", ">= 0", classificationContextTurns);
		}
		if (oracleTimeout == null || oracleTimeout.isNegative() || oracleTimeout.isZero()) {
			throw ConfigurationException.invalid("oracle.timeout_ms", "a positive duration", oracleTimeout);
		}
		if (commitRetries < 0) {
			throw ConfigurationException.invalid("conversation.commit_retries", ">= 0", commitRetries);
		}
		if (retryBackoff == null || retryBackoff.isNegative()) {
			throw ConfigurationException.invalid("conversation.retry_backoff_ms", "a non-negative duration", retryBackoff);
		}
		if (defaultSessionId == null || defaultSessionId.isBlank()) {
			throw ConfigurationException.missing("conversation.default_session_id");
		}
		if (maxInputLength < 1) {
			throw ConfigurationException.invalid("conversation.max_input_length", ">= 1", maxInputLength);
		}
		if (intentTemperature < 0.0 || intentTemperature > 2.0) {
			throw ConfigurationException.invalid("intent.temperature", "a value in [0.0, 2.0]", intentTemperature);
		}
		if (intentMaxTokens < 1) {
			throw ConfigurationException.invalid("intent.max_tokens", ">= 1", intentMaxTokens);
		}
		if (responseTemperature < 0.0 || responseTemperature > 2.0) {
			throw ConfigurationException.invalid("response.temperature", "a value in [0.0, 2.0]", responseTemperature);
		}
		if (responseMaxTokens < 1) {
			throw ConfigurationException.invalid("response.max_tokens", ">= 1", responseMaxTokens);
		}
		if (storePath == null) {
			throw ConfigurationException.missing("storage.path");
		}
	}

	/**
	 * Creates a configuration with default values: all known categories, threshold 0.7,
	 * default category {@code general_chat}.
	 */
	public static ConversationConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder pre-populated with this configuration's values.
	 */
	public Builder toBuilder() {
		return new Builder()
				.categories(categories)
				.confidenceThreshold(confidenceThreshold)
				.defaultCategory(defaultCategory)
				.maxTurnsPerSession(maxTurnsPerSession)
				.contextMaxTurns(contextMaxTurns)
				.contextMaxChars(contextMaxChars)
				.classificationContextTurns(classificationContextTurns)
				.oracleTimeout(oracleTimeout)
				.commitRetries(commitRetries)
				.retryBackoff(retryBackoff)
				.defaultSessionId(defaultSessionId)
				.maxInputLength(maxInputLength)
				.intentTemperature(intentTemperature)
				.intentMaxTokens(intentMaxTokens)
				.responseTemperature(responseTemperature)
				.responseMaxTokens(responseMaxTokens)
				.storePath(storePath);
	}

	public RetentionPolicy retentionPolicy() {
		return new RetentionPolicy(maxTurnsPerSession);
	}

	public ContextBudget contextBudget() {
		return new ContextBudget(contextMaxTurns, contextMaxChars);
	}

	public OracleOptions intentOptions() {
		return new OracleOptions(intentTemperature, intentMaxTokens);
	}

	public OracleOptions responseOptions() {
		return new OracleOptions(responseTemperature, responseMaxTokens);
	}

	/**
	 * Builder for {@link ConversationConfig}.
	 */
	public static class Builder {
		private Set<IntentCategory> categories = EnumSet.copyOf(IntentCategory.knownValues());
		private double confidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;
		private IntentCategory defaultCategory = IntentCategory.GENERAL_CHAT;
		private int maxTurnsPerSession = RetentionPolicy.DEFAULT_MAX_TURNS;
		private int contextMaxTurns = ContextBudget.DEFAULT_MAX_TURNS;
		private int contextMaxChars = ContextBudget.DEFAULT_MAX_CHARS;
		private int classificationContextTurns = DEFAULT_CLASSIFICATION_CONTEXT_TURNS;
		private Duration oracleTimeout = DEFAULT_ORACLE_TIMEOUT;
		private int commitRetries = DEFAULT_COMMIT_RETRIES;
		private Duration retryBackoff = DEFAULT_RETRY_BACKOFF;
		private String defaultSessionId = DEFAULT_SESSION_ID;
		private int maxInputLength = DEFAULT_MAX_INPUT_LENGTH;
		private double intentTemperature = DEFAULT_INTENT_TEMPERATURE;
		private int intentMaxTokens = DEFAULT_INTENT_MAX_TOKENS;
		private double responseTemperature = DEFAULT_RESPONSE_TEMPERATURE;
		private int responseMaxTokens = DEFAULT_RESPONSE_MAX_TOKENS;
		private Path storePath = DEFAULT_STORE_PATH;

		private Builder() {}

		public Builder categories(Set<IntentCategory> categories) {
			this.categories = categories;
			return this;
		}

		public Builder confidenceThreshold(double confidenceThreshold) {
			this.confidenceThreshold = confidenceThreshold;
			return this;
		}

		public Builder defaultCategory(IntentCategory defaultCategory) {
			this.defaultCategory = defaultCategory;
			return this;
		}

		/**
		 * Sets the retention limit. Older turns beyond it are evicted after each append.
		 */
		public Builder maxTurnsPerSession(int maxTurnsPerSession) {
			this.maxTurnsPerSession = maxTurnsPerSession;
			return this;
		}

		public Builder contextMaxTurns(int contextMaxTurns) {
			this.contextMaxTurns = contextMaxTurns;
			return this;
		}

		public Builder contextMaxChars(int contextMaxChars) {
			this.contextMaxChars = contextMaxChars;
			return this;
		}

		public Builder classificationContextTurns(int classificationContextTurns) {
			this.classificationContextTurns = classificationContextTurns;
			return this;
		}

		public Builder oracleTimeout(Duration oracleTimeout) {
			this.oracleTimeout = oracleTimeout;
			return this;
		}

		public Builder commitRetries(int commitRetries) {
			this.commitRetries = commitRetries;
			return this;
		}

		public Builder retryBackoff(Duration retryBackoff) {
			this.retryBackoff = retryBackoff;
			return this;
		}

		public Builder defaultSessionId(String defaultSessionId) {
			this.defaultSessionId = defaultSessionId;
			return this;
		}

		public Builder maxInputLength(int maxInputLength) {
			this.maxInputLength = maxInputLength;
			return this;
		}

		public Builder intentTemperature(double intentTemperature) {
			this.intentTemperature = intentTemperature;
			return this;
		}

		public Builder intentMaxTokens(int intentMaxTokens) {
			this.intentMaxTokens = intentMaxTokens;
			return this;
		}

		public Builder responseTemperature(double responseTemperature) {
			this.responseTemperature = responseTemperature;
			return this;
		}

		public Builder responseMaxTokens(int responseMaxTokens) {
			this.responseMaxTokens = responseMaxTokens;
			return this;
		}

		public Builder storePath(Path storePath) {
			this.storePath = storePath;
			return this;
		}

		public ConversationConfig build() {
			return new ConversationConfig(categories, confidenceThreshold, defaultCategory, maxTurnsPerSession,
					contextMaxTurns, contextMaxChars, classificationContextTurns, oracleTimeout, commitRetries,
					retryBackoff, defaultSessionId, maxInputLength, intentTemperature, intentMaxTokens,
					responseTemperature, responseMaxTokens, storePath);
		}
	}
}
