package org.javai.springai.intent.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.javai.springai.intent.IntentCategory;
import org.javai.springai.intent.classify.KeywordTable;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a {@link ConversationConfig}, and optionally a {@link KeywordTable}, from YAML.
 *
 * <p>Every section and key is optional; absent values take the defaults of
 * {@link ConversationConfig.Builder}. Example:</p>
 * <pre>
 * intent:
 *   categories: [greeting, goodbye, question_answering, general_chat]
 *   confidence_threshold: 0.75
 *   default_category: general_chat
 *   context_turns: 6
 *   temperature: 0.1
 *   max_tokens: 500
 * response:
 *   temperature: 0.3
 *   max_tokens: 1500
 * storage:
 *   path: data/intent_conversations.db
 *   max_turns_per_session: 100
 * context:
 *   max_turns: 20
 *   max_chars: 4000
 * oracle:
 *   timeout_ms: 30000
 * conversation:
 *   default_session_id: main_session
 *   max_input_length: 10000
 *   commit_retries: 3
 *   retry_backoff_ms: 25
 * keywords:
 *   version: 2
 *   default_category: general_chat
 *   categories:
 *     greeting: [hello, hey]
 *     goodbye: [bye]
 * </pre>
 */
public class ConversationConfigLoader {

	private final Yaml yaml = new Yaml();

	/**
	 * Configuration read from a YAML document.
	 *
	 * @param config the conversation settings
	 * @param keywordTable keyword table, present only when the document has a {@code keywords} section
	 */
	public record LoadedConfiguration(ConversationConfig config, Optional<KeywordTable> keywordTable) {
	}

	public LoadedConfiguration load(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return load(reader);
		} catch (IOException e) {
			throw new ConfigurationException(null, "Failed to read configuration from path: " + path, e);
		}
	}

	public LoadedConfiguration load(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (YAMLException e) {
			throw new ConfigurationException(null, "Failed to parse configuration from input stream", e);
		}
	}

	public LoadedConfiguration load(Reader reader) {
		try {
			return build(yaml.load(reader));
		} catch (YAMLException e) {
			throw new ConfigurationException(null, "Failed to parse configuration from reader", e);
		}
	}

	public LoadedConfiguration loadString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (YAMLException e) {
			throw new ConfigurationException(null, "Failed to parse configuration from string", e);
		}
	}

	private LoadedConfiguration build(Object document) {
		if (document == null) {
			return new LoadedConfiguration(ConversationConfig.defaults(), Optional.empty());
		}
		if (!(document instanceof Map<?, ?> root)) {
			throw ConfigurationException.invalid("<root>", "a mapping", document.getClass().getSimpleName());
		}

		ConversationConfig.Builder builder = ConversationConfig.builder();

		Map<?, ?> intent = section(root, "intent");
		if (intent.containsKey("categories")) {
			builder.categories(categories(intent.get("categories"), "intent.categories"));
		}
		if (intent.containsKey("confidence_threshold")) {
			builder.confidenceThreshold(number(intent, "confidence_threshold", "intent").doubleValue());
		}
		if (intent.containsKey("default_category")) {
			builder.defaultCategory(category(intent.get("default_category"), "intent.default_category"));
		}
		if (intent.containsKey("context_turns")) {
			builder.classificationContextTurns(integer(intent, "context_turns", "intent"));
		}
		if (intent.containsKey("temperature")) {
			builder.intentTemperature(number(intent, "temperature", "intent").doubleValue());
		}
		if (intent.containsKey("max_tokens")) {
			builder.intentMaxTokens(integer(intent, "max_tokens", "intent"));
		}

		Map<?, ?> response = section(root, "response");
		if (response.containsKey("temperature")) {
			builder.responseTemperature(number(response, "temperature", "response").doubleValue());
		}
		if (response.containsKey("max_tokens")) {
			builder.responseMaxTokens(integer(response, "max_tokens", "response"));
		}

		Map<?, ?> storage = section(root, "storage");
		if (storage.containsKey("path")) {
			builder.storePath(Path.of(string(storage, "path", "storage")));
		}
		if (storage.containsKey("max_turns_per_session")) {
			builder.maxTurnsPerSession(integer(storage, "max_turns_per_session", "storage"));
		}

		Map<?, ?> context = section(root, "context");
		if (context.containsKey("max_turns")) {
			builder.contextMaxTurns(integer(context, "max_turns", "context"));
		}
		if (context.containsKey("max_chars")) {
			builder.contextMaxChars(integer(context, "max_chars", "context"));
		}

		Map<?, ?> oracle = section(root, "oracle");
		if (oracle.containsKey("timeout_ms")) {
			builder.oracleTimeout(Duration.ofMillis(number(oracle, "timeout_ms", "oracle").longValue()));
		}

		Map<?, ?> conversation = section(root, "conversation");
		if (conversation.containsKey("default_session_id")) {
			builder.defaultSessionId(string(conversation, "default_session_id", "conversation"));
		}
		if (conversation.containsKey("max_input_length")) {
			builder.maxInputLength(integer(conversation, "max_input_length", "conversation"));
		}
		if (conversation.containsKey("commit_retries")) {
			builder.commitRetries(integer(conversation, "commit_retries", "conversation"));
		}
		if (conversation.containsKey("retry_backoff_ms")) {
			builder.retryBackoff(Duration.ofMillis(number(conversation, "retry_backoff_ms", "conversation").longValue()));
		}

		ConversationConfig config = builder.build();
		Optional<KeywordTable> keywords = root.containsKey("keywords")
				? Optional.of(buildKeywordTable(section(root, "keywords")))
				: Optional.empty();
		return new LoadedConfiguration(config, keywords);
	}

	private KeywordTable buildKeywordTable(Map<?, ?> keywords) {
		KeywordTable.Builder builder = KeywordTable.builder();
		if (keywords.containsKey("version")) {
			builder.version(number(keywords, "version", "keywords").longValue());
		}
		if (keywords.containsKey("default_category")) {
			builder.defaultCategory(category(keywords.get("default_category"), "keywords.default_category"));
		}
		Map<?, ?> categories = section(keywords, "categories", "keywords.categories");
		if (categories.isEmpty()) {
			throw ConfigurationException.missing("keywords.categories");
		}
		for (Map.Entry<?, ?> entry : categories.entrySet()) {
			String key = "keywords.categories." + entry.getKey();
			IntentCategory category = category(entry.getKey(), key);
			if (!(entry.getValue() instanceof List<?> words) || words.isEmpty()) {
				throw ConfigurationException.invalid(key, "a non-empty list of keywords", entry.getValue());
			}
			builder.category(category, words.stream().map(String::valueOf).toList());
		}
		try {
			return builder.build();
		} catch (IllegalArgumentException e) {
			throw new ConfigurationException("keywords", "Invalid keyword table: " + e.getMessage(), e);
		}
	}

	private static Map<?, ?> section(Map<?, ?> parent, String name) {
		return section(parent, name, name);
	}

	private static Map<?, ?> section(Map<?, ?> parent, String name, String key) {
		Object value = parent.get(name);
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map<?, ?> map)) {
			throw ConfigurationException.invalid(key, "a mapping", value);
		}
		return map;
	}

	private static Set<IntentCategory> categories(Object value, String key) {
		if (!(value instanceof List<?> names) || names.isEmpty()) {
			throw ConfigurationException.invalid(key, "a non-empty list of category names", value);
		}
		Set<IntentCategory> categories = EnumSet.noneOf(IntentCategory.class);
		for (Object name : names) {
			categories.add(category(name, key));
		}
		return categories;
	}

	private static IntentCategory category(Object value, String key) {
		IntentCategory category = IntentCategory.fromWireName(value != null ? value.toString() : null);
		if (!category.isKnown()) {
			throw ConfigurationException.invalid(key, "a known intent category", value);
		}
		return category;
	}

	private static Number number(Map<?, ?> section, String name, String prefix) {
		Object value = section.get(name);
		if (!(value instanceof Number number)) {
			throw ConfigurationException.invalid(prefix + "." + name, "a number", value);
		}
		return number;
	}

	private static int integer(Map<?, ?> section, String name, String prefix) {
		Object value = section.get(name);
		if (value instanceof Integer) {
			return (Integer) value;
		}
		if (value instanceof Long || value instanceof BigInteger) {
			throw ConfigurationException.invalid(prefix + "." + name, "an integer between "
					+ Integer.MIN_VALUE + " and " + Integer.MAX_VALUE, value);
		}
		throw ConfigurationException.invalid(prefix + "." + name, "an integer", value);
	}

	private static String string(Map<?, ?> section, String name, String prefix) {
		Object value = section.get(name);
		if (value == null || value.toString().isBlank()) {
			throw ConfigurationException.invalid(prefix + "." + name, "a non-empty string", value);
		}
		return value.toString();
	}
}
