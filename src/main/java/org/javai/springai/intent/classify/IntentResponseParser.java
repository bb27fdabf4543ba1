package org.javai.springai.intent.classify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.javai.springai.intent.IntentCategory;
import org.javai.springai.intent.oracle.OracleProtocolException;

/**
 * Parses the oracle's JSON classification answer.
 *
 * <p>Accepts answers wrapped in Markdown code fences. {@code category},
 * {@code confidence} and {@code reasoning} are required; anything else is
 * optional. A category outside the known set parses as
 * {@link IntentCategory#UNKNOWN}, it is up to the caller to reject it.</p>
 */
public class IntentResponseParser {

	private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

	private final ObjectMapper objectMapper;

	public IntentResponseParser() {
		this(new ObjectMapper());
	}

	public IntentResponseParser(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Classification fields as reported by the oracle.
	 *
	 * @param category parsed category, possibly {@link IntentCategory#UNKNOWN}
	 * @param rawCategory category string exactly as received
	 * @param confidence confidence clamped into [0.0, 1.0]
	 */
	public record ParsedIntent(
			IntentCategory category,
			String rawCategory,
			double confidence,
			String reasoning,
			Map<String, Object> entities,
			boolean followUpNeeded,
			boolean contextDependent,
			List<String> suggestedActions
	) {
	}

	/**
	 * @throws OracleProtocolException if the content is not a JSON object with the required fields
	 */
	public ParsedIntent parse(String content) {
		if (content == null || content.isBlank()) {
			throw new OracleProtocolException("Empty classification response", content);
		}
		String json = stripCodeFences(content);

		JsonNode root;
		try {
			root = objectMapper.readTree(json);
		} catch (JsonProcessingException e) {
			throw new OracleProtocolException("Invalid JSON response: " + e.getOriginalMessage(), content, e);
		}
		if (root == null || !root.isObject()) {
			throw new OracleProtocolException("Classification response is not a JSON object", content);
		}

		List<String> missing = new ArrayList<>();
		for (String field : List.of("category", "confidence", "reasoning")) {
			if (!root.hasNonNull(field)) {
				missing.add(field);
			}
		}
		if (!missing.isEmpty()) {
			throw new OracleProtocolException("Missing required fields: " + missing, content);
		}

		String rawCategory = root.get("category").asText();
		double confidence = readConfidence(root.get("confidence"), content);

		return new ParsedIntent(
				IntentCategory.fromWireName(rawCategory),
				rawCategory,
				Math.max(0.0, Math.min(1.0, confidence)),
				root.get("reasoning").asText(),
				readEntities(root.get("entities")),
				root.path("follow_up_needed").asBoolean(false),
				root.path("context_dependent").asBoolean(false),
				readStrings(root.get("suggested_actions")));
	}

	static String stripCodeFences(String content) {
		String cleaned = content.strip();
		int start = cleaned.indexOf("```json");
		int skip = 7;
		if (start < 0) {
			start = cleaned.indexOf("```");
			skip = 3;
		}
		if (start < 0) {
			return cleaned;
		}
		int bodyStart = start + skip;
		int end = cleaned.indexOf("```", bodyStart);
		return (end < 0 ? cleaned.substring(bodyStart) : cleaned.substring(bodyStart, end)).strip();
	}

	private double readConfidence(JsonNode node, String content) {
		double confidence;
		if (node.isNumber()) {
			confidence = node.asDouble();
		} else if (node.isTextual()) {
			try {
				confidence = Double.parseDouble(node.asText().strip());
			} catch (NumberFormatException e) {
				throw new OracleProtocolException("Confidence is not a number: " + node.asText(), content, e);
			}
		} else {
			throw new OracleProtocolException("Confidence is not a number: " + node, content);
		}
		if (!Double.isFinite(confidence)) {
			throw new OracleProtocolException("Confidence is not a finite number: " + node.asText(), content);
		}
		return confidence;
	}

	private Map<String, Object> readEntities(JsonNode node) {
		if (node == null || !node.isObject()) {
			return Map.of();
		}
		return objectMapper.convertValue(node, MAP_TYPE);
	}

	private static List<String> readStrings(JsonNode node) {
		if (node == null || !node.isArray()) {
			return List.of();
		}
		List<String> values = new ArrayList<>();
		node.forEach(element -> {
			if (!element.isNull()) {
				values.add(element.asText());
			}
		});
		return values;
	}
}
