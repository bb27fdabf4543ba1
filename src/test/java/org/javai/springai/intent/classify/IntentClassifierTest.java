package org.javai.springai.intent.classify;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.logging.log4j.Level;
import org.javai.springai.intent.IntentCategory;
import org.javai.springai.intent.IntentResult;
import org.javai.springai.intent.config.ConfigurationException;
import org.javai.springai.intent.config.ConversationConfig;
import org.javai.springai.intent.oracle.LanguageOracle;
import org.javai.springai.intent.oracle.OracleProtocolException;
import org.javai.springai.intent.oracle.OracleRequest;
import org.javai.springai.intent.oracle.OracleResponse;
import org.javai.springai.intent.oracle.OracleUnavailableException;
import org.javai.springai.intent.store.Turn;
import org.javai.springai.intent.testsupport.LogCaptorAppender;
import org.javai.springai.intent.testsupport.ScriptedOracle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("IntentClassifier")
class IntentClassifierTest {

	private final ConversationConfig config = ConversationConfig.defaults();
	private final FallbackClassifier fallback = new FallbackClassifier();

	private static LanguageOracle answering(String json) {
		return request -> new OracleResponse(json, null, "test-model");
	}

	private static List<Turn> priorExchange() {
		return List.of(
				Turn.human("Tell me about photosynthesis").committedAs(1, Instant.EPOCH),
				Turn.assistant("Photosynthesis turns light into chemical energy.").committedAs(2, Instant.EPOCH));
	}

	@Nested
	@DisplayName("with a healthy oracle")
	class HealthyOracle {

		@Test
		@DisplayName("returns the oracle's classification")
		void returnsOracleClassification() {
			IntentClassifier classifier = new IntentClassifier(
					answering(ScriptedOracle.classificationJson("greeting", 0.95)), fallback, config);

			IntentResult result = classifier.classify("Hello there!", List.of());

			assertThat(result.category()).isEqualTo(IntentCategory.GREETING);
			assertThat(result.confidence()).isEqualTo(0.95);
			assertThat(result.source()).isEqualTo(IntentResult.Source.ORACLE);
			assertThat(result.lowConfidence()).isFalse();
			assertThat(result.modelId()).isEqualTo("test-model");
		}

		@Test
		@DisplayName("delivers a low-confidence answer flagged rather than replaced")
		void deliversLowConfidenceAnswer() {
			IntentClassifier classifier = new IntentClassifier(
					answering(ScriptedOracle.classificationJson("question_answering", 0.4)), fallback, config);

			IntentResult result = classifier.classify("hmm, maybe?", List.of());

			assertThat(result.category()).isEqualTo(IntentCategory.QUESTION_ANSWERING);
			assertThat(result.confidence()).isEqualTo(0.4);
			assertThat(result.lowConfidence()).isTrue();
			assertThat(result.isFallback()).isFalse();
		}

		@Test
		@DisplayName("sends category list, context summary and intent options")
		void sendsPromptAndOptions() {
			AtomicReference<OracleRequest> captured = new AtomicReference<>();
			LanguageOracle oracle = request -> {
				captured.set(request);
				return OracleResponse.of(ScriptedOracle.classificationJson("clarification", 0.88));
			};
			IntentClassifier classifier = new IntentClassifier(oracle, fallback, config);

			classifier.classify("Can you explain that again?", priorExchange());

			OracleRequest request = captured.get();
			assertThat(request.systemPrompt())
					.contains("- greeting: Greetings, introductions, and conversation starters")
					.contains("CONVERSATION CONTEXT: User: Tell me about photosynthesis | Assistant: Photosynthesis");
			assertThat(request.userText()).isEqualTo("ANALYZE THIS INPUT: Can you explain that again?");
			assertThat(request.history()).isEmpty();
			assertThat(request.options().temperature()).isEqualTo(0.1);
			assertThat(request.options().maxTokens()).isEqualTo(500);
		}
	}

	@Nested
	@DisplayName("falling back")
	class FallingBack {

		@Test
		@DisplayName("when the oracle names a category outside the set")
		void whenCategoryIsUnknown() {
			IntentClassifier classifier = new IntentClassifier(
					answering(ScriptedOracle.classificationJson("weather_report", 0.99)), fallback, config);

			IntentResult result = classifier.classify("Hello, what's up", List.of());

			assertThat(result.category()).isEqualTo(IntentCategory.GREETING);
			assertThat(result.confidence()).isEqualTo(FallbackClassifier.FALLBACK_CONFIDENCE);
			assertThat(result.source()).isEqualTo(IntentResult.Source.FALLBACK);
		}

		@Test
		@DisplayName("when the oracle names a category that is not configured")
		void whenCategoryIsNotConfigured() {
			ConversationConfig narrow = ConversationConfig.builder()
					.categories(EnumSet.of(IntentCategory.GENERAL_CHAT, IntentCategory.GREETING))
					.build();
			IntentClassifier classifier = new IntentClassifier(
					answering(ScriptedOracle.classificationJson("goodbye", 0.9)), fallback, narrow);

			IntentResult result = classifier.classify("bye now", List.of());

			assertThat(result.category()).isEqualTo(IntentCategory.GENERAL_CHAT);
			assertThat(result.confidence()).isEqualTo(FallbackClassifier.MIN_CONFIDENCE);
			assertThat(result.isFallback()).isTrue();
		}

		@Test
		@DisplayName("when the oracle is unavailable, logging a warning")
		void whenOracleIsUnavailable() {
			LanguageOracle down = request -> {
				throw new OracleUnavailableException("connection refused", null);
			};
			IntentClassifier classifier = new IntentClassifier(down, fallback, config);

			try (LogCaptorAppender logs = LogCaptorAppender.create(IntentClassifier.class, Level.WARN)) {
				IntentResult result = classifier.classify("Goodbye and thanks", List.of());

				assertThat(result.category()).isEqualTo(IntentCategory.GOODBYE);
				assertThat(result.isFallback()).isTrue();
				assertThat(logs.messagesAt(Level.WARN)).anyMatch(msg -> msg.contains("ORACLE_UNAVAILABLE"));
			}
		}

		@Test
		@DisplayName("when the oracle answers with something that is not JSON")
		void whenAnswerIsMalformed() {
			IntentClassifier classifier = new IntentClassifier(answering("definitely a greeting"), fallback, config);

			IntentResult result = classifier.classify("hey you", List.of());

			assertThat(result.category()).isEqualTo(IntentCategory.GREETING);
			assertThat(result.isFallback()).isTrue();
		}

		@Test
		@DisplayName("when the oracle answers with a confidence of NaN")
		void whenConfidenceIsNaN() {
			IntentClassifier classifier = new IntentClassifier(
					answering("{\"category\": \"greeting\", \"confidence\": \"NaN\", \"reasoning\": \"x\"}"),
					fallback, config);

			IntentResult result = classifier.classify("Hello there!", List.of());

			assertThat(result.category()).isEqualTo(IntentCategory.GREETING);
			assertThat(result.confidence()).isEqualTo(FallbackClassifier.FALLBACK_CONFIDENCE);
			assertThat(result.isFallback()).isTrue();
		}

		@Test
		@DisplayName("when the oracle reports a protocol error itself")
		void whenOracleReportsProtocolError() {
			LanguageOracle broken = request -> {
				throw new OracleProtocolException("empty", "");
			};
			IntentClassifier classifier = new IntentClassifier(broken, fallback, config);

			assertThat(classifier.classify("What is Java?", List.of()).category())
					.isEqualTo(IntentCategory.QUESTION_ANSWERING);
		}

		@Test
		@DisplayName("always, when no oracle is configured")
		void whenNoOracleIsConfigured() {
			IntentClassifier classifier = IntentClassifier.fallbackOnly(fallback, config);

			IntentResult result = classifier.classify("Please create a report", List.of());

			assertThat(classifier.hasOracle()).isFalse();
			assertThat(result.category()).isEqualTo(IntentCategory.TASK_REQUEST);
			assertThat(result.isFallback()).isTrue();
		}

		@Test
		@DisplayName("marks a clarification context dependent when there is prior context")
		void clarificationWithContextIsContextDependent() {
			IntentClassifier classifier = IntentClassifier.fallbackOnly(fallback, config);

			IntentResult withContext = classifier.classify("Can you explain that?", priorExchange());
			IntentResult withoutContext = classifier.classify("Can you explain that?", List.of());

			assertThat(withContext.category()).isEqualTo(IntentCategory.CLARIFICATION);
			assertThat(withContext.contextDependent()).isTrue();
			assertThat(withoutContext.contextDependent()).isFalse();
		}

		@Test
		@DisplayName("treats a request for an example after a machine learning exchange as context dependent")
		void exampleRequestAfterMachineLearningExchange() {
			IntentClassifier classifier = IntentClassifier.fallbackOnly(fallback, config);
			List<Turn> context = List.of(
					Turn.human("What is machine learning?").committedAs(1, Instant.EPOCH),
					Turn.assistant("Machine learning lets computers learn patterns from data.")
							.committedAs(2, Instant.EPOCH));

			IntentResult result = classifier.classify("Can you give me a simple example?", context);

			assertThat(result.category()).isEqualTo(IntentCategory.CLARIFICATION);
			assertThat(result.contextDependent()).isTrue();
			assertThat(result.isFallback()).isTrue();
		}

		@Test
		@DisplayName("fails with the raw input preserved when the fallback itself fails")
		void failsWhenFallbackFails() {
			FallbackClassifier broken = mock(FallbackClassifier.class);
			when(broken.registry()).thenReturn(KeywordTableRegistry.withDefaults());
			when(broken.classify(anyString())).thenThrow(new IllegalStateException("keyword table corrupt"));
			IntentClassifier classifier = IntentClassifier.fallbackOnly(broken, config);

			assertThatThrownBy(() -> classifier.classify("anything at all", List.of()))
					.isInstanceOfSatisfying(ClassificationFailedException.class,
							e -> assertThat(e.rawInput()).isEqualTo("anything at all"));
		}
	}

	@Nested
	@DisplayName("configuration")
	class Configuration {

		@Test
		@DisplayName("requires a configuration")
		void requiresConfiguration() {
			assertThatThrownBy(() -> new IntentClassifier(null, fallback, null))
					.isInstanceOf(ConfigurationException.class);
		}

		@Test
		@DisplayName("requires a keyword table")
		void requiresKeywordTable() {
			assertThatThrownBy(() -> new IntentClassifier(null, null, config))
					.isInstanceOfSatisfying(ConfigurationException.class,
							e -> assertThat(e.configKey()).isEqualTo("keywords"));
		}

		@Test
		@DisplayName("rejects a keyword table whose default category is not configured")
		void rejectsUnconfiguredKeywordDefault() {
			ConversationConfig narrow = ConversationConfig.builder()
					.categories(EnumSet.of(IntentCategory.GREETING))
					.defaultCategory(IntentCategory.GREETING)
					.build();

			assertThatThrownBy(() -> IntentClassifier.fallbackOnly(fallback, narrow))
					.isInstanceOfSatisfying(ConfigurationException.class,
							e -> assertThat(e.configKey()).isEqualTo("keywords.default_category"));
		}

		@Test
		@DisplayName("rejects an out-of-range threshold")
		void rejectsOutOfRangeThreshold() {
			assertThatThrownBy(() -> ConversationConfig.builder().confidenceThreshold(1.5).build())
					.isInstanceOfSatisfying(ConfigurationException.class,
							e -> assertThat(e.configKey()).isEqualTo("intent.confidence_threshold"));
		}
	}
}
