package org.javai.springai.intent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import org.javai.springai.intent.classify.KeywordTable;
import org.javai.springai.intent.config.ConversationConfig;
import org.javai.springai.intent.conversation.CancellationToken;
import org.javai.springai.intent.conversation.TurnResult;
import org.javai.springai.intent.generate.DegradedResponses;
import org.javai.springai.intent.oracle.OracleResponse;
import org.javai.springai.intent.store.Role;
import org.javai.springai.intent.store.SessionInfo;
import org.javai.springai.intent.store.SessionStore;
import org.javai.springai.intent.store.StorageException;
import org.javai.springai.intent.store.StoreSummary;
import org.javai.springai.intent.store.Turn;
import org.javai.springai.intent.testsupport.ScriptedOracle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ConversationService")
class ConversationServiceTest {

	@TempDir
	Path tempDir;

	private ConversationConfig config;

	@BeforeEach
	void setUp() {
		config = ConversationConfig.builder()
				.storePath(tempDir.resolve("conversations.db"))
				.retryBackoff(Duration.ZERO)
				.build();
	}

	@Nested
	@DisplayName("with an oracle")
	class WithOracle {

		@Test
		@DisplayName("answers and records a turn")
		void answersAndRecordsTurn() {
			try (ConversationService service = ConversationService.builder()
					.withOracle(ScriptedOracle.answering("greeting", 0.95, "Hello! How can I help?"))
					.withConfig(config)
					.build()) {

				ProcessResult result = service.process("Hello there!", "alice");

				assertThat(result.success()).isTrue();
				assertThat(result.intent()).isEqualTo(IntentCategory.GREETING);
				assertThat(result.confidence()).isEqualTo(0.95);
				assertThat(result.response()).isEqualTo("Hello! How can I help?");
				assertThat(result.degraded()).isFalse();
				assertThat(result.lowConfidence()).isFalse();
				assertThat(result.errorCode()).isNull();
				assertThat(service.history("alice")).extracting(Turn::role)
						.containsExactly(Role.HUMAN, Role.ASSISTANT);
			}
		}

		@Test
		@DisplayName("flags a low-confidence classification")
		void flagsLowConfidence() {
			try (ConversationService service = ConversationService.builder()
					.withOracle(ScriptedOracle.answering("question_answering", 0.3, "Possibly."))
					.withConfig(config)
					.build()) {

				ProcessResult result = service.process("maybe something?", "bob");

				assertThat(result.success()).isTrue();
				assertThat(result.intent()).isEqualTo(IntentCategory.QUESTION_ANSWERING);
				assertThat(result.lowConfidence()).isTrue();
			}
		}

		@Test
		@DisplayName("falls back when the oracle is too slow")
		void fallsBackWhenOracleIsSlow() {
			ScriptedOracle sleepy = new ScriptedOracle(text -> {
				sleep(Duration.ofSeconds(5));
				return OracleResponse.of(ScriptedOracle.classificationJson("greeting", 0.9));
			}, text -> {
				sleep(Duration.ofSeconds(5));
				return OracleResponse.of("too late");
			});
			ConversationConfig impatient = config.toBuilder().oracleTimeout(Duration.ofMillis(100)).build();

			try (ConversationService service = ConversationService.builder()
					.withOracle(sleepy)
					.withConfig(impatient)
					.build()) {

				ProcessResult result = service.process("Goodbye for now", "carol");

				assertThat(result.success()).isTrue();
				assertThat(result.intent()).isEqualTo(IntentCategory.GOODBYE);
				assertThat(result.degraded()).isTrue();
				assertThat(result.response()).isEqualTo(DegradedResponses.forCategory(IntentCategory.GOODBYE));
			}
		}

		@Test
		@DisplayName("exposes the full turn outcome when asked")
		void exposesTurnOutcome() {
			try (ConversationService service = ConversationService.builder()
					.withOracle(ScriptedOracle.answering("general_chat", 0.8, "Nice."))
					.withConfig(config)
					.build()) {

				TurnResult turn = service.processTurn("The weather is lovely", "dave", CancellationToken.none());

				assertThat(turn.isCommitted()).isTrue();
				assertThat(turn.humanSequence()).isEqualTo(1L);
				assertThat(turn.response().usage()).containsEntry("total_tokens", 42);
			}
		}
	}

	@Nested
	@DisplayName("without an oracle")
	class WithoutOracle {

		@Test
		@DisplayName("classifies by keyword and answers with a canned response")
		void classifiesByKeyword() {
			try (ConversationService service = ConversationService.builder().withConfig(config).build()) {

				ProcessResult result = service.process("What is the capital of France?", "erin");

				assertThat(result.success()).isTrue();
				assertThat(result.intent()).isEqualTo(IntentCategory.QUESTION_ANSWERING);
				assertThat(result.degraded()).isTrue();
				assertThat(result.response()).isNotBlank();
			}
		}

		@Test
		@DisplayName("uses a configured keyword table and accepts a newer one")
		void swapsKeywordTables() {
			KeywordTable custom = KeywordTable.builder()
					.version(2)
					.category(IntentCategory.GREETING, "ahoy")
					.build();
			try (ConversationService service = ConversationService.builder()
					.withConfig(config)
					.withKeywordTable(custom)
					.build()) {

				assertThat(service.analyze("ahoy there", "frank").category()).isEqualTo(IntentCategory.GREETING);
				assertThat(service.analyze("hello there", "frank").category()).isEqualTo(IntentCategory.GENERAL_CHAT);

				boolean swapped = service.keywordTables().swap(2, KeywordTable.defaults().withVersion(3));

				assertThat(swapped).isTrue();
				assertThat(service.analyze("hello there", "frank").category()).isEqualTo(IntentCategory.GREETING);
			}
		}

		@Test
		@DisplayName("reports rejected input without recording it")
		void reportsRejectedInput() {
			try (ConversationService service = ConversationService.builder().withConfig(config).build()) {

				ProcessResult result = service.process("   ", "gina");

				assertThat(result.success()).isFalse();
				assertThat(result.errorCode()).isEqualTo(ErrorCode.EMPTY_INPUT);
				assertThat(result.errorMessage()).isNotBlank();
				assertThat(result.intent()).isNull();
				assertThat(service.sessions()).isEmpty();
			}
		}
	}

	@Nested
	@DisplayName("session management")
	class SessionManagement {

		private ConversationService service;

		@BeforeEach
		void setUp() {
			service = ConversationService.builder()
					.withOracle(ScriptedOracle.answering("general_chat", 0.8, "Okay."))
					.withConfig(config)
					.build();
		}

		@AfterEach
		void tearDown() {
			service.close();
		}

		@Test
		@DisplayName("uses the default session when none is named")
		void usesDefaultSession() {
			ProcessResult result = service.process("hi");

			assertThat(result.sessionId()).isEqualTo(ConversationConfig.DEFAULT_SESSION_ID);
			assertThat(service.history(null)).hasSize(2);
		}

		@Test
		@DisplayName("lists sessions and summarises the store")
		void listsAndSummarises() {
			service.process("one", "a");
			service.process("two", "b");
			service.process("three", "b");

			assertThat(service.sessions()).extracting(SessionInfo::id).containsExactlyInAnyOrder("a", "b");
			StoreSummary summary = service.summary();
			assertThat(summary.totalSessions()).isEqualTo(2);
			assertThat(summary.totalTurns()).isEqualTo(6);
			assertThat(summary.humanTurns()).isEqualTo(3);
			assertThat(summary.assistantTurns()).isEqualTo(3);
			assertThat(summary.mostActiveSessionId()).isEqualTo("b");
		}

		@Test
		@DisplayName("clears turns but keeps the session")
		void clearsSession() {
			service.process("one", "a");

			service.clearSession("a");

			assertThat(service.history("a")).isEmpty();
			assertThat(service.sessions()).extracting(SessionInfo::id).containsExactly("a");
		}

		@Test
		@DisplayName("deletes a session with its turns")
		void deletesSession() {
			service.process("one", "a");
			service.process("two", "b");

			service.deleteSession("a");

			assertThat(service.history("a")).isEmpty();
			assertThat(service.sessions()).extracting(SessionInfo::id).containsExactly("b");
		}

		@Test
		@DisplayName("analysis records nothing")
		void analysisRecordsNothing() {
			IntentResult result = service.analyze("Tell me something", "quiet");

			assertThat(result.category()).isEqualTo(IntentCategory.GENERAL_CHAT);
			assertThat(service.sessions()).isEmpty();
		}

		@Test
		@DisplayName("lists supported intents in declaration order")
		void listsSupportedIntents() {
			assertThat(service.supportedIntents()).isEqualTo(IntentCategory.knownValues());
		}
	}

	@Nested
	@DisplayName("status and health")
	class StatusAndHealth {

		@Test
		@DisplayName("reports store statistics, configuration and intents")
		void reportsStatus() {
			try (ConversationService service = ConversationService.builder()
					.withOracle(ScriptedOracle.answering("general_chat", 0.8, "Okay."))
					.withConfig(config)
					.build()) {
				service.process("one", "a");

				ServiceStatus status = service.status();

				assertThat(status.healthy()).isTrue();
				assertThat(status.oracleConfigured()).isTrue();
				assertThat(status.storage().totalTurns()).isEqualTo(2);
				assertThat(status.config()).isSameAs(config);
				assertThat(status.supportedIntents()).isEqualTo(service.supportedIntents());
				assertThat(status.healthCheckResult()).isNull();
				assertThat(status.checkedAt()).isNotNull();
				assertThat(status.error()).isNull();
			}
		}

		@Test
		@DisplayName("classifies the health check message without recording anything")
		void classifiesHealthCheckMessage() {
			ScriptedOracle oracle = ScriptedOracle.answering("general_chat", 0.9, "unused");
			try (ConversationService service = ConversationService.builder()
					.withOracle(oracle)
					.withConfig(config)
					.build()) {

				ServiceStatus health = service.healthCheck();

				assertThat(health.healthy()).isTrue();
				assertThat(health.oracleResponding()).isTrue();
				assertThat(health.healthCheckResult().category()).isEqualTo(IntentCategory.GENERAL_CHAT);
				assertThat(oracle.classificationRequests()).hasSize(1);
				assertThat(service.sessions()).isEmpty();
			}
		}

		@Test
		@DisplayName("stays healthy on the fallback when there is no oracle")
		void healthyWithoutOracle() {
			try (ConversationService service = ConversationService.builder().withConfig(config).build()) {

				ServiceStatus health = service.healthCheck();

				assertThat(health.healthy()).isTrue();
				assertThat(health.oracleConfigured()).isFalse();
				assertThat(health.oracleResponding()).isFalse();
				assertThat(health.healthCheckResult().isFallback()).isTrue();
			}
		}

		@Test
		@DisplayName("is unhealthy when the store cannot be read")
		void unhealthyWhenStoreFails() {
			SessionStore broken = mock(SessionStore.class);
			when(broken.summary()).thenThrow(new StorageException("disk gone", "summary", false));
			try (ConversationService service = ConversationService.builder()
					.withStore(broken)
					.withConfig(config)
					.build()) {

				ServiceStatus health = service.healthCheck();

				assertThat(health.healthy()).isFalse();
				assertThat(health.storage()).isNull();
				assertThat(health.healthCheckResult()).isNull();
				assertThat(health.error()).contains("disk gone");
			}
		}
	}

	@Test
	@DisplayName("lists only the configured intents")
	void listsOnlyConfiguredIntents() {
		ConversationConfig narrow = config.toBuilder()
				.categories(EnumSet.of(IntentCategory.GOODBYE, IntentCategory.GENERAL_CHAT, IntentCategory.GREETING))
				.build();
		try (ConversationService service = ConversationService.builder().withConfig(narrow).build()) {
			assertThat(service.supportedIntents()).isEqualTo(
					List.of(IntentCategory.GENERAL_CHAT, IntentCategory.GREETING, IntentCategory.GOODBYE));
		}
	}

	private static void sleep(Duration duration) {
		try {
			Thread.sleep(duration.toMillis());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
	}
}
