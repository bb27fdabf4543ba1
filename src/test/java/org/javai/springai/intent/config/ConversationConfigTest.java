package org.javai.springai.intent.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import org.javai.springai.intent.ErrorCode;
import org.javai.springai.intent.IntentCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ConversationConfig")
class ConversationConfigTest {

	@Nested
	@DisplayName("defaults")
	class Defaults {

		@Test
		@DisplayName("cover every known category with general chat as default")
		void coverEveryKnownCategory() {
			ConversationConfig config = ConversationConfig.defaults();

			assertThat(config.categories()).containsExactlyInAnyOrderElementsOf(IntentCategory.knownValues());
			assertThat(config.categories()).doesNotContain(IntentCategory.UNKNOWN);
			assertThat(config.defaultCategory()).isEqualTo(IntentCategory.GENERAL_CHAT);
			assertThat(config.confidenceThreshold()).isEqualTo(0.7);
			assertThat(config.defaultSessionId()).isEqualTo("main_session");
			assertThat(config.storePath()).isEqualTo(Path.of("intent_conversations.db"));
		}

		@Test
		@DisplayName("derive retention, context budget and oracle options")
		void deriveComponentSettings() {
			ConversationConfig config = ConversationConfig.builder()
					.maxTurnsPerSession(40)
					.contextMaxTurns(8)
					.contextMaxChars(900)
					.intentTemperature(0.0)
					.intentMaxTokens(200)
					.responseTemperature(0.9)
					.responseMaxTokens(1000)
					.build();

			assertThat(config.retentionPolicy().maxTurnsPerSession()).isEqualTo(40);
			assertThat(config.contextBudget().maxTurns()).isEqualTo(8);
			assertThat(config.contextBudget().maxChars()).isEqualTo(900);
			assertThat(config.intentOptions().temperature()).isEqualTo(0.0);
			assertThat(config.intentOptions().maxTokens()).isEqualTo(200);
			assertThat(config.responseOptions().temperature()).isEqualTo(0.9);
			assertThat(config.responseOptions().maxTokens()).isEqualTo(1000);
		}

		@Test
		@DisplayName("round-trip through toBuilder")
		void roundTripThroughToBuilder() {
			ConversationConfig config = ConversationConfig.builder()
					.categories(EnumSet.of(IntentCategory.GREETING, IntentCategory.GENERAL_CHAT))
					.oracleTimeout(Duration.ofSeconds(3))
					.build();

			assertThat(config.toBuilder().build()).isEqualTo(config);
		}

		@Test
		@DisplayName("do not share the caller's category set")
		void copyCategorySet() {
			Set<IntentCategory> categories = EnumSet.of(IntentCategory.GREETING, IntentCategory.GENERAL_CHAT);
			ConversationConfig config = ConversationConfig.builder().categories(categories).build();

			categories.add(IntentCategory.GOODBYE);

			assertThat(config.categories()).doesNotContain(IntentCategory.GOODBYE);
		}
	}

	@Nested
	@DisplayName("validation")
	class Validation {

		@Test
		@DisplayName("requires at least one category")
		void requiresCategories() {
			assertThatThrownBy(() -> ConversationConfig.builder().categories(Set.of()).build())
					.isInstanceOfSatisfying(ConfigurationException.class, e -> {
						assertThat(e.configKey()).isEqualTo("intent.categories");
						assertThat(e.errorCode()).isEqualTo(ErrorCode.CONFIGURATION_ERROR);
					});
		}

		@Test
		@DisplayName("rejects the unknown sentinel as a category")
		void rejectsUnknownCategory() {
			assertThatThrownBy(() -> ConversationConfig.builder()
					.categories(EnumSet.of(IntentCategory.UNKNOWN, IntentCategory.GENERAL_CHAT))
					.build())
					.isInstanceOfSatisfying(ConfigurationException.class,
							e -> assertThat(e.configKey()).isEqualTo("intent.categories"));
		}

		@Test
		@DisplayName("requires the default category to be configured")
		void requiresConfiguredDefault() {
			assertThatThrownBy(() -> ConversationConfig.builder()
					.categories(EnumSet.of(IntentCategory.GREETING))
					.build())
					.isInstanceOfSatisfying(ConfigurationException.class,
							e -> assertThat(e.configKey()).isEqualTo("intent.default_category"));
		}

		@Test
		@DisplayName("rejects a non-positive oracle timeout")
		void rejectsZeroTimeout() {
			assertThatThrownBy(() -> ConversationConfig.builder().oracleTimeout(Duration.ZERO).build())
					.isInstanceOfSatisfying(ConfigurationException.class,
							e -> assertThat(e.configKey()).isEqualTo("oracle.timeout_ms"));
		}

		@Test
		@DisplayName("rejects a blank default session id")
		void rejectsBlankSessionId() {
			assertThatThrownBy(() -> ConversationConfig.builder().defaultSessionId(" ").build())
					.isInstanceOfSatisfying(ConfigurationException.class,
							e -> assertThat(e.configKey()).isEqualTo("conversation.default_session_id"));
		}

		@Test
		@DisplayName("rejects negative retry settings")
		void rejectsNegativeRetries() {
			assertThatThrownBy(() -> ConversationConfig.builder().commitRetries(-1).build())
					.isInstanceOfSatisfying(ConfigurationException.class,
							e -> assertThat(e.configKey()).isEqualTo("conversation.commit_retries"));
			assertThatThrownBy(() -> ConversationConfig.builder().retryBackoff(Duration.ofMillis(-5)).build())
					.isInstanceOfSatisfying(ConfigurationException.class,
							e -> assertThat(e.configKey()).isEqualTo("conversation.retry_backoff_ms"));
		}

		@Test
		@DisplayName("accepts zero context turns and zero retries")
		void acceptsZeroes() {
			ConversationConfig config = ConversationConfig.builder()
					.contextMaxTurns(0)
					.classificationContextTurns(0)
					.commitRetries(0)
					.retryBackoff(Duration.ZERO)
					.build();

			assertThat(config.contextMaxTurns()).isZero();
			assertThat(config.commitRetries()).isZero();
		}
	}
}
