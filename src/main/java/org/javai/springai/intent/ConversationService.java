package org.javai.springai.intent;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.javai.springai.intent.classify.FallbackClassifier;
import org.javai.springai.intent.classify.IntentClassifier;
import org.javai.springai.intent.classify.KeywordTable;
import org.javai.springai.intent.classify.KeywordTableRegistry;
import org.javai.springai.intent.config.ConversationConfig;
import org.javai.springai.intent.context.ContextWindowBuilder;
import org.javai.springai.intent.conversation.CancellationToken;
import org.javai.springai.intent.conversation.ConversationOrchestrator;
import org.javai.springai.intent.conversation.TurnResult;
import org.javai.springai.intent.generate.ResponseGenerator;
import org.javai.springai.intent.oracle.ChatClientOracle;
import org.javai.springai.intent.oracle.LanguageOracle;
import org.javai.springai.intent.oracle.TimeLimitedOracle;
import org.javai.springai.intent.store.JdbcSessionStore;
import org.javai.springai.intent.store.SessionInfo;
import org.javai.springai.intent.store.SessionStore;
import org.javai.springai.intent.store.StoreSummary;
import org.javai.springai.intent.store.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Entry point: classify utterances, answer them, and keep per-session history.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * try (ConversationService service = ConversationService.builder()
 *         .withChatClient(chatClient)
 *         .withConfig(ConversationConfig.builder().storePath(Path.of("data/history.db")).build())
 *         .build()) {
 *     ProcessResult result = service.process("Hello there!", "alice");
 *     // result.intent() == IntentCategory.GREETING
 * }
 * }</pre>
 *
 * <p>Without a chat client or oracle the service still works: classification
 * uses the keyword fallback and answers are degraded.</p>
 */
public class ConversationService implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ConversationService.class);

	static final String HEALTH_CHECK_MESSAGE = "Health check test message";

	private final SessionStore store;
	private final ConversationOrchestrator orchestrator;
	private final IntentClassifier classifier;
	private final KeywordTableRegistry keywordTables;
	private final ConversationConfig config;
	private final TimeLimitedOracle timeLimitedOracle;

	private ConversationService(Builder builder) {
		this.config = builder.config != null ? builder.config : ConversationConfig.defaults();
		this.store = builder.store != null
				? builder.store
				: JdbcSessionStore.sqlite(config.storePath(), config.retentionPolicy());

		LanguageOracle rawOracle = builder.oracle;
		if (rawOracle == null && builder.chatClient != null) {
			rawOracle = new ChatClientOracle(builder.chatClient, builder.modelId);
		}
		this.timeLimitedOracle = rawOracle != null ? new TimeLimitedOracle(rawOracle, config.oracleTimeout()) : null;

		this.keywordTables = new KeywordTableRegistry(
				builder.keywordTable != null ? builder.keywordTable : KeywordTable.defaults());
		this.classifier = new IntentClassifier(timeLimitedOracle, new FallbackClassifier(keywordTables), config);
		ResponseGenerator generator = new ResponseGenerator(timeLimitedOracle, config.responseOptions());
		this.orchestrator = new ConversationOrchestrator(
				store, new ContextWindowBuilder(store, config.contextBudget()), classifier, generator, config);

		logger.info("Conversation service ready (oracle: {}, categories: {}, threshold: {})",
				timeLimitedOracle != null ? "configured" : "none, fallback only",
				config.categories().size(), config.confidenceThreshold());
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Processes an utterance in the configured default session.
	 */
	public ProcessResult process(String text) {
		return process(text, null);
	}

	public ProcessResult process(String text, String sessionId) {
		return ProcessResult.from(orchestrator.process(text, sessionId));
	}

	/**
	 * Processes an utterance and returns the full turn outcome, honouring {@code token}.
	 */
	public TurnResult processTurn(String text, String sessionId, CancellationToken token) {
		return orchestrator.process(text, sessionId, token);
	}

	/**
	 * Classifies without answering or recording anything.
	 */
	public IntentResult analyze(String text, String sessionId) {
		return orchestrator.analyze(text, sessionId);
	}

	public List<Turn> history(String sessionId) {
		return store.history(orchestrator.resolveSessionId(sessionId));
	}

	public List<SessionInfo> sessions() {
		return store.listSessions();
	}

	public void deleteSession(String sessionId) {
		String id = orchestrator.resolveSessionId(sessionId);
		store.deleteSession(id);
		logger.info("Deleted session {}", id);
	}

	public void clearSession(String sessionId) {
		String id = orchestrator.resolveSessionId(sessionId);
		store.clearSession(id);
		logger.info("Cleared session {}", id);
	}

	public StoreSummary summary() {
		return store.summary();
	}

	/**
	 * Configured categories in declaration order.
	 */
	public List<IntentCategory> supportedIntents() {
		Set<IntentCategory> configured = config.categories();
		return IntentCategory.knownValues().stream().filter(configured::contains).toList();
	}

	/**
	 * Reports oracle presence, store statistics and configuration without calling the oracle.
	 */
	public ServiceStatus status() {
		Instant now = Instant.now();
		try {
			return new ServiceStatus(true, classifier.hasOracle(), store.summary(), config, supportedIntents(),
					null, now, null);
		} catch (ConversationException e) {
			logger.error("Error getting service status: {}", e.toString());
			return new ServiceStatus(false, classifier.hasOracle(), null, config, supportedIntents(),
					null, now, e.getMessage());
		}
	}

	/**
	 * {@link #status()} plus a classification of a fixed message. The classification reads
	 * no session context and records nothing.
	 */
	public ServiceStatus healthCheck() {
		ServiceStatus status = status();
		if (!status.healthy()) {
			return status;
		}
		try {
			IntentResult result = classifier.classify(HEALTH_CHECK_MESSAGE, List.of());
			if (result.isFallback() && classifier.hasOracle()) {
				logger.warn("Health check message was answered by the fallback classifier");
			}
			return new ServiceStatus(true, status.oracleConfigured(), status.storage(), config,
					status.supportedIntents(), result, status.checkedAt(), null);
		} catch (ConversationException e) {
			logger.error("Health check failed: {}", e.toString());
			return new ServiceStatus(false, status.oracleConfigured(), status.storage(), config,
					status.supportedIntents(), null, status.checkedAt(), e.getMessage());
		}
	}

	/**
	 * Keyword tables used by the fallback classifier; swap in a new version at runtime.
	 */
	public KeywordTableRegistry keywordTables() {
		return keywordTables;
	}

	public ConversationConfig config() {
		return config;
	}

	@Override
	public void close() {
		if (timeLimitedOracle != null) {
			timeLimitedOracle.close();
		}
	}

	public static final class Builder {
		private ChatClient chatClient;
		private String modelId;
		private LanguageOracle oracle;
		private SessionStore store;
		private ConversationConfig config;
		private KeywordTable keywordTable;

		private Builder() {
		}

		public Builder withChatClient(ChatClient chatClient) {
			this.chatClient = chatClient;
			return this;
		}

		/**
		 * Model identifier recorded when the provider does not report one.
		 */
		public Builder withModelId(String modelId) {
			this.modelId = modelId;
			return this;
		}

		/**
		 * Uses a custom oracle instead of a chat client. Takes precedence over {@link #withChatClient(ChatClient)}.
		 */
		public Builder withOracle(LanguageOracle oracle) {
			this.oracle = oracle;
			return this;
		}

		/**
		 * Uses the given store instead of a SQLite file at {@link ConversationConfig#storePath()}.
		 */
		public Builder withStore(SessionStore store) {
			this.store = store;
			return this;
		}

		public Builder withConfig(ConversationConfig config) {
			this.config = config;
			return this;
		}

		public Builder withKeywordTable(KeywordTable keywordTable) {
			this.keywordTable = keywordTable;
			return this;
		}

		public ConversationService build() {
			return new ConversationService(this);
		}
	}
}
