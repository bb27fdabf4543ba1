package org.javai.springai.intent.conversation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.javai.springai.intent.ConversationException;
import org.javai.springai.intent.ErrorCode;
import org.javai.springai.intent.IntentResult;
import org.javai.springai.intent.classify.ClassificationFailedException;
import org.javai.springai.intent.classify.IntentClassifier;
import org.javai.springai.intent.config.ConversationConfig;
import org.javai.springai.intent.context.ContextWindowBuilder;
import org.javai.springai.intent.generate.DegradedResponses;
import org.javai.springai.intent.generate.GeneratedResponse;
import org.javai.springai.intent.generate.ResponseGenerator;
import org.javai.springai.intent.oracle.OracleException;
import org.javai.springai.intent.store.Role;
import org.javai.springai.intent.store.SessionIds;
import org.javai.springai.intent.store.SessionLocks;
import org.javai.springai.intent.store.SessionStore;
import org.javai.springai.intent.store.StorageException;
import org.javai.springai.intent.store.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a single turn from input to stored history.
 *
 * <p>Each call moves through {@link TurnState#RECEIVED}, {@link TurnState#CONTEXT_BUILT},
 * {@link TurnState#CLASSIFIED}, {@link TurnState#GENERATED} and {@link TurnState#COMMITTED},
 * or ends in {@link TurnState#FAILED}. The orchestrator itself holds no durable state.</p>
 *
 * <h2>Commit</h2>
 * <p>The human turn and the assistant turn are appended under a per-session
 * commit lock so the pair is adjacent in the history. If the human turn cannot
 * be stored nothing is written. If the assistant turn cannot be stored after
 * the configured retries the result carries a {@link PartialCommitException}
 * and the human turn remains in the history.</p>
 *
 * <h2>Degradation</h2>
 * <p>A failing or slow oracle never fails a turn: classification falls back to
 * keywords and generation falls back to {@link DegradedResponses}.</p>
 */
public class ConversationOrchestrator {

	private static final Logger logger = LoggerFactory.getLogger(ConversationOrchestrator.class);

	/** Input containing U+0000 to U+0002 is rejected. */
	private static final char MAX_REJECTED_CONTROL_CHAR = '\u0002';

	private final SessionStore store;
	private final ContextWindowBuilder contextBuilder;
	private final IntentClassifier classifier;
	private final ResponseGenerator generator;
	private final ConversationConfig config;
	private final SessionLocks commitLocks = new SessionLocks();

	public ConversationOrchestrator(
			SessionStore store,
			ContextWindowBuilder contextBuilder,
			IntentClassifier classifier,
			ResponseGenerator generator,
			ConversationConfig config) {
		this.store = Objects.requireNonNull(store, "store must not be null");
		this.contextBuilder = Objects.requireNonNull(contextBuilder, "contextBuilder must not be null");
		this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
		this.generator = Objects.requireNonNull(generator, "generator must not be null");
		this.config = Objects.requireNonNull(config, "config must not be null");
	}

	/**
	 * Processes a turn in the default session.
	 */
	public TurnResult process(String text) {
		return process(text, null, CancellationToken.none());
	}

	public TurnResult process(String text, String sessionId) {
		return process(text, sessionId, CancellationToken.none());
	}

	/**
	 * Processes a turn.
	 *
	 * @param text the user's utterance
	 * @param sessionId target session, or null/blank for the configured default
	 * @param token checked between stages; ignored once the commit has begun
	 * @return the outcome, never null; failures are reported through {@link TurnResult#error()}
	 */
	public TurnResult process(String text, String sessionId, CancellationToken token) {
		CancellationToken cancellation = token != null ? token : CancellationToken.none();
		String session = resolveSessionId(sessionId);
		List<TurnState> path = new ArrayList<>();
		path.add(TurnState.RECEIVED);

		ConversationException invalid = validateSessionId(session);
		if (invalid == null) {
			invalid = validateInput(text);
		}
		if (invalid != null) {
			return failed(session, text, path, null, null, null, invalid);
		}
		String input = text.strip();

		List<Turn> context;
		try {
			context = contextBuilder.build(session);
		} catch (ConversationException e) {
			return failed(session, input, path, null, null, null, e);
		} catch (RuntimeException e) {
			logger.error("Unexpected error building context for session {}", session, e);
			return failed(session, input, path, null, null, null,
					new ConversationException(ErrorCode.INTERNAL_ERROR, "Could not build conversation context", e));
		}
		path.add(TurnState.CONTEXT_BUILT);
		if (cancellation.isCancelled()) {
			return cancelled(session, input, path, null, null);
		}

		IntentResult intent;
		try {
			intent = classifier.classify(input, context);
		} catch (ClassificationFailedException e) {
			return failed(session, input, path, null, null, null, e);
		} catch (RuntimeException e) {
			return failed(session, input, path, null, null, null, new ClassificationFailedException(input, e));
		}
		path.add(TurnState.CLASSIFIED);
		if (cancellation.isCancelled()) {
			return cancelled(session, input, path, intent, null);
		}

		GeneratedResponse response = generate(session, input, intent, context);
		path.add(TurnState.GENERATED);
		if (cancellation.isCancelled()) {
			return cancelled(session, input, path, intent, response);
		}

		return commit(session, input, intent, response, path);
	}

	/**
	 * Classifies {@code text} with the session's context without recording anything.
	 *
	 * @throws ConversationException for a malformed session id, empty, oversized or invalid input,
	 *         or a storage failure while reading context
	 * @throws ClassificationFailedException if no classification could be produced
	 */
	public IntentResult analyze(String text, String sessionId) {
		String session = SessionIds.requireValid(resolveSessionId(sessionId));
		ConversationException invalid = validateInput(text);
		if (invalid != null) {
			throw invalid;
		}
		String input = text.strip();
		List<Turn> context = contextBuilder.build(session);
		try {
			return classifier.classify(input, context);
		} catch (ClassificationFailedException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new ClassificationFailedException(input, e);
		}
	}

	int lockedSessionCount() {
		return commitLocks.size();
	}

	public String resolveSessionId(String sessionId) {
		return sessionId == null || sessionId.isBlank() ? config.defaultSessionId() : sessionId;
	}

	private ConversationException validateInput(String text) {
		if (text == null || text.isBlank()) {
			return new ConversationException(ErrorCode.EMPTY_INPUT, "Empty input provided");
		}
		int length = text.strip().length();
		if (length > config.maxInputLength()) {
			return new ConversationException(ErrorCode.INPUT_TOO_LONG,
					"Input too long (maximum " + config.maxInputLength() + " characters)",
					Map.of("length", length, "max_length", config.maxInputLength()), null);
		}
		if (text.chars().anyMatch(c -> c <= MAX_REJECTED_CONTROL_CHAR)) {
			return new ConversationException(ErrorCode.INVALID_INPUT, "Input contains invalid control characters");
		}
		return null;
	}

	private static ConversationException validateSessionId(String session) {
		try {
			SessionIds.requireValid(session);
			return null;
		} catch (ConversationException e) {
			return e;
		}
	}

	private GeneratedResponse generate(String session, String input, IntentResult intent, List<Turn> context) {
		try {
			return generator.generate(input, intent, context);
		} catch (OracleException e) {
			logger.warn("Response generation failed for session {} [{}]: {}; using degraded response",
					session, e.errorCode(), e.getMessage());
		} catch (RuntimeException e) {
			logger.error("Unexpected error generating response for session {}; using degraded response", session, e);
		}
		return GeneratedResponse.degraded(DegradedResponses.forCategory(intent.category()));
	}

	private TurnResult commit(String session, String input, IntentResult intent, GeneratedResponse response,
			List<TurnState> path) {
		ReentrantLock lock = commitLocks.lock(session);
		try {
			long humanSequence;
			try {
				humanSequence = appendWithRetry(session, Turn.human(input, intent), false);
			} catch (StorageException e) {
				logger.error("Could not store human turn for session {}; nothing was written", session, e);
				return failed(session, input, path, intent, response, null, e);
			} catch (RuntimeException e) {
				logger.error("Unexpected error storing human turn for session {}", session, e);
				return failed(session, input, path, intent, response, null,
						new ConversationException(ErrorCode.INTERNAL_ERROR, "Could not store human turn", e));
			}

			long assistantSequence;
			try {
				assistantSequence = appendWithRetry(session,
						Turn.assistant(response.content(), assistantMetadata(intent, response, humanSequence)), true);
			} catch (RuntimeException e) {
				PartialCommitException partial = new PartialCommitException(session, humanSequence, Role.ASSISTANT, e);
				logger.error("Partial commit in session {}: human turn {} stored without a reply",
						session, humanSequence, e);
				path.add(TurnState.FAILED);
				return new TurnResult(session, input, TurnState.FAILED, path, intent, response,
						humanSequence, null, partial);
			}

			path.add(TurnState.COMMITTED);
			logger.info("Committed turn {}/{} in session {}: {} (confidence: {}, source: {}{})",
					humanSequence, assistantSequence, session, intent.category().wireName(),
					String.format(Locale.ROOT, "%.2f", intent.confidence()), intent.source(),
					response.degraded() ? ", degraded" : "");
			return new TurnResult(session, input, TurnState.COMMITTED, path, intent, response,
					humanSequence, assistantSequence, null);
		} finally {
			commitLocks.unlock(session, lock);
		}
	}

	/**
	 * Appends with up to {@code commitRetries} additional attempts.
	 *
	 * @param retryAnyFailure retry every storage failure, not only transient ones
	 */
	private long appendWithRetry(String session, Turn turn, boolean retryAnyFailure) {
		int attempts = 1 + config.commitRetries();
		StorageException last = null;
		for (int attempt = 1; attempt <= attempts; attempt++) {
			try {
				return store.append(session, turn);
			} catch (StorageException e) {
				last = e;
				if (!retryAnyFailure && !e.isTransient()) {
					throw e;
				}
				if (attempt < attempts) {
					logger.warn("Append of {} turn to session {} failed (attempt {}/{}): {}",
							turn.role(), session, attempt, attempts, e.getMessage());
					pause();
				}
			}
		}
		throw last;
	}

	/**
	 * Sleeps for the full retry backoff even when interrupted. A pending interrupt is restored before
	 * returning, so every retry of a commit keeps its backoff.
	 */
	private void pause() {
		long remaining = config.retryBackoff().toNanos();
		if (remaining <= 0) {
			return;
		}
		long deadline = System.nanoTime() + remaining;
		boolean interrupted = false;
		try {
			while (remaining > 0) {
				try {
					TimeUnit.NANOSECONDS.sleep(remaining);
					return;
				} catch (InterruptedException e) {
					interrupted = true;
					remaining = deadline - System.nanoTime();
				}
			}
		} finally {
			if (interrupted) {
				Thread.currentThread().interrupt();
			}
		}
	}

	private static Map<String, Object> assistantMetadata(IntentResult intent, GeneratedResponse response,
			long humanSequence) {
		Map<String, Object> metadata = new LinkedHashMap<>();
		metadata.put("degraded", response.degraded());
		metadata.put("in_reply_to", humanSequence);
		metadata.put("intent", intent.category().wireName());
		if (!response.usage().isEmpty()) {
			metadata.put("usage", response.usage());
		}
		if (response.modelId() != null) {
			metadata.put("model_id", response.modelId());
		}
		return metadata;
	}

	private TurnResult cancelled(String session, String input, List<TurnState> path, IntentResult intent,
			GeneratedResponse response) {
		logger.info("Turn in session {} cancelled after {}", session, path.get(path.size() - 1));
		return failed(session, input, path, intent, response, null,
				new ConversationException(ErrorCode.CANCELLED, "Turn cancelled before commit"));
	}

	private static TurnResult failed(String session, String input, List<TurnState> path, IntentResult intent,
			GeneratedResponse response, Long humanSequence, ConversationException error) {
		if (error.errorCode() != ErrorCode.CANCELLED) {
			logger.warn("Turn in session {} failed after {}: {}", session, path.get(path.size() - 1), error.toString());
		}
		path.add(TurnState.FAILED);
		return new TurnResult(session, input, TurnState.FAILED, path, intent, response, humanSequence, null, error);
	}
}
