package org.javai.springai.intent.conversation;

import java.util.List;
import java.util.Optional;
import org.javai.springai.intent.ConversationException;
import org.javai.springai.intent.ErrorCode;
import org.javai.springai.intent.IntentResult;
import org.javai.springai.intent.generate.GeneratedResponse;

/**
 * Outcome of processing one turn.
 *
 * @param sessionId the session the turn belongs to
 * @param input the utterance as received (stripped when it passed validation)
 * @param state terminal state, {@link TurnState#COMMITTED} or {@link TurnState#FAILED}
 * @param path every state visited, in order
 * @param intent classification, null if the turn failed before classification
 * @param response the answer, null if the turn failed before generation
 * @param humanSequence sequence assigned to the stored human turn, if stored
 * @param assistantSequence sequence assigned to the stored assistant turn, if stored
 * @param error the failure, null for committed turns
 */
public record TurnResult(
		String sessionId,
		String input,
		TurnState state,
		List<TurnState> path,
		IntentResult intent,
		GeneratedResponse response,
		Long humanSequence,
		Long assistantSequence,
		ConversationException error
) {

	public TurnResult {
		if (state == null || !state.isTerminal()) {
			throw new IllegalArgumentException("state must be terminal");
		}
		path = path != null ? List.copyOf(path) : List.of();
		if (state == TurnState.FAILED && error == null) {
			throw new IllegalArgumentException("a failed turn must carry its error");
		}
	}

	public boolean isCommitted() {
		return state == TurnState.COMMITTED;
	}

	public boolean isDegraded() {
		return response != null && response.degraded();
	}

	public Optional<ErrorCode> errorCode() {
		return Optional.ofNullable(error).map(ConversationException::errorCode);
	}

	/**
	 * Last state reached before the turn ended, ignoring the terminal {@link TurnState#FAILED}.
	 */
	public TurnState lastReachedState() {
		for (int i = path.size() - 1; i >= 0; i--) {
			if (path.get(i) != TurnState.FAILED) {
				return path.get(i);
			}
		}
		return TurnState.RECEIVED;
	}
}
