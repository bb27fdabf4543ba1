package org.javai.springai.intent.conversation;

/**
 * States a turn passes through while being processed.
 *
 * <p>The happy path is {@code RECEIVED -> CONTEXT_BUILT -> CLASSIFIED -> GENERATED -> COMMITTED}.
 * {@link #FAILED} can follow any state.</p>
 */
public enum TurnState {
	RECEIVED,
	CONTEXT_BUILT,
	CLASSIFIED,
	GENERATED,
	COMMITTED,
	FAILED;

	public boolean isTerminal() {
		return this == COMMITTED || this == FAILED;
	}
}
