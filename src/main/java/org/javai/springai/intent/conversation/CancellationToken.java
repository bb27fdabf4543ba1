package org.javai.springai.intent.conversation;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for a single turn.
 *
 * <p>The orchestrator checks the token between stages. Once the commit has
 * started, cancellation is ignored and the turn is recorded in full.</p>
 */
public final class CancellationToken {

	private static final CancellationToken NONE = new CancellationToken();

	private final AtomicBoolean cancelled = new AtomicBoolean();

	/**
	 * A token that is never cancelled.
	 */
	public static CancellationToken none() {
		return NONE;
	}

	public static CancellationToken create() {
		return new CancellationToken();
	}

	public void cancel() {
		if (this == NONE) {
			throw new UnsupportedOperationException("the shared no-op token cannot be cancelled");
		}
		cancelled.set(true);
	}

	public boolean isCancelled() {
		return cancelled.get();
	}
}
