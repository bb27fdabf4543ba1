package org.javai.springai.intent.context;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.javai.springai.intent.store.SessionStore;
import org.javai.springai.intent.store.Turn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the slice of prior turns handed to the oracle.
 *
 * <p>The window is read from the {@link SessionStore} newest-first up to the turn
 * budget, then trimmed from the oldest end until the character budget holds. The
 * same store state and budgets always give the same window.</p>
 */
public class ContextWindowBuilder {

	private static final Logger logger = LoggerFactory.getLogger(ContextWindowBuilder.class);

	private final SessionStore store;
	private final ContextBudget defaultBudget;

	public ContextWindowBuilder(SessionStore store) {
		this(store, ContextBudget.defaults());
	}

	public ContextWindowBuilder(SessionStore store, ContextBudget defaultBudget) {
		this.store = Objects.requireNonNull(store, "store must not be null");
		this.defaultBudget = Objects.requireNonNull(defaultBudget, "defaultBudget must not be null");
	}

	/**
	 * Builds a window using the configured default budget.
	 */
	public List<Turn> build(String sessionId) {
		return build(sessionId, defaultBudget.maxTurns(), defaultBudget.maxChars());
	}

	/**
	 * Builds a window, oldest turn first, within both budgets.
	 *
	 * @param sessionId the session to read
	 * @param maxTurns turn budget (0 yields an empty window)
	 * @param maxChars character budget (0 yields an empty window)
	 * @return the window, possibly empty
	 */
	public List<Turn> build(String sessionId, int maxTurns, int maxChars) {
		ContextBudget budget = new ContextBudget(maxTurns, maxChars);
		if (budget.maxTurns() == 0 || budget.maxChars() == 0) {
			return List.of();
		}
		List<Turn> recent = store.readRecent(sessionId, budget.maxTurns());

		Deque<Turn> window = new ArrayDeque<>(recent);
		long chars = recent.stream().mapToLong(turn -> turn.content().length()).sum();
		while (!window.isEmpty() && chars > budget.maxChars()) {
			chars -= window.removeFirst().content().length();
		}
		if (window.size() < recent.size()) {
			logger.debug("Context for session {} trimmed from {} to {} turn(s) to fit {} chars",
					sessionId, recent.size(), window.size(), budget.maxChars());
		}
		return List.copyOf(window);
	}

	public ContextBudget defaultBudget() {
		return defaultBudget;
	}
}
