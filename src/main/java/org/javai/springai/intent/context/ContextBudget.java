package org.javai.springai.intent.context;

/**
 * Turn-count and character budgets for a context window.
 *
 * @param maxTurns most turns a window may hold
 * @param maxChars most characters (sum of turn contents) a window may hold
 */
public record ContextBudget(int maxTurns, int maxChars) {

	public static final int DEFAULT_MAX_TURNS = 20;
	public static final int DEFAULT_MAX_CHARS = 4_000;

	public ContextBudget {
		if (maxTurns < 0) {
			throw new IllegalArgumentException("maxTurns must be >= 0");
		}
		if (maxChars < 0) {
			throw new IllegalArgumentException("maxChars must be >= 0");
		}
	}

	public static ContextBudget defaults() {
		return new ContextBudget(DEFAULT_MAX_TURNS, DEFAULT_MAX_CHARS);
	}
}
