package org.javai.springai.intent.store;

/**
 * Bounds how many turns a session keeps. Oldest turns (lowest sequence) go first.
 *
 * @param maxTurnsPerSession the most turns a session retains, at least 1
 */
public record RetentionPolicy(int maxTurnsPerSession) {

	public static final int DEFAULT_MAX_TURNS = 100;

	public RetentionPolicy {
		if (maxTurnsPerSession < 1) {
			throw new IllegalArgumentException("maxTurnsPerSession must be >= 1");
		}
	}

	public static RetentionPolicy defaults() {
		return new RetentionPolicy(DEFAULT_MAX_TURNS);
	}

	/**
	 * Highest sequence number that must be evicted once {@code latestSequence} is
	 * committed, or 0 when nothing has to go. Relies on sequences being contiguous.
	 */
	public long evictUpTo(long latestSequence) {
		return Math.max(0L, latestSequence - maxTurnsPerSession);
	}
}
