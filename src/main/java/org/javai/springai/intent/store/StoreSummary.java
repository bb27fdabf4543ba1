package org.javai.springai.intent.store;

import java.time.Instant;

/**
 * Aggregate statistics over every stored session.
 */
public record StoreSummary(
		int totalSessions,
		int totalTurns,
		int humanTurns,
		int assistantTurns,
		String mostActiveSessionId,
		Instant mostRecentActivity
) {

	public static StoreSummary empty() {
		return new StoreSummary(0, 0, 0, 0, null, null);
	}

	public double averageTurnsPerSession() {
		return totalSessions == 0 ? 0.0 : (double) totalTurns / totalSessions;
	}
}
