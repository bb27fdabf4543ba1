package org.javai.springai.intent;

import java.time.Instant;
import java.util.List;
import org.javai.springai.intent.config.ConversationConfig;
import org.javai.springai.intent.store.StoreSummary;

/**
 * Snapshot of a {@link ConversationService}'s health.
 *
 * @param healthy true if the store answered and, for a health check, the health check classification succeeded
 * @param oracleConfigured false when the service runs on keyword fallback only
 * @param storage store statistics, null if the store could not be read
 * @param config the service's configuration
 * @param supportedIntents configured categories in declaration order
 * @param healthCheckResult classification of the health check message, null for {@link ConversationService#status()}
 * @param checkedAt when the snapshot was taken
 * @param error description of the first failure, null when healthy
 */
public record ServiceStatus(
		boolean healthy,
		boolean oracleConfigured,
		StoreSummary storage,
		ConversationConfig config,
		List<IntentCategory> supportedIntents,
		IntentResult healthCheckResult,
		Instant checkedAt,
		String error
) {

	public ServiceStatus {
		supportedIntents = supportedIntents != null ? List.copyOf(supportedIntents) : List.of();
	}

	/**
	 * True if the health check classification ran and the oracle answered it.
	 */
	public boolean oracleResponding() {
		return healthCheckResult != null && !healthCheckResult.isFallback();
	}
}
