package org.javai.springai.intent;

import org.javai.springai.intent.conversation.TurnResult;

/**
 * Caller-facing outcome of {@link ConversationService#process(String, String)}.
 *
 * @param success true if both turns were recorded
 * @param response the assistant's answer, null on failure before generation
 * @param intent detected category, null on failure before classification
 * @param confidence classification confidence, 0.0 when there is no intent
 * @param sessionId the session the turn was processed in
 * @param errorCode failure code, null on success
 * @param errorMessage readable failure description, null on success
 * @param degraded true when a canned answer replaced the oracle's
 * @param lowConfidence true when the oracle's classification fell below the threshold
 */
public record ProcessResult(
		boolean success,
		String response,
		IntentCategory intent,
		double confidence,
		String sessionId,
		ErrorCode errorCode,
		String errorMessage,
		boolean degraded,
		boolean lowConfidence
) {

	public static ProcessResult from(TurnResult turn) {
		IntentResult intent = turn.intent();
		return new ProcessResult(
				turn.isCommitted(),
				turn.response() != null ? turn.response().content() : null,
				intent != null ? intent.category() : null,
				intent != null ? intent.confidence() : 0.0,
				turn.sessionId(),
				turn.error() != null ? turn.error().errorCode() : null,
				turn.error() != null ? turn.error().getMessage() : null,
				turn.isDegraded(),
				intent != null && intent.lowConfidence());
	}
}
