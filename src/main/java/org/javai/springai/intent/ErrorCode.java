package org.javai.springai.intent;

/**
 * Stable error codes reported to callers when a stage fails.
 */
public enum ErrorCode {
	EMPTY_INPUT,
	INPUT_TOO_LONG,
	INVALID_INPUT,
	INVALID_SESSION_ID,
	STORAGE_ERROR,
	ORACLE_UNAVAILABLE,
	ORACLE_PROTOCOL_ERROR,
	CLASSIFICATION_FAILED,
	PARTIAL_COMMIT,
	CONFIGURATION_ERROR,
	CANCELLED,
	INTERNAL_ERROR
}
