package org.javai.springai.intent.store;

/**
 * Author of a turn.
 */
public enum Role {
	HUMAN,
	ASSISTANT
}
