package org.javai.springai.intent.oracle;

import java.util.Map;
import org.javai.springai.intent.ErrorCode;

/**
 * Transport-level oracle failure: unreachable, timed out, or rejected.
 */
public class OracleUnavailableException extends OracleException {

	private final boolean timedOut;

	public OracleUnavailableException(String message, Throwable cause) {
		this(message, false, cause);
	}

	public OracleUnavailableException(String message, boolean timedOut, Throwable cause) {
		super(ErrorCode.ORACLE_UNAVAILABLE, message, Map.of("timed_out", timedOut), cause);
		this.timedOut = timedOut;
	}

	public boolean timedOut() {
		return timedOut;
	}
}
