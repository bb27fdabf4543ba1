package org.javai.springai.intent.oracle;

import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.springai.intent.ErrorCode;

/**
 * The oracle answered, but the answer cannot be used (empty, not JSON, missing fields).
 */
public class OracleProtocolException extends OracleException {

	private static final int MAX_RAW_LENGTH = 500;

	private final String rawResponse;

	public OracleProtocolException(String message, String rawResponse) {
		this(message, rawResponse, null);
	}

	public OracleProtocolException(String message, String rawResponse, Throwable cause) {
		super(ErrorCode.ORACLE_PROTOCOL_ERROR, message, details(rawResponse), cause);
		this.rawResponse = truncate(rawResponse);
	}

	public String rawResponse() {
		return rawResponse;
	}

	private static Map<String, Object> details(String rawResponse) {
		Map<String, Object> details = new LinkedHashMap<>();
		details.put("raw_response", truncate(rawResponse));
		return details;
	}

	private static String truncate(String raw) {
		if (raw == null) {
			return null;
		}
		return raw.length() > MAX_RAW_LENGTH ? raw.substring(0, MAX_RAW_LENGTH) + "..." : raw;
	}
}
