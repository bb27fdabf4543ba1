package org.javai.springai.intent.oracle;

/**
 * Sampling parameters passed with an oracle request.
 *
 * @param temperature sampling temperature, null for the model default
 * @param maxTokens completion budget, null for the model default
 */
public record OracleOptions(Double temperature, Integer maxTokens) {

	public OracleOptions {
		if (temperature != null && (temperature < 0.0 || temperature > 2.0)) {
			throw new IllegalArgumentException("temperature must be between 0.0 and 2.0");
		}
		if (maxTokens != null && maxTokens < 1) {
			throw new IllegalArgumentException("maxTokens must be >= 1");
		}
	}

	public static OracleOptions defaults() {
		return new OracleOptions(null, null);
	}
}
