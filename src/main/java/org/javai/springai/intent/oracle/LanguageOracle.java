package org.javai.springai.intent.oracle;

/**
 * The external language model, used for both classification and generation.
 *
 * <p>Treated as untrusted and fallible. Implementations report transport
 * problems (unreachable, timed out, rejected) as {@link OracleUnavailableException}
 * and unusable answers as {@link OracleProtocolException}.</p>
 */
@FunctionalInterface
public interface LanguageOracle {

	OracleResponse complete(OracleRequest request);
}
