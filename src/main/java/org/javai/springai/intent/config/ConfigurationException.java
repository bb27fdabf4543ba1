package org.javai.springai.intent.config;

import java.util.Map;
import org.javai.springai.intent.ConversationException;
import org.javai.springai.intent.ErrorCode;

/**
 * A missing or invalid configuration value. Raised while components are being
 * wired and never recovered at runtime.
 */
public class ConfigurationException extends ConversationException {

	private final String configKey;

	public ConfigurationException(String configKey, String message) {
		this(configKey, message, null);
	}

	public ConfigurationException(String configKey, String message, Throwable cause) {
		super(ErrorCode.CONFIGURATION_ERROR, message,
				configKey != null ? Map.of("config_key", configKey) : Map.of(), cause);
		this.configKey = configKey;
	}

	public static ConfigurationException missing(String configKey) {
		return new ConfigurationException(configKey, "Missing required configuration: " + configKey);
	}

	public static ConfigurationException invalid(String configKey, String expected, Object actual) {
		return new ConfigurationException(configKey,
				"Invalid configuration value for " + configKey + " (expected " + expected + ", got " + actual + ")");
	}

	public String configKey() {
		return configKey;
	}
}
