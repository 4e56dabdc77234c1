package com.github.stormino.audioextract.exception;

import java.util.Collection;
import java.util.List;

/**
 * A setting or request option holds a value the engine cannot use.
 */
public class ConfigurationException extends ConversionException {

    private final String configKey;
    private final String configValue;
    private final List<String> allowedValues;

    public ConfigurationException(String message, String configKey) {
        this(message, configKey, null, List.of());
    }

    public ConfigurationException(String message, String configKey, String configValue) {
        this(message, configKey, configValue, List.of());
    }

    private ConfigurationException(String message, String configKey, String configValue,
                                   Collection<String> allowedValues) {
        super(message);
        this.configKey = configKey;
        this.configValue = configValue;
        this.allowedValues = List.copyOf(allowedValues);
    }

    /**
     * Rejects {@code value} for {@code key}, listing the accepted choices in the message.
     */
    public static ConfigurationException invalidChoice(String key, String value, Collection<String> allowed) {
        return new ConfigurationException(
                "Invalid " + key + " '" + value + "', expected one of " + String.join(", ", allowed),
                key, value, allowed);
    }

    public String getConfigKey() {
        return configKey;
    }

    public String getConfigValue() {
        return configValue;
    }

    /**
     * Accepted values, empty when the setting is not an enumeration.
     */
    public List<String> getAllowedValues() {
        return allowedValues;
    }
}
