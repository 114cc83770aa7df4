package com.mimecast.forwarder.config;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.naming.ConfigurationException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Configuration foundation.
 *
 * <p>Wraps a flat key/value map and provides type safe accessors.
 * <p>Values may come from a JSON5 file (numbers and booleans arrive typed) or from the
 * environment (everything arrives as strings), so every accessor accepts both forms.
 */
public class ConfigFoundation {
    protected static final Logger log = LogManager.getLogger(ConfigFoundation.class);

    /**
     * Values accepted as boolean true.
     */
    private static final Set<String> TRUE_VALUES = Set.of("1", "true", "yes", "y", "on");

    /**
     * Configuration map.
     */
    protected final Map<String, Object> map;

    /**
     * Constructs a new ConfigFoundation instance with an empty map.
     */
    public ConfigFoundation() {
        this(new HashMap<>());
    }

    /**
     * Constructs a new ConfigFoundation instance.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        this.map = map;
    }

    /**
     * Checks if a non-blank value is present.
     *
     * @param key Key.
     * @return Boolean.
     */
    public boolean hasProperty(String key) {
        Object value = map.get(key);
        return value != null && StringUtils.isNotBlank(String.valueOf(value));
    }

    /**
     * Gets string property.
     *
     * @param key Key.
     * @return String or null.
     */
    public String getStringProperty(String key) {
        return getStringProperty(key, null);
    }

    /**
     * Gets string property with default.
     *
     * @param key          Key.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String key, String defaultValue) {
        return hasProperty(key) ? String.valueOf(map.get(key)).trim() : defaultValue;
    }

    /**
     * Gets required string property.
     *
     * @param key Key.
     * @return String.
     * @throws ConfigurationException Value missing or blank.
     */
    public String getRequiredStringProperty(String key) throws ConfigurationException {
        if (!hasProperty(key)) {
            throw new ConfigurationException("Missing required configuration: " + key);
        }
        return getStringProperty(key);
    }

    /**
     * Gets long property with default.
     *
     * @param key          Key.
     * @param defaultValue Default value.
     * @return Long.
     * @throws ConfigurationException Value is not a whole number.
     */
    public long getLongProperty(String key, long defaultValue) throws ConfigurationException {
        if (!hasProperty(key)) {
            return defaultValue;
        }

        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }

        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid number for " + key + ": " + value);
        }
    }

    /**
     * Gets int property with default.
     *
     * @param key          Key.
     * @param defaultValue Default value.
     * @return Integer.
     * @throws ConfigurationException Value is not a whole number or out of range.
     */
    public int getIntProperty(String key, int defaultValue) throws ConfigurationException {
        long value = getLongProperty(key, defaultValue);
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException e) {
            throw new ConfigurationException("Number out of range for " + key + ": " + value);
        }
    }

    /**
     * Gets boolean property with default.
     * <p>Accepts 1, true, yes, y and on (case insensitive) as true.
     *
     * @param key          Key.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String key, boolean defaultValue) {
        if (!hasProperty(key)) {
            return defaultValue;
        }

        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }

        return TRUE_VALUES.contains(String.valueOf(value).trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Gets the backing map.
     *
     * @return Map.
     */
    public Map<String, Object> getMap() {
        return map;
    }
}
