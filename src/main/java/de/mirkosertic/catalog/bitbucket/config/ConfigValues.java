package de.mirkosertic.catalog.bitbucket.config;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Typed access to the untyped maps produced by SnakeYAML. All errors name the full key path.
 */
final class ConfigValues {

    private ConfigValues() {
    }

    @SuppressWarnings("unchecked")
    static @Nullable Map<String, Object> optionalMap(final Map<String, Object> parent, final String key, final String path) {
        final Object value = parent.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Invalid type in config for key '" + path + "', expected object");
        }
        return (Map<String, Object>) value;
    }

    static @Nullable String optionalString(final Map<String, Object> parent, final String key, final String path) {
        final Object value = parent.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Map || value instanceof Iterable) {
            throw new ConfigurationException("Invalid type in config for key '" + path + "', expected string");
        }
        return value.toString();
    }

    static String requiredString(final Map<String, Object> parent, final String key, final String path) {
        final String value = optionalString(parent, key, path);
        if (value == null || value.isEmpty()) {
            throw new ConfigurationException("Missing required config value at '" + path + "'");
        }
        return value;
    }
}
