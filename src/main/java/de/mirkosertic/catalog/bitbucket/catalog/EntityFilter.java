package de.mirkosertic.catalog.bitbucket.catalog;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field-path equality filter, e.g. {@code kind=Location} and
 * {@code metadata.annotations.bitbucket.org/repo-url=<url>}.
 */
public record EntityFilter(Map<String, String> fields) {

    public EntityFilter {
        fields = Map.copyOf(fields);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final Map<String, String> fields = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder kind(final String kind) {
            fields.put("kind", kind);
            return this;
        }

        public Builder annotation(final String key, final String value) {
            fields.put("metadata.annotations." + key, value);
            return this;
        }

        public EntityFilter build() {
            return new EntityFilter(fields);
        }
    }
}
