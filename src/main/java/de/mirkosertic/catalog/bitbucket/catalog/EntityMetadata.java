package de.mirkosertic.catalog.bitbucket.catalog;

import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

public record EntityMetadata(
        String name,
        @Nullable
        String namespace,
        Map<String, String> annotations
) {
    public EntityMetadata {
        annotations = annotations == null ? Map.of() : Map.copyOf(annotations);
    }

    /**
     * Returns a copy with the given annotation added (or replaced).
     */
    public EntityMetadata withAnnotation(final String key, final String value) {
        final Map<String, String> merged = new LinkedHashMap<>(annotations);
        merged.put(key, value);
        return new EntityMetadata(name, namespace, merged);
    }

    public @Nullable String annotation(final String key) {
        return annotations.get(key);
    }
}
