package de.mirkosertic.catalog.bitbucket.events;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * One delivered event.
 *
 * @param topic        topic the event was published on, e.g. {@code bitbucketCloud/repo:push}
 * @param eventPayload the payload, either a typed object or a raw JSON tree/map
 * @param metadata     transport metadata such as webhook headers
 */
public record EventParams(
        String topic,
        Object eventPayload,
        Map<String, String> metadata
) {
    public EventParams {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public @Nullable String metadataValue(final String key) {
        return metadata.get(key);
    }
}
