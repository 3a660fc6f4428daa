package de.mirkosertic.catalog.bitbucket.catalog;

/**
 * An entity handed to the catalog together with the key of the provider that owns it.
 * The catalog only deletes entities whose stored location key equals {@code locationKey}.
 */
public record DeferredEntity(
        LocationEntity entity,
        String locationKey
) {
}
