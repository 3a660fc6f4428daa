package de.mirkosertic.catalog.bitbucket;

import de.mirkosertic.catalog.bitbucket.catalog.DeferredEntity;
import de.mirkosertic.catalog.bitbucket.catalog.LocationEntity;

import java.util.List;

/**
 * Difference between the locations registered for one repository and the catalog files
 * found in it.
 */
public record LocationDiff(
        /** Files found upstream without a registered location. */
        List<DeferredEntity> added,
        /** Registered locations whose file is gone, tagged with the owning provider's key. */
        List<DeferredEntity> removed,
        /** Registered locations whose file still exists; their content may have changed. */
        List<LocationEntity> stillPresent
) {
    public boolean hasMembershipChanges() {
        return !added.isEmpty() || !removed.isEmpty();
    }
}
