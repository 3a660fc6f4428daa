package de.mirkosertic.catalog.bitbucket;

import de.mirkosertic.catalog.bitbucket.catalog.DeferredEntity;
import de.mirkosertic.catalog.bitbucket.catalog.LocationEntity;
import de.mirkosertic.catalog.bitbucket.discovery.DiscoveryTarget;
import de.mirkosertic.catalog.bitbucket.discovery.EntityMaterializer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes the three-way diff between registered locations and discovered catalog files.
 * <p>
 * Locations are identified by {@code spec.target}, compared byte for byte. All targets are
 * built by {@link de.mirkosertic.catalog.bitbucket.discovery.FileUrlResolver}, so casing and
 * encoding are consistent on both sides.
 */
final class LocationReconciler {

    private LocationReconciler() {
    }

    static LocationDiff diff(final Collection<DiscoveryTarget> discovered,
                             final Collection<LocationEntity> existing,
                             final String providerName) {
        final Set<String> existingTargets = new HashSet<>();
        for (final LocationEntity entity : existing) {
            existingTargets.add(entity.spec().target());
        }

        final Set<String> discoveredTargets = new HashSet<>();
        final List<DiscoveryTarget> newTargets = new ArrayList<>();
        for (final DiscoveryTarget target : discovered) {
            // the search may report a file twice across pages
            if (discoveredTargets.add(target.fileUrl()) && !existingTargets.contains(target.fileUrl())) {
                newTargets.add(target);
            }
        }

        final List<DeferredEntity> removed = new ArrayList<>();
        final List<LocationEntity> stillPresent = new ArrayList<>();
        for (final LocationEntity entity : existing) {
            if (discoveredTargets.contains(entity.spec().target())) {
                stillPresent.add(entity);
            } else {
                removed.add(new DeferredEntity(entity, providerName));
            }
        }

        return new LocationDiff(
                EntityMaterializer.toDeferredEntities(newTargets, providerName),
                removed,
                stillPresent
        );
    }
}
