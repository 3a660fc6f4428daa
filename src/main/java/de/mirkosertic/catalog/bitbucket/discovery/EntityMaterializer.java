package de.mirkosertic.catalog.bitbucket.discovery;

import de.mirkosertic.catalog.bitbucket.catalog.DeferredEntity;
import de.mirkosertic.catalog.bitbucket.catalog.LocationEntities;
import de.mirkosertic.catalog.bitbucket.catalog.LocationEntity;
import de.mirkosertic.catalog.bitbucket.catalog.LocationSpec;

import java.util.Collection;
import java.util.List;

/**
 * Turns discovery targets into catalog {@code Location} entities owned by one provider.
 */
public final class EntityMaterializer {

    /** Provenance annotation: web URL of the repository the catalog file lives in. */
    public static final String ANNOTATION_REPO_URL = "bitbucket.org/repo-url";

    private EntityMaterializer() {
    }

    /**
     * Order preserving, one entity per target.
     */
    public static List<DeferredEntity> toDeferredEntities(final Collection<DiscoveryTarget> targets,
                                                          final String providerName) {
        return targets.stream()
                .map(target -> new DeferredEntity(toLocationEntity(target), providerName))
                .toList();
    }

    static LocationEntity toLocationEntity(final DiscoveryTarget target) {
        return LocationEntities.fromLocationSpec(LocationSpec.requiredUrl(target.fileUrl()))
                .withAnnotation(ANNOTATION_REPO_URL, target.repoUrl());
    }
}
