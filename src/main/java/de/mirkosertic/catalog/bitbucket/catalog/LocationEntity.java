package de.mirkosertic.catalog.bitbucket.catalog;

/**
 * A catalog {@code Location} entity: a pointer to a catalog file, not its content.
 */
public record LocationEntity(
        String apiVersion,
        String kind,
        EntityMetadata metadata,
        LocationSpec spec
) {
    public static final String API_VERSION = "backstage.io/v1alpha1";
    public static final String KIND = "Location";

    public LocationEntity withAnnotation(final String key, final String value) {
        return new LocationEntity(apiVersion, kind, metadata.withAnnotation(key, value), spec);
    }
}
