package de.mirkosertic.catalog.bitbucket.catalog;

/**
 * Where a catalog file lives and whether it has to exist.
 */
public record LocationSpec(
        /** Location type, always {@code url} for discovered files. */
        String type,
        /** Absolute URL of the catalog file. */
        String target,
        /** {@code required} or {@code optional}. */
        String presence
) {
    public static final String TYPE_URL = "url";
    public static final String PRESENCE_REQUIRED = "required";

    public static LocationSpec requiredUrl(final String target) {
        return new LocationSpec(TYPE_URL, target, PRESENCE_REQUIRED);
    }
}
