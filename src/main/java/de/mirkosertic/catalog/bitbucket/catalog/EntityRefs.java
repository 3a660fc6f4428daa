package de.mirkosertic.catalog.bitbucket.catalog;

import java.util.Locale;

public final class EntityRefs {

    private static final String DEFAULT_NAMESPACE = "default";

    private EntityRefs() {
    }

    /**
     * Formats {@code kind:namespace/name}, lower-casing kind and namespace.
     */
    public static String stringify(final LocationEntity entity) {
        final String namespace = entity.metadata().namespace();
        return entity.kind().toLowerCase(Locale.ROOT)
                + ":"
                + (namespace == null ? DEFAULT_NAMESPACE : namespace.toLowerCase(Locale.ROOT))
                + "/"
                + entity.metadata().name();
    }
}
