package de.mirkosertic.catalog.bitbucket.catalog;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts location specs into {@link LocationEntity} instances the same way the catalog does,
 * so that entity names and refs stay stable between full and delta refreshes.
 */
public final class LocationEntities {

    public static final String ANNOTATION_MANAGED_BY_LOCATION = "backstage.io/managed-by-location";
    public static final String ANNOTATION_MANAGED_BY_ORIGIN_LOCATION = "backstage.io/managed-by-origin-location";

    private LocationEntities() {
    }

    public static LocationEntity fromLocationSpec(final LocationSpec location) {
        final String ownLocation = location.type() + ":" + location.target();

        final Map<String, String> annotations = new LinkedHashMap<>();
        annotations.put(ANNOTATION_MANAGED_BY_LOCATION, ownLocation);
        annotations.put(ANNOTATION_MANAGED_BY_ORIGIN_LOCATION, ownLocation);

        return new LocationEntity(
                LocationEntity.API_VERSION,
                LocationEntity.KIND,
                new EntityMetadata(generatedName(ownLocation), null, annotations),
                location
        );
    }

    /**
     * {@code generated-} followed by the hex SHA-1 of the location reference.
     */
    static String generatedName(final String locationRef) {
        try {
            final MessageDigest digest = MessageDigest.getInstance("SHA-1");
            final byte[] hash = digest.digest(locationRef.getBytes(StandardCharsets.UTF_8));
            return "generated-" + HexFormat.of().formatHex(hash);
        } catch (final NoSuchAlgorithmException e) {
            // every JRE ships SHA-1
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
