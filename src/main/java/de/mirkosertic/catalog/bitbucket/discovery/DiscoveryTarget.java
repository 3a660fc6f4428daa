package de.mirkosertic.catalog.bitbucket.discovery;

/**
 * A catalog file found upstream. Identity is {@code fileUrl}.
 */
public record DiscoveryTarget(
        /** URL of the catalog file, as produced by {@link FileUrlResolver}. */
        String fileUrl,
        /** Web URL of the repository containing the file. */
        String repoUrl
) {
}
