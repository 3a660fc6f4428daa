package de.mirkosertic.catalog.bitbucket.config;

import org.jspecify.annotations.Nullable;

import java.util.regex.Pattern;

/**
 * Optional repository filters. An absent pattern lets every repository pass.
 */
public record ProviderFilters(
        @Nullable Pattern projectKey,
        @Nullable Pattern repoSlug
) {
}
