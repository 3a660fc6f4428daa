package de.mirkosertic.catalog.bitbucket.discovery;

import de.mirkosertic.catalog.bitbucket.bitbucket.model.Repository;
import de.mirkosertic.catalog.bitbucket.config.ProviderFilters;
import org.jspecify.annotations.Nullable;

import java.util.regex.Pattern;

/**
 * Decides whether a repository is in scope of a provider.
 * <p>
 * Patterns are searched, not fully matched: {@code service} matches the slug {@code my-service-api}.
 * Anchor the pattern to require a full match.
 */
public class RepositoryFilter {

    private final @Nullable ProviderFilters filters;

    public RepositoryFilter(final @Nullable ProviderFilters filters) {
        this.filters = filters;
    }

    public boolean matches(final Repository repository) {
        if (filters == null) {
            return true;
        }
        return matches(filters.projectKey(), repository.projectKey())
                && matches(filters.repoSlug(), repository.slug());
    }

    private static boolean matches(final @Nullable Pattern pattern, final @Nullable String value) {
        if (pattern == null) {
            return true;
        }
        // a configured pattern never matches a missing value
        return value != null && pattern.matcher(value).find();
    }
}
