package de.mirkosertic.catalog.bitbucket.bitbucket.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of a paginated Bitbucket Cloud response. {@code next} is the absolute URL of the
 * following page, or {@code null} on the last page.
 */
public record Page<T>(
        List<T> values,
        @Nullable String next
) {
    public Page {
        values = values == null ? List.of() : List.copyOf(values);
    }

    public boolean hasNext() {
        return next != null && !next.isEmpty();
    }
}
