package de.mirkosertic.catalog.bitbucket.bitbucket.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One hit of the workspace code search. A hit with no path matches is a content match only.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CodeSearchResult(
        @JsonProperty("path_matches")
        List<PathMatch> pathMatches,
        @Nullable
        SearchFile file
) {
    public CodeSearchResult {
        pathMatches = pathMatches == null ? List.of() : List.copyOf(pathMatches);
    }

    public boolean isPathMatch() {
        return !pathMatches.isEmpty();
    }

    public @Nullable Repository repository() {
        if (file == null || file.commit() == null) {
            return null;
        }
        return file.commit().repository();
    }
}
