package de.mirkosertic.catalog.bitbucket.bitbucket.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * The subset of a Bitbucket Cloud repository that discovery needs. Search results only carry
 * the fields requested through the field projection, so everything is nullable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Repository(
        @Nullable String slug,
        @Nullable Project project,
        @Nullable Branch mainbranch,
        @Nullable Links links,
        @Nullable Workspace workspace
) {

    /**
     * Canonical web URL ({@code links.html.href}).
     *
     * @throws IllegalStateException if the repository has no html link
     */
    public String webUrl() {
        if (links == null || links.html() == null || links.html().href() == null) {
            throw new IllegalStateException("Repository " + slug + " has no html link");
        }
        return links.html().href();
    }

    public @Nullable String projectKey() {
        return project == null ? null : project.key();
    }

    public @Nullable String defaultBranch() {
        return mainbranch == null ? null : mainbranch.name();
    }

    public @Nullable String workspaceSlug() {
        return workspace == null ? null : workspace.slug();
    }
}
