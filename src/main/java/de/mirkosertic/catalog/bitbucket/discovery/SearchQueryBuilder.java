package de.mirkosertic.catalog.bitbucket.discovery;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Builds the code search query that finds catalog files.
 * <p>
 * The query matches the file name and restricts hits to the configured path, e.g.
 * {@code "catalog-info.yaml" path:/catalog-info.yaml repo:my-repo}. The field selection drops
 * content matches and all links except the repository's html link, and adds the repository
 * details needed to build file URLs and apply filters.
 */
public final class SearchQueryBuilder {

    static final String FIELDS = String.join(",", List.of(
            // exclude code/content match details
            "-values.content_matches",
            // include/add relevant repository details
            "+values.file.commit.repository.mainbranch.name",
            "+values.file.commit.repository.project.key",
            "+values.file.commit.repository.slug",
            // remove irrelevant links
            "-values.*.links",
            "-values.*.*.links",
            "-values.*.*.*.links",
            // ...except the one we need
            "+values.file.commit.repository.links.html.href"
    ));

    private SearchQueryBuilder() {
    }

    /**
     * @param catalogPath configured catalog path, e.g. {@code /catalog-info.yaml}
     * @param repoSlug    restrict the search to one repository, or {@code null} for the whole workspace
     */
    public static SearchQuery build(final String catalogPath, final @Nullable String repoSlug) {
        final String catalogFilename = catalogPath.substring(catalogPath.lastIndexOf('/') + 1);
        final String optRepoFilter = repoSlug != null ? " repo:" + repoSlug : "";
        final String query = "\"" + catalogFilename + "\" path:" + catalogPath + optRepoFilter;
        return new SearchQuery(query, FIELDS);
    }
}
