package de.mirkosertic.catalog.bitbucket.discovery;

import de.mirkosertic.catalog.bitbucket.bitbucket.BitbucketCloudClient;
import de.mirkosertic.catalog.bitbucket.bitbucket.model.CodeSearchResult;
import de.mirkosertic.catalog.bitbucket.bitbucket.model.Repository;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Finds catalog files through the Bitbucket Cloud code search.
 * <p>
 * Results are streamed: pages are requested while the stream is consumed, so a caller that
 * stops early does not fetch the remaining pages. The stream can be consumed once.
 * A failing page request surfaces as {@link de.mirkosertic.catalog.bitbucket.bitbucket.BitbucketApiException}
 * from the terminal operation and is not retried here.
 */
public class CatalogFileScanner {

    private static final Logger logger = LoggerFactory.getLogger(CatalogFileScanner.class);

    private final BitbucketCloudClient client;
    private final RepositoryFilter repositoryFilter;

    public CatalogFileScanner(final BitbucketCloudClient client, final RepositoryFilter repositoryFilter) {
        this.client = client;
        this.repositoryFilter = repositoryFilter;
    }

    /**
     * @param workspace   workspace slug
     * @param catalogPath configured catalog path
     * @param repoSlug    scan only this repository, or {@code null} for the whole workspace
     */
    public Stream<DiscoveryTarget> scan(final String workspace,
                                        final String catalogPath,
                                        final @Nullable String repoSlug) {
        final SearchQuery searchQuery = SearchQueryBuilder.build(catalogPath, repoSlug);
        logger.debug("Searching workspace {} with query {}", workspace, searchQuery.query());

        final Iterable<CodeSearchResult> results = client.searchCode(workspace, searchQuery.query(), searchQuery.fields());

        return StreamSupport.stream(results.spliterator(), false)
                // not a file match, but a code match
                .filter(CodeSearchResult::isPathMatch)
                .filter(this::isInScope)
                .map(CatalogFileScanner::toTarget);
    }

    private boolean isInScope(final CodeSearchResult result) {
        final Repository repository = result.repository();
        if (repository == null || result.file().path() == null) {
            logger.warn("Incomplete search result {}, skipping", result);
            return false;
        }
        return repositoryFilter.matches(repository);
    }

    private static DiscoveryTarget toTarget(final CodeSearchResult result) {
        final Repository repository = result.repository();
        return new DiscoveryTarget(
                FileUrlResolver.resolve(repository, result.file().path()),
                repository.webUrl()
        );
    }
}
