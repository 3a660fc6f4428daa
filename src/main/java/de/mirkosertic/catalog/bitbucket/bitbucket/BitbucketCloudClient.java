package de.mirkosertic.catalog.bitbucket.bitbucket;

import de.mirkosertic.catalog.bitbucket.bitbucket.model.CodeSearchResult;

/**
 * The parts of the Bitbucket Cloud API used for catalog discovery.
 */
public interface BitbucketCloudClient {

    /**
     * Searches code in a workspace.
     * <p>
     * The returned iterable is lazy: pages are fetched while iterating, and each call to
     * {@link Iterable#iterator()} starts again at the first page. Fetch failures are thrown
     * from {@code hasNext()}/{@code next()} as {@link BitbucketApiException}.
     *
     * @param workspace workspace slug
     * @param query     Bitbucket code search query
     * @param fields    partial response field selection, may be empty
     */
    Iterable<CodeSearchResult> searchCode(String workspace, String query, String fields);
}
