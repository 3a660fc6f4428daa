package de.mirkosertic.catalog.bitbucket.bitbucket;

import de.mirkosertic.catalog.bitbucket.CatalogProviderException;

/**
 * Failure talking to the Bitbucket Cloud REST API. Unchecked because it may surface
 * lazily while search results are iterated.
 */
public class BitbucketApiException extends CatalogProviderException {

    /** HTTP status, or {@code -1} if no response was received. */
    private final int statusCode;

    public BitbucketApiException(final String message, final int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public BitbucketApiException(final String message, final Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
