package de.mirkosertic.catalog.bitbucket;

/**
 * Aggregate failure of a batch of catalog operations. The cause is the first failure
 * observed in submission order.
 */
public class MutationFailedException extends CatalogProviderException {

    private final int failedCount;

    public MutationFailedException(final String message, final Throwable cause, final int failedCount) {
        super(message, cause);
        this.failedCount = failedCount;
    }

    public int getFailedCount() {
        return failedCount;
    }
}
