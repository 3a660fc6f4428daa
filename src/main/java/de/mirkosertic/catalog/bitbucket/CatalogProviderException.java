package de.mirkosertic.catalog.bitbucket;

/**
 * Base class of all failures raised by the Bitbucket Cloud catalog provider.
 */
public class CatalogProviderException extends RuntimeException {

    public CatalogProviderException(final String message) {
        super(message);
    }

    public CatalogProviderException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
