package de.mirkosertic.catalog.bitbucket;

/**
 * Thrown when a refresh is requested before the provider was connected to the catalog.
 */
public class NotInitializedException extends CatalogProviderException {

    public NotInitializedException() {
        super("Not initialized");
    }
}
