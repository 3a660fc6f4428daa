package de.mirkosertic.catalog.bitbucket;

/**
 * Raised (once per provider instance) when a push event arrives but the collaborators
 * required for delta refreshes are missing.
 */
public class EventHandlingMisconfiguredException extends CatalogProviderException {

    public EventHandlingMisconfiguredException(final String providerName) {
        super(providerName + " not well configured to handle repo:push. Missing CatalogApi and/or TokenManager.");
    }
}
