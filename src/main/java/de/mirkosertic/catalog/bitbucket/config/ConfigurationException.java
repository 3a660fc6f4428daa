package de.mirkosertic.catalog.bitbucket.config;

import de.mirkosertic.catalog.bitbucket.CatalogProviderException;

/**
 * Invalid or incomplete configuration. Raised while providers are being created.
 */
public class ConfigurationException extends CatalogProviderException {

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
