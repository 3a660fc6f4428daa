package de.mirkosertic.catalog.bitbucket.catalog;

import java.io.IOException;

public interface EntityProvider {

    /**
     * Unique name, also used as location key of every entity the provider emits.
     */
    String getProviderName();

    void connect(EntityProviderConnection connection) throws IOException;
}
