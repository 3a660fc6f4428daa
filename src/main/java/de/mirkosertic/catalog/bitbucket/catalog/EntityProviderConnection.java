package de.mirkosertic.catalog.bitbucket.catalog;

import java.io.IOException;

/**
 * Channel through which a provider pushes mutations into the catalog.
 */
public interface EntityProviderConnection {

    void applyMutation(EntityMutation mutation) throws IOException;
}
