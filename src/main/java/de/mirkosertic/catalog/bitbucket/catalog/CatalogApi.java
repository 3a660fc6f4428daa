package de.mirkosertic.catalog.bitbucket.catalog;

import java.io.IOException;
import java.util.List;

/**
 * Read and refresh access to the catalog. Every call needs a bearer token from a {@link TokenManager}.
 */
public interface CatalogApi {

    List<LocationEntity> getEntities(EntityFilter filter, String token) throws IOException;

    /**
     * Asks the catalog to re-process the entity identified by {@code entityRef}.
     */
    void refreshEntity(String entityRef, String token) throws IOException;
}
