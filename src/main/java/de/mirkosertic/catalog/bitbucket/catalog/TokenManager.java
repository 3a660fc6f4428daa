package de.mirkosertic.catalog.bitbucket.catalog;

import java.io.IOException;

/**
 * Issues short-lived bearer tokens for {@link CatalogApi} calls.
 */
public interface TokenManager {

    Token getToken() throws IOException;

    record Token(String token) {
    }
}
