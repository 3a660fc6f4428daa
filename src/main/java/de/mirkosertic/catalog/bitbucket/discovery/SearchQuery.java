package de.mirkosertic.catalog.bitbucket.discovery;

/**
 * A code search query together with the partial-response field selection.
 */
public record SearchQuery(String query, String fields) {
}
