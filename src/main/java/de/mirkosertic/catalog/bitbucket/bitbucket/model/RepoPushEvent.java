package de.mirkosertic.catalog.bitbucket.bitbucket.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Webhook payload of a {@code repo:push}. Only the repository is read; the push details
 * (changes, commits) are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RepoPushEvent(Repository repository) {
}
