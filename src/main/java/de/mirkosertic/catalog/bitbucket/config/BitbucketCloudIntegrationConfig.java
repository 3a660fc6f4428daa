package de.mirkosertic.catalog.bitbucket.config;

import org.jspecify.annotations.Nullable;

/**
 * Connection settings for Bitbucket Cloud.
 */
public record BitbucketCloudIntegrationConfig(
        String host,
        String apiBaseUrl,
        @Nullable String username,
        @Nullable String appPassword
) {
    public static final String HOST = "bitbucket.org";
    public static final String API_BASE_URL = "https://api.bitbucket.org/2.0";

    public static BitbucketCloudIntegrationConfig anonymous() {
        return new BitbucketCloudIntegrationConfig(HOST, API_BASE_URL, null, null);
    }

    public boolean hasCredentials() {
        return username != null && !username.isEmpty() && appPassword != null && !appPassword.isEmpty();
    }

    @Override
    public String toString() {
        // never log the app password
        return "BitbucketCloudIntegrationConfig[host=" + host + ", apiBaseUrl=" + apiBaseUrl
                + ", username=" + username + ", appPassword=" + (appPassword == null ? "null" : "***") + "]";
    }
}
