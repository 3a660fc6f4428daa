package de.mirkosertic.catalog.bitbucket.bitbucket;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.catalog.bitbucket.bitbucket.model.CodeSearchResult;
import de.mirkosertic.catalog.bitbucket.bitbucket.model.Page;
import de.mirkosertic.catalog.bitbucket.config.BitbucketCloudIntegrationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;

/**
 * {@link BitbucketCloudClient} on top of the JDK HTTP client and Jackson.
 * <p>
 * Uses HTTP basic authentication with username and app password when both are configured,
 * otherwise calls the API anonymously (public repositories only).
 */
public class HttpBitbucketCloudClient implements BitbucketCloudClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpBitbucketCloudClient.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final BitbucketCloudIntegrationConfig integration;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final JavaType searchResultListType;

    public HttpBitbucketCloudClient(final BitbucketCloudIntegrationConfig integration) {
        this(integration, HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build(), new ObjectMapper());
    }

    HttpBitbucketCloudClient(final BitbucketCloudIntegrationConfig integration,
                             final HttpClient httpClient,
                             final ObjectMapper objectMapper) {
        this.integration = integration;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.searchResultListType = objectMapper.getTypeFactory()
                .constructCollectionType(List.class, CodeSearchResult.class);
    }

    @Override
    public Iterable<CodeSearchResult> searchCode(final String workspace, final String query, final String fields) {
        final StringBuilder url = new StringBuilder(integration.apiBaseUrl())
                .append("/workspaces/").append(encode(workspace))
                .append("/search/code?search_query=").append(encode(query));
        if (!fields.isEmpty()) {
            url.append("&fields=").append(encode(fields));
        }
        final String firstPageUrl = url.toString();

        return () -> new PagedIterator<>(firstPageUrl, this::fetchSearchPage);
    }

    private Page<CodeSearchResult> fetchSearchPage(final String pageUrl) {
        final JsonNode body = getJson(pageUrl);

        final JsonNode values = body.get("values");
        final List<CodeSearchResult> results = values == null || values.isNull()
                ? List.of()
                : objectMapper.convertValue(values, searchResultListType);

        final JsonNode next = body.get("next");
        final String nextUrl = next == null || next.isNull() ? null : next.asText();

        logger.debug("Fetched search page with {} results (hasNext={})", results.size(), nextUrl != null);
        return new Page<>(results, nextUrl);
    }

    private JsonNode getJson(final String url) {
        final HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(url))
                .header("Accept", "application/json")
                .GET();
        if (integration.hasCredentials()) {
            request.header("Authorization", basicAuth(integration.username(), integration.appPassword()));
        }

        final HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (final IOException e) {
            throw new BitbucketApiException("Request to " + url + " failed", e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BitbucketApiException("Interrupted while requesting " + url, e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new BitbucketApiException("Bitbucket Cloud API returned HTTP " + response.statusCode()
                    + " for " + url + ": " + response.body(), response.statusCode());
        }

        try {
            return objectMapper.readTree(response.body());
        } catch (final IOException e) {
            throw new BitbucketApiException("Malformed JSON response from " + url, e);
        }
    }

    private static String basicAuth(final String username, final String password) {
        final String credentials = username + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    private static String encode(final String value) {
        // URLEncoder produces form encoding, the API wants %20 for spaces
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
