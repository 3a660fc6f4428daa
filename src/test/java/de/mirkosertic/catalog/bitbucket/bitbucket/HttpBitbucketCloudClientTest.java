package de.mirkosertic.catalog.bitbucket.bitbucket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import de.mirkosertic.catalog.bitbucket.bitbucket.model.CodeSearchResult;
import de.mirkosertic.catalog.bitbucket.config.BitbucketCloudIntegrationConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HttpBitbucketCloudClient Tests")
class HttpBitbucketCloudClientTest {

    private static final String SEARCH_PATH = "/2.0/workspaces/ws/search/code";

    private HttpServer server;
    private String baseUrl;
    private final List<String> requestedQueries = new CopyOnWriteArrayList<>();
    private final List<String> authHeaders = new CopyOnWriteArrayList<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort() + "/2.0";
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private HttpBitbucketCloudClient client(final String username, final String appPassword) {
        return new HttpBitbucketCloudClient(
                new BitbucketCloudIntegrationConfig(BitbucketCloudIntegrationConfig.HOST, baseUrl, username, appPassword),
                HttpClient.newHttpClient(),
                new ObjectMapper());
    }

    private void respond(final HttpExchange exchange, final int status, final String body) throws IOException {
        requestedQueries.add(exchange.getRequestURI().getRawQuery());
        final String auth = exchange.getRequestHeaders().getFirst("Authorization");
        authHeaders.add(auth == null ? "<none>" : auth);
        final byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (final OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static String result(final String slug, final String path, final boolean pathMatch) {
        return """
                {
                  "type": "code_search_result",
                  "content_match_count": 0,
                  "path_matches": %s,
                  "file": {
                    "path": "%s",
                    "type": "commit_file",
                    "commit": {
                      "hash": "abc",
                      "repository": {
                        "slug": "%s",
                        "project": {"key": "TEAM"},
                        "mainbranch": {"name": "main"},
                        "links": {"html": {"href": "https://bitbucket.org/ws/%s"}}
                      }
                    }
                  }
                }
                """.formatted(pathMatch ? "[{\"text\": \"" + path + "\", \"match\": true}]" : "[]", path, slug, slug);
    }

    @Test
    @DisplayName("Should follow next links across pages")
    void shouldFollowPagination() {
        server.createContext(SEARCH_PATH, exchange -> {
            final String query = exchange.getRequestURI().getRawQuery();
            if (query.contains("page=2")) {
                respond(exchange, 200, "{\"values\": [" + result("billing", "catalog-info.yaml", true) + "]}");
            } else {
                respond(exchange, 200, "{\"values\": [" + result("orders", "catalog-info.yaml", true) + "],"
                        + "\"next\": \"" + baseUrl + "/workspaces/ws/search/code?page=2\"}");
            }
        });

        final List<CodeSearchResult> results = new ArrayList<>();
        client(null, null).searchCode("ws", "\"catalog-info.yaml\" path:/catalog-info.yaml", "")
                .forEach(results::add);

        assertThat(results).extracting(r -> r.repository().slug()).containsExactly("orders", "billing");
        assertThat(results.get(0).isPathMatch()).isTrue();
        assertThat(results.get(0).repository().webUrl()).isEqualTo("https://bitbucket.org/ws/orders");
        assertThat(requestedQueries).hasSize(2);
    }

    @Test
    @DisplayName("Should skip empty pages")
    void shouldSkipEmptyPages() {
        server.createContext(SEARCH_PATH, exchange -> {
            final String query = exchange.getRequestURI().getRawQuery();
            if (query.contains("page=3")) {
                respond(exchange, 200, "{\"values\": [" + result("orders", "catalog-info.yaml", false) + "]}");
            } else if (query.contains("page=2")) {
                respond(exchange, 200, "{\"values\": [], \"next\": \"" + baseUrl + "/workspaces/ws/search/code?page=3\"}");
            } else {
                respond(exchange, 200, "{\"values\": [], \"next\": \"" + baseUrl + "/workspaces/ws/search/code?page=2\"}");
            }
        });

        final Iterator<CodeSearchResult> iterator = client(null, null).searchCode("ws", "q", "").iterator();

        assertThat(iterator.hasNext()).isTrue();
        assertThat(iterator.next().isPathMatch()).isFalse();
        assertThat(iterator.hasNext()).isFalse();
    }

    @Test
    @DisplayName("Should fetch nothing before iteration starts")
    void shouldBeLazy() {
        server.createContext(SEARCH_PATH, exchange -> respond(exchange, 200, "{\"values\": []}"));

        final Iterable<CodeSearchResult> results = client(null, null).searchCode("ws", "q", "");

        assertThat(requestedQueries).isEmpty();
        assertThat(results.iterator().hasNext()).isFalse();
        assertThat(requestedQueries).hasSize(1);
    }

    @Test
    @DisplayName("Should encode query and fields")
    void shouldEncodeQueryParameters() {
        server.createContext(SEARCH_PATH, exchange -> respond(exchange, 200, "{\"values\": []}"));

        client(null, null).searchCode("ws", "\"catalog-info.yaml\" path:/catalog-info.yaml repo:orders",
                "+values.file.commit.repository.slug").iterator().hasNext();

        assertThat(requestedQueries).singleElement().isEqualTo(
                "search_query=%22catalog-info.yaml%22%20path%3A%2Fcatalog-info.yaml%20repo%3Aorders"
                        + "&fields=%2Bvalues.file.commit.repository.slug");
    }

    @Test
    @DisplayName("Should send basic auth when credentials are configured")
    void shouldSendBasicAuth() {
        server.createContext(SEARCH_PATH, exchange -> respond(exchange, 200, "{\"values\": []}"));

        client("user", "secret").searchCode("ws", "q", "").iterator().hasNext();

        final String expected = "Basic " + Base64.getEncoder()
                .encodeToString("user:secret".getBytes(StandardCharsets.UTF_8));
        assertThat(authHeaders).containsExactly(expected);
    }

    @Test
    @DisplayName("Should call anonymously without credentials")
    void shouldCallAnonymously() {
        server.createContext(SEARCH_PATH, exchange -> respond(exchange, 200, "{\"values\": []}"));

        client(null, null).searchCode("ws", "q", "").iterator().hasNext();

        assertThat(authHeaders).containsExactly("<none>");
    }

    @Test
    @DisplayName("Should report non 2xx responses with status code")
    void shouldFailOnErrorStatus() {
        server.createContext(SEARCH_PATH, exchange -> respond(exchange, 403, "{\"error\": {\"message\": \"denied\"}}"));

        final Iterator<CodeSearchResult> iterator = client(null, null).searchCode("ws", "q", "").iterator();

        assertThatThrownBy(iterator::hasNext)
                .isInstanceOfSatisfying(BitbucketApiException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(403))
                .hasMessageContaining("HTTP 403");
    }

    @Test
    @DisplayName("Should report malformed JSON")
    void shouldFailOnMalformedJson() {
        server.createContext(SEARCH_PATH, exchange -> respond(exchange, 200, "not json"));

        final Iterator<CodeSearchResult> iterator = client(null, null).searchCode("ws", "q", "").iterator();

        assertThatThrownBy(iterator::hasNext)
                .isInstanceOf(BitbucketApiException.class)
                .hasMessageContaining("Malformed JSON");
    }
}
