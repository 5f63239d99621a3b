package io.mcp.client.http.jdk;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

import io.mcp.client.http.HttpClient;
import io.mcp.client.http.HttpResponse;
import io.mcp.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * {@link HttpClient} backed by {@code java.net.http.HttpClient}. Instances are thread-safe and
 * meant to be shared.
 */
public class JdkHttpClient implements HttpClient {

    private final java.net.http.HttpClient httpClient;
    private final String baseUrl;

    JdkHttpClient(String baseUrl) {
        this(baseUrl, null);
    }

    JdkHttpClient(String baseUrl, @Nullable Duration connectTimeout) {
        java.net.http.HttpClient.Builder builder = java.net.http.HttpClient.newBuilder()
                .version(java.net.http.HttpClient.Version.HTTP_1_1)
                .followRedirects(java.net.http.HttpClient.Redirect.NORMAL);
        if (connectTimeout != null) {
            builder.connectTimeout(connectTimeout);
        }
        this.httpClient = builder.build();

        URL targetUrl = buildUrl(baseUrl);
        this.baseUrl = targetUrl.getProtocol() + "://" + targetUrl.getAuthority();
    }

    String getBaseUrl() {
        return baseUrl;
    }

    private static URL buildUrl(String uri) {
        try {
            return URI.create(uri).toURL();
        } catch (MalformedURLException | IllegalArgumentException e) {
            throw new IllegalArgumentException("URI [" + uri + "] is not valid", e);
        }
    }

    @Override
    public GetRequestBuilder get(String path) {
        return new JdkGetRequestBuilder(path);
    }

    @Override
    public PostRequestBuilder post(String path) {
        return new JdkPostRequestBuilder(path);
    }

    @Override
    public DeleteRequestBuilder delete(String path) {
        return new JdkDeleteBuilder(path);
    }

    /**
     * {@code java.net.http} sends a {@code GET} or {@code HEAD} a second time when the connection
     * closes before any response byte was read. No per-client setting turns this off.
     */
    @Override
    public int maxSendsOnConnectionFailure(String method) {
        return "GET".equals(method) || "HEAD".equals(method) ? 2 : 1;
    }

    private abstract class JdkRequestBuilder<T extends RequestBuilder<T>> implements RequestBuilder<T> {
        private final String path;
        protected final Map<String, String> headers = new LinkedHashMap<>();
        private @Nullable Duration timeout;

        JdkRequestBuilder(String path) {
            this.path = path;
        }

        @Override
        public T addHeader(String name, String value) {
            headers.put(name, value);
            return self();
        }

        @Override
        public T addHeaders(Map<String, String> headers) {
            if (headers != null && !headers.isEmpty()) {
                for (Map.Entry<String, String> entry : headers.entrySet()) {
                    addHeader(entry.getKey(), entry.getValue());
                }
            }
            return self();
        }

        @Override
        public T timeout(Duration timeout) {
            Assert.checkNotNullParam("timeout", timeout);
            if (timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException("Timeout must be positive: " + timeout);
            }
            this.timeout = timeout;
            return self();
        }

        @SuppressWarnings("unchecked")
        T self() {
            return (T) this;
        }

        protected HttpRequest.Builder createRequestBuilder() {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path));
            for (Map.Entry<String, String> headerEntry : headers.entrySet()) {
                builder.header(headerEntry.getKey(), headerEntry.getValue());
            }
            if (timeout != null) {
                builder.timeout(timeout);
            }
            return builder;
        }

        protected CompletableFuture<HttpResponse> exchange(HttpRequest request) {
            CompletableFuture<java.net.http.HttpResponse<byte[]>> exchange =
                    httpClient.sendAsync(request, BodyHandlers.ofByteArray());
            CompletableFuture<HttpResponse> result = exchange.thenApply(JdkHttpResponse::new);
            // cancellation of a dependent stage does not reach the exchange on its own
            result.whenComplete((response, failure) -> {
                if (failure instanceof CancellationException) {
                    exchange.cancel(true);
                }
            });
            return result;
        }
    }

    private class JdkGetRequestBuilder extends JdkRequestBuilder<GetRequestBuilder> implements GetRequestBuilder {

        JdkGetRequestBuilder(String path) {
            super(path);
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            return exchange(createRequestBuilder().GET().build());
        }
    }

    private class JdkDeleteBuilder extends JdkRequestBuilder<DeleteRequestBuilder> implements DeleteRequestBuilder {

        JdkDeleteBuilder(String path) {
            super(path);
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            return exchange(createRequestBuilder().DELETE().build());
        }
    }

    private class JdkPostRequestBuilder extends JdkRequestBuilder<PostRequestBuilder> implements PostRequestBuilder {
        private String body = "";

        JdkPostRequestBuilder(String path) {
            super(path);
        }

        @Override
        public PostRequestBuilder body(@Nullable String body) {
            this.body = body == null ? "" : body;
            return this;
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            HttpRequest request = createRequestBuilder()
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                    .build();
            return exchange(request);
        }
    }

    private record JdkHttpResponse(java.net.http.HttpResponse<byte[]> response) implements HttpResponse {

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public byte[] body() {
            byte[] body = response.body();
            return body == null ? new byte[0] : body;
        }
    }
}
