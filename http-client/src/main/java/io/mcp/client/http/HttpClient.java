package io.mcp.client.http;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

/**
 * Raw HTTP access to one server origin.
 * <p>
 * Paths given to the request builders are appended to the origin the client was created for.
 * A returned future completes with the response for every HTTP status; it completes
 * exceptionally only when no response was obtained. Cancelling the future aborts the exchange.
 */
public interface HttpClient {

    /** HTTP Content-Type header name. */
    String CONTENT_TYPE = "Content-Type";
    /** JSON content type value. */
    String APPLICATION_JSON = "application/json";
    /** HTTP Accept header name. */
    String ACCEPT = "Accept";
    /** HTTP User-Agent header name. */
    String USER_AGENT = "User-Agent";

    static HttpClient createHttpClient(String baseUrl) {
        return HttpClientBuilder.DEFAULT_FACTORY.create(baseUrl);
    }

    GetRequestBuilder get(String path);

    PostRequestBuilder post(String path);

    DeleteRequestBuilder delete(String path);

    /**
     * The number of times one request with the given method may reach the server when its
     * connection fails, counting sends the client performs on its own before reporting the
     * failure.
     *
     * @param method the HTTP method name
     * @return at least {@code 1}
     */
    default int maxSendsOnConnectionFailure(String method) {
        return 1;
    }

    interface RequestBuilder<T extends RequestBuilder<T>> {
        CompletableFuture<HttpResponse> send();

        T addHeader(String name, String value);

        T addHeaders(Map<String, String> headers);

        /**
         * Bounds the time until the response headers arrive.
         *
         * @param timeout the timeout, must be positive
         * @return this builder for chaining
         */
        T timeout(Duration timeout);
    }

    interface GetRequestBuilder extends RequestBuilder<GetRequestBuilder> {

    }

    interface PostRequestBuilder extends RequestBuilder<PostRequestBuilder> {
        PostRequestBuilder body(@Nullable String body);

        default CompletableFuture<HttpResponse> send(String body) {
            return this.body(body).send();
        }
    }

    interface DeleteRequestBuilder extends RequestBuilder<DeleteRequestBuilder> {

    }
}
