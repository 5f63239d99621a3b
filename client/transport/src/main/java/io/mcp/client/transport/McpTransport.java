package io.mcp.client.transport;

import static io.mcp.util.Assert.checkNotNullParam;

import java.net.ConnectException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;

import com.fasterxml.jackson.core.type.TypeReference;
import io.mcp.client.http.HttpClient;
import io.mcp.client.http.HttpResponse;
import io.mcp.spec.ConnectionError;
import io.mcp.spec.Envelope;
import io.mcp.spec.MCPApiException;
import io.mcp.spec.MCPError;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends requests to an MCP server and retries the ones that failed transiently.
 * <p>
 * A call is bounded by a single deadline, the configured timeout or the one of its
 * {@link ClientCallContext}. Each attempt may use the time left until the deadline, and no
 * retry is scheduled whose backoff would end past it. Connection failures and 5xx responses
 * are retried, with at most {@code 1 + }{@link RetryPolicy#maxRetries()} requests reaching the
 * server; sends the {@link HttpClient} performs on its own count against that bound, see
 * {@link HttpClient#maxSendsOnConnectionFailure(String)}. Once retries are exhausted the last
 * failure or response is returned as it is. Backoff never blocks a thread.
 * <p>
 * Retries also apply to {@code POST} requests, so a request whose response was lost may be
 * processed twice by the server.
 * <p>
 * Instances are immutable and safe for concurrent use.
 */
public class McpTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(McpTransport.class);

    public static final String VERSION = "1.0.0";
    public static final String USER_AGENT = "mcp-java-sdk/" + VERSION;

    private static final String EMPTY_JSON_OBJECT = "{}";

    private final HttpClient httpClient;
    private final String basePath;
    private final TransportConfig config;
    private final DoubleSupplier random;

    public McpTransport(String baseUrl) {
        this(baseUrl, new TransportConfig());
    }

    public McpTransport(String baseUrl, TransportConfig config) {
        this(null, baseUrl, config);
    }

    public McpTransport(@Nullable HttpClient httpClient, String baseUrl, TransportConfig config) {
        this(httpClient, baseUrl, config, () -> ThreadLocalRandom.current().nextDouble());
    }

    McpTransport(@Nullable HttpClient httpClient, String baseUrl, TransportConfig config, DoubleSupplier random) {
        checkNotNullParam("baseUrl", baseUrl);
        checkNotNullParam("config", config);
        checkNotNullParam("random", random);
        this.config = config;
        this.random = random;
        this.httpClient = httpClient == null ? config.getHttpClientBuilder().create(baseUrl) : httpClient;
        String path = URI.create(baseUrl).getPath();
        if (path == null) {
            path = "";
        }

        // Strip the last slash if one is provided
        if (path.endsWith("/")) {
            this.basePath = path.substring(0, path.length() - 1);
        } else {
            this.basePath = path;
        }
    }

    public TransportConfig getConfig() {
        return config;
    }

    String getBasePath() {
        return basePath;
    }

    /**
     * Performs a request, retrying transient failures.
     * <p>
     * The returned future completes with the last response received, whatever its status, or
     * fails with a {@link ConnectionError} if no response was obtained. Cancelling it aborts the
     * attempt in flight and any pending retry.
     *
     * @param method the HTTP method
     * @param path the endpoint path, starting with {@code /}, with its query string if any
     * @param body the JSON request body; {@code POST} requests without one send an empty object
     * @param context per-call headers and timeout, may be {@code null}
     * @return the future response
     */
    public CompletableFuture<RawResponse> requestAsync(HttpMethod method, String path, @Nullable String body,
            @Nullable ClientCallContext context) {
        return call(method, path, body, context).result;
    }

    RetryingCall call(HttpMethod method, String path, @Nullable String body, @Nullable ClientCallContext context) {
        checkNotNullParam("method", method);
        checkNotNullParam("path", path);
        Duration timeout = config.getTimeout();
        if (context != null && context.getTimeout() != null) {
            timeout = context.getTimeout();
        }
        RetryingCall call = new RetryingCall(method, basePath + path, body, requestHeaders(context), timeout);
        call.start();
        return call;
    }

    /**
     * Blocking variant of {@link #requestAsync}. Interrupting the calling thread aborts the call.
     *
     * @throws ConnectionError if no response was obtained, or the call was interrupted
     */
    public RawResponse request(HttpMethod method, String path, @Nullable String body,
            @Nullable ClientCallContext context) throws ConnectionError {
        CompletableFuture<RawResponse> future = requestAsync(method, path, body, context);
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ConnectionError(e);
        } catch (CancellationException e) {
            throw new ConnectionError(e);
        } catch (ExecutionException e) {
            MCPApiException error = ErrorClassifier.classify(e);
            if (error instanceof ConnectionError connectionError) {
                throw connectionError;
            }
            throw new ConnectionError(error);
        }
    }

    /**
     * Performs a request and decodes its envelope. The future fails with an {@link MCPError}
     * when the response reports a failure and with a {@link ConnectionError} when there was no
     * response.
     */
    public CompletableFuture<McpResponse> exchangeAsync(HttpMethod method, String path, @Nullable String body,
            @Nullable ClientCallContext context) {
        CompletableFuture<RawResponse> raw = requestAsync(method, path, body, context);
        CompletableFuture<McpResponse> result = raw.thenCompose(response -> {
            try {
                return CompletableFuture.completedFuture(toMcpResponse(response));
            } catch (MCPError e) {
                return CompletableFuture.failedFuture(e);
            }
        });
        result.whenComplete((response, failure) -> {
            if (failure instanceof CancellationException) {
                raw.cancel(true);
            }
        });
        return result;
    }

    /**
     * Blocking request with envelope decoding.
     *
     * @throws MCPError if a response arrived but reports a failure
     * @throws ConnectionError if no response was obtained
     */
    public McpResponse exchange(HttpMethod method, String path, @Nullable String body,
            @Nullable ClientCallContext context) throws MCPApiException {
        return toMcpResponse(request(method, path, body, context));
    }

    /**
     * Blocking request whose payload is mapped to {@code type}.
     */
    public <T> T exchange(HttpMethod method, String path, @Nullable String body,
            @Nullable ClientCallContext context, TypeReference<T> type) throws MCPApiException {
        return exchange(method, path, body, context).payloadAs(type);
    }

    public <T> T exchange(HttpMethod method, String path, @Nullable String body,
            @Nullable ClientCallContext context, Class<T> type) throws MCPApiException {
        return exchange(method, path, body, context).payloadAs(type);
    }

    /**
     * URL-encodes one path segment supplied by a caller, such as a task id or plugin name.
     */
    public static String encodePathSegment(String segment) {
        checkNotNullParam("segment", segment);
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    public static String encodeQueryValue(String value) {
        checkNotNullParam("value", value);
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static McpResponse toMcpResponse(RawResponse response) throws MCPError {
        Envelope envelope = EnvelopeParser.decode(response.body());
        String rawBody = response.bodyAsString();
        MCPError error = ErrorClassifier.classify(response.statusCode(), envelope, rawBody);
        if (error != null) {
            throw error;
        }
        return new McpResponse(response.statusCode(), envelope, rawBody);
    }

    private Map<String, String> requestHeaders(@Nullable ClientCallContext context) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HttpClient.CONTENT_TYPE, HttpClient.APPLICATION_JSON);
        headers.put(HttpClient.ACCEPT, HttpClient.APPLICATION_JSON);
        headers.put(HttpClient.USER_AGENT, USER_AGENT);
        headers.putAll(config.getHeaders());
        if (context != null) {
            headers.putAll(context.getHeaders());
        }
        return headers;
    }

    /**
     * State of one logical call across its attempts.
     */
    final class RetryingCall {
        private final HttpMethod method;
        private final String path;
        private final @Nullable String body;
        private final Map<String, String> headers;
        private final Duration timeout;
        private final long deadline;
        private final CompletableFuture<RawResponse> result = new CompletableFuture<>();
        private final CompletableFuture<Void> deadlineTimer = new CompletableFuture<>();
        // the attempt in flight or the pending backoff
        private volatile @Nullable Future<?> pending;
        // requests that may have reached the server so far
        private int sends;

        RetryingCall(HttpMethod method, String path, @Nullable String body, Map<String, String> headers, Duration timeout) {
            this.method = method;
            this.path = path;
            this.body = body;
            this.headers = headers;
            this.timeout = timeout;
            this.deadline = System.nanoTime() + timeout.toNanos();
        }

        void start() {
            result.whenComplete((response, failure) -> {
                deadlineTimer.cancel(false);
                Future<?> current = pending;
                if (current != null && !current.isDone()) {
                    current.cancel(true);
                }
            });
            // the per-attempt timeout only covers the response headers, this bounds the rest
            deadlineTimer.completeOnTimeout(null, timeout.toNanos(), TimeUnit.NANOSECONDS)
                    .thenRun(() -> result.completeExceptionally(timedOut()));
            attempt(0);
        }

        CompletableFuture<RawResponse> result() {
            return result;
        }

        boolean deadlineCleared() {
            return deadlineTimer.isCancelled();
        }

        private ConnectionError timedOut() {
            return new ConnectionError(
                    new HttpTimeoutException(method + " " + path + " timed out after " + timeout.toMillis() + " ms"));
        }

        private void attempt(int attempt) {
            if (result.isDone()) {
                return;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                result.completeExceptionally(timedOut());
                return;
            }
            long started = System.nanoTime();
            CompletableFuture<HttpResponse> exchange;
            try {
                exchange = send(Duration.ofNanos(remaining));
            } catch (RuntimeException e) {
                exchange = CompletableFuture.failedFuture(e);
            }
            pending = exchange;
            if (result.isDone()) {
                exchange.cancel(true);
                return;
            }
            exchange.whenComplete((response, failure) -> completed(attempt, started, response, failure));
        }

        private CompletableFuture<HttpResponse> send(Duration attemptTimeout) {
            switch (method) {
                case GET:
                    return httpClient.get(path).addHeaders(headers).timeout(attemptTimeout).send();
                case DELETE:
                    return httpClient.delete(path).addHeaders(headers).timeout(attemptTimeout).send();
                case POST:
                    return httpClient.post(path).addHeaders(headers).timeout(attemptTimeout)
                            .body(body == null ? EMPTY_JSON_OBJECT : body)
                            .send();
                default:
                    throw new IllegalStateException("Unsupported method " + method);
            }
        }

        private void completed(int attempt, long started, @Nullable HttpResponse response, @Nullable Throwable failure) {
            if (result.isDone()) {
                return;
            }
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            if (failure != null || response == null) {
                MCPApiException error = failure == null
                        ? new ConnectionError(new IllegalStateException("No response"))
                        : ErrorClassifier.classify(failure);
                LOGGER.debug("{} {} failed after {} ms (attempt {}): {}", method, path, elapsedMillis, attempt + 1,
                        error.getMessage());
                retryOrFinish(attempt, sendsOnFailure(error), error.isTransient(), error.getMessage(),
                        () -> result.completeExceptionally(error));
                return;
            }
            RawResponse raw = new RawResponse(response.statusCode(), response.body());
            LOGGER.debug("{} {} -> {} in {} ms (attempt {})", method, path, raw.statusCode(), elapsedMillis, attempt + 1);
            retryOrFinish(attempt, 1, ErrorClassifier.isRetryable(raw.statusCode()), "HTTP " + raw.statusCode(),
                    () -> result.complete(raw));
        }

        /**
         * Requests that may have reached the server for an attempt that got no response. A refused
         * connection or a timeout is never sent again by the HTTP client itself.
         */
        private int sendsOnFailure(MCPApiException error) {
            for (Throwable cause = error.getCause(); cause != null; cause = cause.getCause()) {
                if (cause instanceof ConnectException || cause instanceof HttpTimeoutException) {
                    return 1;
                }
            }
            return Math.max(1, httpClient.maxSendsOnConnectionFailure(method.name()));
        }

        /**
         * At most {@code 1 + maxRetries} requests reach the server. The next attempt is assumed
         * to cost as many sends as the last one did.
         */
        private void retryOrFinish(int attempt, int attemptSends, boolean retryable, String reason, Runnable finish) {
            sends += attemptSends;
            RetryPolicy policy = config.getRetryPolicy();
            if (!retryable) {
                finish.run();
                return;
            }
            if (sends + attemptSends > policy.maxRetries() + 1) {
                LOGGER.debug("{} {} not retried: {} of {} requests sent", method, path, sends, policy.maxRetries() + 1);
                finish.run();
                return;
            }
            Duration delay = policy.delayFor(attempt, random);
            if (delay.toNanos() >= deadline - System.nanoTime()) {
                LOGGER.debug("{} {} not retried: a backoff of {} ms would pass the deadline", method, path, delay.toMillis());
                finish.run();
                return;
            }
            LOGGER.warn("{} {} failed on attempt {} ({}), retrying in {} ms", method, path, attempt + 1, reason,
                    delay.toMillis());
            CompletableFuture<Void> backoff = new CompletableFuture<Void>()
                    .completeOnTimeout(null, delay.toNanos(), TimeUnit.NANOSECONDS);
            pending = backoff;
            backoff.thenRunAsync(() -> attempt(attempt + 1));
            if (result.isDone()) {
                backoff.cancel(true);
            }
        }
    }
}
