package io.mcp.client.transport;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import io.mcp.client.http.HttpClientBuilder;
import io.mcp.util.Assert;

/**
 * Settings of a {@link McpTransport}. Instances are immutable; use {@link TransportConfigBuilder}.
 */
public class TransportConfig {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final Duration timeout;
    private final RetryPolicy retryPolicy;
    private final Map<String, String> headers;
    private final HttpClientBuilder httpClientBuilder;

    public TransportConfig(Duration timeout, RetryPolicy retryPolicy, Map<String, String> headers,
            HttpClientBuilder httpClientBuilder) {
        Assert.checkNotNullParam("timeout", timeout);
        Assert.checkNotNullParam("retryPolicy", retryPolicy);
        Assert.checkNotNullParam("headers", headers);
        Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        this.timeout = timeout;
        this.retryPolicy = retryPolicy;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.httpClientBuilder = httpClientBuilder;
    }

    public TransportConfig() {
        this(DEFAULT_TIMEOUT, RetryPolicy.DEFAULT, Map.of(), HttpClientBuilder.DEFAULT_FACTORY);
    }

    /**
     * @return the deadline of a whole call, retries and backoff included
     */
    public Duration getTimeout() {
        return timeout;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    /**
     * @return headers added to every request
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    public HttpClientBuilder getHttpClientBuilder() {
        return httpClientBuilder;
    }
}
