package io.mcp.client.transport;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

import io.mcp.client.http.HttpClientBuilder;
import io.mcp.util.Assert;

public class TransportConfigBuilder {

    private Duration timeout = TransportConfig.DEFAULT_TIMEOUT;
    private int maxRetries = RetryPolicy.DEFAULT_MAX_RETRIES;
    private Duration retryDelay = RetryPolicy.DEFAULT_RETRY_DELAY;
    private Duration maxRetryDelay = RetryPolicy.DEFAULT_MAX_RETRY_DELAY;
    private double jitter = RetryPolicy.DEFAULT_JITTER;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private HttpClientBuilder httpClientBuilder = HttpClientBuilder.DEFAULT_FACTORY;

    public TransportConfigBuilder timeout(Duration timeout) {
        Assert.checkNotNullParam("timeout", timeout);
        this.timeout = timeout;
        return this;
    }

    public TransportConfigBuilder maxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
        return this;
    }

    public TransportConfigBuilder retryDelay(Duration retryDelay) {
        Assert.checkNotNullParam("retryDelay", retryDelay);
        this.retryDelay = retryDelay;
        return this;
    }

    public TransportConfigBuilder maxRetryDelay(Duration maxRetryDelay) {
        Assert.checkNotNullParam("maxRetryDelay", maxRetryDelay);
        this.maxRetryDelay = maxRetryDelay;
        return this;
    }

    public TransportConfigBuilder jitter(double jitter) {
        this.jitter = jitter;
        return this;
    }

    public TransportConfigBuilder header(String name, String value) {
        Assert.checkNotBlankParam("name", name);
        Assert.checkNotNullParam("value", value);
        this.headers.put(name, value);
        return this;
    }

    public TransportConfigBuilder headers(Map<String, String> headers) {
        Assert.checkNotNullParam("headers", headers);
        headers.forEach(this::header);
        return this;
    }

    public TransportConfigBuilder httpClientBuilder(HttpClientBuilder httpClientBuilder) {
        Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
        this.httpClientBuilder = httpClientBuilder;
        return this;
    }

    public TransportConfig build() {
        RetryPolicy retryPolicy = new RetryPolicy(maxRetries, retryDelay, maxRetryDelay, jitter);
        return new TransportConfig(timeout, retryPolicy, headers, httpClientBuilder);
    }
}
