package io.mcp.client.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import io.mcp.client.http.HttpClientBuilder;
import io.mcp.client.transport.RetryPolicy;
import io.mcp.client.transport.TransportConfig;
import io.mcp.client.transport.TransportConfigBuilder;
import io.mcp.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Configuration of an {@link io.mcp.client.MCPClient}.
 * <p>
 * Durations read by {@link #fromProperties(Properties)} are either ISO-8601
 * ({@code PT2.5S}) or a plain number of milliseconds.
 */
public class ClientConfig {

    public static final String DEFAULT_BASE_URL = "http://localhost:5005";
    public static final String PROPERTY_PREFIX = "mcp.client.";

    private final String baseUrl;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration retryDelay;
    private final Duration maxRetryDelay;
    private final double jitter;
    private final Map<String, String> headers;
    private final HttpClientBuilder httpClientBuilder;

    private ClientConfig(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.timeout = builder.timeout;
        this.maxRetries = builder.maxRetries;
        this.retryDelay = builder.retryDelay;
        this.maxRetryDelay = builder.maxRetryDelay;
        this.jitter = builder.jitter;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.httpClientBuilder = builder.httpClientBuilder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ClientConfig defaults() {
        return builder().build();
    }

    /**
     * Reads a configuration from properties prefixed with {@value #PROPERTY_PREFIX}:
     * {@code baseUrl}, {@code timeout}, {@code maxRetries}, {@code retryDelay},
     * {@code maxRetryDelay}, {@code jitter} and {@code header.<name>}. Missing keys keep their
     * defaults.
     *
     * @param properties the properties to read
     * @return the configuration
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static ClientConfig fromProperties(Properties properties) {
        Assert.checkNotNullParam("properties", properties);
        Builder builder = builder();
        String value = property(properties, "baseUrl");
        if (value != null) {
            builder.baseUrl(value);
        }
        value = property(properties, "timeout");
        if (value != null) {
            builder.timeout(parseDuration("timeout", value));
        }
        value = property(properties, "maxRetries");
        if (value != null) {
            builder.maxRetries(parseInt("maxRetries", value));
        }
        value = property(properties, "retryDelay");
        if (value != null) {
            builder.retryDelay(parseDuration("retryDelay", value));
        }
        value = property(properties, "maxRetryDelay");
        if (value != null) {
            builder.maxRetryDelay(parseDuration("maxRetryDelay", value));
        }
        value = property(properties, "jitter");
        if (value != null) {
            builder.jitter(parseDouble("jitter", value));
        }
        String headerPrefix = PROPERTY_PREFIX + "header.";
        for (String name : properties.stringPropertyNames()) {
            if (name.startsWith(headerPrefix) && name.length() > headerPrefix.length()) {
                builder.header(name.substring(headerPrefix.length()), properties.getProperty(name).trim());
            }
        }
        return builder.build();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public Duration getMaxRetryDelay() {
        return maxRetryDelay;
    }

    public double getJitter() {
        return jitter;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public HttpClientBuilder getHttpClientBuilder() {
        return httpClientBuilder;
    }

    public TransportConfig toTransportConfig() {
        return new TransportConfigBuilder()
                .timeout(timeout)
                .maxRetries(maxRetries)
                .retryDelay(retryDelay)
                .maxRetryDelay(maxRetryDelay)
                .jitter(jitter)
                .headers(headers)
                .httpClientBuilder(httpClientBuilder)
                .build();
    }

    private static @Nullable String property(Properties properties, String key) {
        String value = properties.getProperty(PROPERTY_PREFIX + key);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static Duration parseDuration(String key, String value) {
        try {
            if (value.startsWith("P") || value.startsWith("p")) {
                return Duration.parse(value);
            }
            return Duration.ofMillis(Long.parseLong(value));
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new IllegalArgumentException("Invalid duration for " + PROPERTY_PREFIX + key + ": " + value, e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + PROPERTY_PREFIX + key + ": " + value, e);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + PROPERTY_PREFIX + key + ": " + value, e);
        }
    }

    public static class Builder {
        private String baseUrl = DEFAULT_BASE_URL;
        private Duration timeout = TransportConfig.DEFAULT_TIMEOUT;
        private int maxRetries = RetryPolicy.DEFAULT_MAX_RETRIES;
        private Duration retryDelay = RetryPolicy.DEFAULT_RETRY_DELAY;
        private Duration maxRetryDelay = RetryPolicy.DEFAULT_MAX_RETRY_DELAY;
        private double jitter = RetryPolicy.DEFAULT_JITTER;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private HttpClientBuilder httpClientBuilder = HttpClientBuilder.DEFAULT_FACTORY;

        private Builder() {
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = Assert.checkNotBlankParam("baseUrl", baseUrl);
            return this;
        }

        /**
         * Deadline of a whole call, retries and backoff included.
         */
        public Builder timeout(Duration timeout) {
            this.timeout = Assert.checkNotNullParam("timeout", timeout);
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = Assert.checkNotNullParam("retryDelay", retryDelay);
            return this;
        }

        public Builder maxRetryDelay(Duration maxRetryDelay) {
            this.maxRetryDelay = Assert.checkNotNullParam("maxRetryDelay", maxRetryDelay);
            return this;
        }

        public Builder jitter(double jitter) {
            this.jitter = jitter;
            return this;
        }

        public Builder header(String name, String value) {
            Assert.checkNotBlankParam("name", name);
            Assert.checkNotNullParam("value", value);
            this.headers.put(name, value);
            return this;
        }

        public Builder httpClientBuilder(HttpClientBuilder httpClientBuilder) {
            this.httpClientBuilder = Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
            return this;
        }

        /**
         * @throws IllegalArgumentException if the base URL is not an absolute http(s) URL, or a
         * timing value is out of range
         */
        public ClientConfig build() {
            String lower = baseUrl.toLowerCase(Locale.ROOT);
            if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
                throw new IllegalArgumentException("Base URL must be an absolute http(s) URL: " + baseUrl);
            }
            ClientConfig config = new ClientConfig(this);
            // fails on out of range timing values
            config.toTransportConfig();
            return config;
        }
    }
}
