package io.mcp.client.http.jdk;

import java.time.Duration;

import io.mcp.client.http.HttpClient;
import io.mcp.client.http.HttpClientBuilder;
import io.mcp.util.Assert;
import org.jspecify.annotations.Nullable;

public class JdkHttpClientBuilder implements HttpClientBuilder {

    private @Nullable Duration connectTimeout;

    /**
     * Bounds connection establishment for clients created by this builder. Without it only the
     * per-request timeout applies.
     *
     * @param connectTimeout the connect timeout
     * @return this builder
     */
    public JdkHttpClientBuilder connectTimeout(Duration connectTimeout) {
        Assert.checkNotNullParam("connectTimeout", connectTimeout);
        this.connectTimeout = connectTimeout;
        return this;
    }

    @Override
    public HttpClient create(String url) {
        return new JdkHttpClient(url, connectTimeout);
    }
}
