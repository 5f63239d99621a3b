package io.mcp.client.http;

import io.mcp.client.http.jdk.JdkHttpClientBuilder;

/**
 * Factory of {@link HttpClient} instances, one per server origin.
 */
public interface HttpClientBuilder {

    HttpClientBuilder DEFAULT_FACTORY = new JdkHttpClientBuilder();

    HttpClient create(String url);
}
