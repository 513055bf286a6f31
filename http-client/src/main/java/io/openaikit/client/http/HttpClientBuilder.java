package io.openaikit.client.http;

import io.openaikit.client.http.jdk.JdkHttpClientBuilder;

/**
 * Creates {@link HttpClient}s. Plug in another implementation through
 * {@code ClientConfig.Builder#httpClientBuilder} to change the transport.
 */
@FunctionalInterface
public interface HttpClientBuilder {

    /** The JDK {@code java.net.http} transport with default settings. */
    HttpClientBuilder DEFAULT_FACTORY = new JdkHttpClientBuilder();

    /**
     * @param baseUrl absolute base URL, for example {@code https://api.openai.com/v1}
     * @throws IllegalArgumentException if the URL is not an absolute http(s) URL
     */
    HttpClient create(String baseUrl);
}
