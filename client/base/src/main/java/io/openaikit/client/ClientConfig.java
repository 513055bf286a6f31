package io.openaikit.client;

import java.time.Duration;

import io.openaikit.client.http.HttpClientBuilder;
import io.openaikit.client.retry.RetryListener;
import io.openaikit.client.retry.RetryPolicy;
import io.openaikit.client.stream.DecodeFailurePolicy;
import io.openaikit.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Immutable configuration shared by every call of one {@link OpenAIKitClient}.
 * <p>
 * Only the API key is required:
 * <pre>{@code
 * ClientConfig config = ClientConfig.builder()
 *     .apiKey(System.getenv("OPENAI_API_KEY"))
 *     .organization("org-123")
 *     .retryPolicy(RetryPolicy.rateLimitOptimized())
 *     .build();
 * }</pre>
 */
public final class ClientConfig {

    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final String apiKey;
    private final @Nullable String organization;
    private final @Nullable String project;
    private final String baseUrl;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;
    private final DecodeFailurePolicy decodeFailurePolicy;
    private final HttpClientBuilder httpClientBuilder;
    private final @Nullable RetryListener retryListener;

    private ClientConfig(Builder builder) {
        this.apiKey = Assert.checkNotNullParam("apiKey", builder.apiKey);
        this.organization = builder.organization;
        this.project = builder.project;
        this.baseUrl = builder.baseUrl;
        this.timeout = builder.timeout;
        this.retryPolicy = builder.retryPolicy;
        this.decodeFailurePolicy = builder.decodeFailurePolicy;
        this.httpClientBuilder = builder.httpClientBuilder;
        this.retryListener = builder.retryListener;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getApiKey() {
        return apiKey;
    }

    public @Nullable String getOrganization() {
        return organization;
    }

    public @Nullable String getProject() {
        return project;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public DecodeFailurePolicy getDecodeFailurePolicy() {
        return decodeFailurePolicy;
    }

    public HttpClientBuilder getHttpClientBuilder() {
        return httpClientBuilder;
    }

    public @Nullable RetryListener getRetryListener() {
        return retryListener;
    }

    @Override
    public String toString() {
        // never print the key
        return "ClientConfig{baseUrl='" + baseUrl + "', organization=" + organization + ", project=" + project
                + ", timeout=" + timeout + ", retryPolicy=" + retryPolicy + ", decodeFailurePolicy=" + decodeFailurePolicy + "}";
    }

    public static class Builder {
        private @Nullable String apiKey;
        private @Nullable String organization;
        private @Nullable String project;
        private String baseUrl = DEFAULT_BASE_URL;
        private Duration timeout = DEFAULT_TIMEOUT;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private DecodeFailurePolicy decodeFailurePolicy = DecodeFailurePolicy.FAIL;
        private HttpClientBuilder httpClientBuilder = HttpClientBuilder.DEFAULT_FACTORY;
        private @Nullable RetryListener retryListener;

        public Builder apiKey(String apiKey) {
            Assert.checkNotNullParam("apiKey", apiKey);
            this.apiKey = apiKey;
            return this;
        }

        public Builder organization(@Nullable String organization) {
            this.organization = organization;
            return this;
        }

        public Builder project(@Nullable String project) {
            this.project = project;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            Assert.checkNotNullParam("baseUrl", baseUrl);
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder timeout(Duration timeout) {
            Assert.checkNotNullParam("timeout", timeout);
            Assert.checkArgument(!timeout.isNegative() && !timeout.isZero(), "timeout must be positive");
            this.timeout = timeout;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            Assert.checkNotNullParam("retryPolicy", retryPolicy);
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder decodeFailurePolicy(DecodeFailurePolicy decodeFailurePolicy) {
            Assert.checkNotNullParam("decodeFailurePolicy", decodeFailurePolicy);
            this.decodeFailurePolicy = decodeFailurePolicy;
            return this;
        }

        public Builder httpClientBuilder(HttpClientBuilder httpClientBuilder) {
            Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
            this.httpClientBuilder = httpClientBuilder;
            return this;
        }

        public Builder retryListener(@Nullable RetryListener retryListener) {
            this.retryListener = retryListener;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(this);
        }
    }
}
