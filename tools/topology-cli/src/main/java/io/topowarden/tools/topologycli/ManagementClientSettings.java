package io.topowarden.tools.topologycli;

import java.time.Duration;

/**
 * Immutable HTTP settings shared by the address resolver and the management client.
 * Missing or non-positive timeouts fall back to the defaults.
 */
public record ManagementClientSettings(
    Duration connectTimeout,
    Duration requestTimeout,
    int maxRedirects
) {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_REDIRECTS = 5;
    public static final int MAX_REDIRECTS_LIMIT = 20;

    public ManagementClientSettings {
        connectTimeout = resolveTimeout(connectTimeout, DEFAULT_CONNECT_TIMEOUT);
        requestTimeout = resolveTimeout(requestTimeout, DEFAULT_REQUEST_TIMEOUT);
        if (maxRedirects < 0 || maxRedirects > MAX_REDIRECTS_LIMIT) {
            throw new IllegalArgumentException(
                "Max redirects must be between 0 and " + MAX_REDIRECTS_LIMIT + ", got: " + maxRedirects
            );
        }
    }

    public static ManagementClientSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Duration resolveTimeout(Duration candidate, Duration fallback) {
        if (candidate == null || candidate.isZero() || candidate.isNegative()) {
            return fallback;
        }
        return candidate;
    }

    public static class Builder {
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private int maxRedirects = DEFAULT_MAX_REDIRECTS;

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder maxRedirects(int maxRedirects) {
            this.maxRedirects = maxRedirects;
            return this;
        }

        public ManagementClientSettings build() {
            return new ManagementClientSettings(connectTimeout, requestTimeout, maxRedirects);
        }
    }
}
