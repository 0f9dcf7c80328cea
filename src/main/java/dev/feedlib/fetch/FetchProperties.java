package dev.feedlib.fetch;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Fetcher settings bound from {@code feedlib.fetch.*}.
 *
 * @param userAgent fixed descriptive {@code User-Agent} sent on every request
 * @param connectTimeoutMs TCP connect timeout in milliseconds
 * @param readTimeoutMs socket read timeout in milliseconds
 * @param maxContentLength largest accepted body in bytes
 * @param maxRedirects redirect hops followed before giving up
 * @param asyncPoolSize worker threads behind {@link FeedFetcher#readAsync}
 * @param proxy default relay endpoint, used when a call asks for the proxy
 */
@ConfigurationProperties(prefix = "feedlib.fetch")
public record FetchProperties(
        @DefaultValue(FetchProperties.DEFAULT_USER_AGENT) String userAgent,
        @DefaultValue("10000") int connectTimeoutMs,
        @DefaultValue("30000") int readTimeoutMs,
        @DefaultValue("10485760") long maxContentLength,
        @DefaultValue("10") int maxRedirects,
        @DefaultValue("8") int asyncPoolSize,
        @DefaultValue Proxy proxy
) {

    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (compatible; feedlib/0.1; feed fetcher)";

    public FetchProperties {
        if (proxy == null) {
            proxy = new Proxy(null, null);
        }
        if (maxContentLength <= 0) {
            throw new IllegalStateException(
                    "feedlib.fetch.max-content-length must be positive, got: " + maxContentLength);
        }
        if (maxRedirects < 0) {
            throw new IllegalStateException(
                    "feedlib.fetch.max-redirects must not be negative, got: " + maxRedirects);
        }
    }

    /** Settings with every default applied and no relay configured. */
    public static FetchProperties defaults() {
        return new FetchProperties(DEFAULT_USER_AGENT, 10_000, 30_000, 10L * 1024 * 1024, 10, 8,
                new Proxy(null, null));
    }

    /**
     * Trusted relay endpoint.
     *
     * @param url relay URL, relaying is unavailable when blank
     * @param token shared secret sent in every relay request
     */
    public record Proxy(@Nullable String url, @Nullable String token) {}
}
