package dev.feedlib.fetch;

import org.jspecify.annotations.Nullable;

/**
 * Per-call options for {@link FeedFetcher#read(String, FetchOptions)}.
 *
 * <p>{@code proxyUrl} and {@code proxyToken} override the configured relay for this call only.
 *
 * @param useProxy route the request through the trusted relay when one is configured
 * @param allowPrivateAddress skip the private-address check (trusted callers and tests only)
 * @param allowNonWebpage return bodies whose content type is not a webpage or feed
 * @param proxyUrl relay endpoint override
 * @param proxyToken relay token override
 * @param etag previous {@code ETag}, sent as {@code If-None-Match}
 * @param lastModified previous {@code Last-Modified}, sent as {@code If-Modified-Since}
 * @param referer value for the {@code Referer} header
 */
public record FetchOptions(
        boolean useProxy,
        boolean allowPrivateAddress,
        boolean allowNonWebpage,
        @Nullable String proxyUrl,
        @Nullable String proxyToken,
        @Nullable String etag,
        @Nullable String lastModified,
        @Nullable String referer
) {

    private static final FetchOptions DEFAULTS =
            new FetchOptions(false, false, false, null, null, null, null, null);

    public static FetchOptions defaults() {
        return DEFAULTS;
    }

    public FetchOptions withUseProxy(boolean useProxy) {
        return new FetchOptions(useProxy, allowPrivateAddress, allowNonWebpage,
                proxyUrl, proxyToken, etag, lastModified, referer);
    }

    public FetchOptions withAllowPrivateAddress(boolean allowPrivateAddress) {
        return new FetchOptions(useProxy, allowPrivateAddress, allowNonWebpage,
                proxyUrl, proxyToken, etag, lastModified, referer);
    }

    public FetchOptions withAllowNonWebpage(boolean allowNonWebpage) {
        return new FetchOptions(useProxy, allowPrivateAddress, allowNonWebpage,
                proxyUrl, proxyToken, etag, lastModified, referer);
    }

    public FetchOptions withProxy(@Nullable String proxyUrl, @Nullable String proxyToken) {
        return new FetchOptions(useProxy, allowPrivateAddress, allowNonWebpage,
                proxyUrl, proxyToken, etag, lastModified, referer);
    }

    public FetchOptions withConditional(@Nullable String etag, @Nullable String lastModified) {
        return new FetchOptions(useProxy, allowPrivateAddress, allowNonWebpage,
                proxyUrl, proxyToken, etag, lastModified, referer);
    }

    public FetchOptions withReferer(@Nullable String referer) {
        return new FetchOptions(useProxy, allowPrivateAddress, allowNonWebpage,
                proxyUrl, proxyToken, etag, lastModified, referer);
    }
}
