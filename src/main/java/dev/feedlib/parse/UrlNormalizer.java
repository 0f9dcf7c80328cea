package dev.feedlib.parse;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class that turns the URLs found in feeds into absolute http(s) URLs.
 * Resolves relative references against a base URL, lowercases scheme and host and drops default
 * ports. Anything that cannot be made into a valid http(s) URL becomes null.
 */
public final class UrlNormalizer {

    private static final Logger log = LoggerFactory.getLogger(UrlNormalizer.class);

    /** Longest URL accepted by {@link #isValid(String)}. */
    public static final int MAX_LENGTH = 4096;

    private UrlNormalizer() {
        // utility class
    }

    /**
     * Normalize a URL found in a feed:
     * - Trim whitespace and escape inner spaces
     * - Resolve relative and scheme-relative references against {@code baseUrl}
     * - Lowercase scheme and host (path is case-sensitive)
     * - Remove default ports
     *
     * @param url the URL to normalize, possibly relative
     * @param baseUrl absolute URL relative references are resolved against, may be null
     * @return the normalized absolute URL, or null if the result is not a valid http(s) URL
     */
    public static @Nullable String normalize(@Nullable String url, @Nullable String baseUrl) {
        if (url == null || url.isBlank()) {
            return null;
        }
        URI uri = parse(url);
        if (uri == null) {
            log.debug("Malformed URL, dropping: {}", url);
            return null;
        }
        if (!uri.isAbsolute()) {
            URI base = baseUrl == null ? null : parse(baseUrl);
            if (base == null || !base.isAbsolute()) {
                return null;
            }
            if (base.getRawPath() == null || base.getRawPath().isEmpty()) {
                base = parse(baseUrl.trim() + "/");
                if (base == null) {
                    return null;
                }
            }
            uri = base.resolve(uri);
        }

        if (uri.getScheme() == null || uri.getHost() == null) {
            return null;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!isHttp(scheme)) {
            return null;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        String path = uri.getRawPath();

        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://");
        if (uri.getRawUserInfo() != null) {
            sb.append(uri.getRawUserInfo()).append('@');
        }
        sb.append(host);
        if (port != -1 && !isDefaultPort(scheme, port)) {
            sb.append(':').append(port);
        }
        sb.append(path == null || path.isEmpty() ? "/" : path);
        if (uri.getRawQuery() != null) {
            sb.append('?').append(uri.getRawQuery());
        }
        if (uri.getRawFragment() != null) {
            sb.append('#').append(uri.getRawFragment());
        }
        String normalized = sb.toString();
        return isValid(normalized) ? normalized : null;
    }

    /**
     * Check whether a URL is an absolute http(s) URL with a host, no longer than
     * {@link #MAX_LENGTH} characters.
     *
     * @param url the URL to check
     * @return true if valid
     */
    public static boolean isValid(@Nullable String url) {
        if (url == null || url.isEmpty() || url.length() > MAX_LENGTH) {
            return false;
        }
        try {
            URI uri = new URI(url);
            return uri.getScheme() != null && isHttp(uri.getScheme().toLowerCase(Locale.ROOT))
                    && uri.getHost() != null && !uri.getHost().isEmpty();
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static @Nullable URI parse(String url) {
        try {
            return new URI(url.trim().replace(" ", "%20"));
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static boolean isHttp(String scheme) {
        return "http".equals(scheme) || "https".equals(scheme);
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);
    }
}
