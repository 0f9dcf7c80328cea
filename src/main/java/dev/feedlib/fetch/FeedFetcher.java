package dev.feedlib.fetch;

import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import javax.net.ssl.SSLException;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Fetches feed and webpage URLs safely and normalizes every outcome into a {@link FetchResponse}.
 *
 * <p>One logical attempt per call, no retries. Pipeline:
 * <ol>
 *   <li>relay through {@link ProxyRelayClient} when asked to and a relay is configured, otherwise</li>
 *   <li>check the target with {@link AddressGuard} and GET it, following redirects hop by hop
 *       (each hop is checked again)</li>
 *   <li>for successful responses, reject content that {@link ContentSniffer} does not accept
 *       after reading only the body prefix</li>
 *   <li>detect the encoding with {@link EncodingDetector} and record the feed family</li>
 * </ol>
 * Ordinary network and content outcomes never throw; a malformed URL or relay configuration does.
 *
 * <p>{@link #read} blocks the caller; {@link #readAsync} runs the same pipeline on the fetch
 * worker pool.
 */
@Service
public class FeedFetcher {

    private static final Logger log = LoggerFactory.getLogger(FeedFetcher.class);

    static final String ACCEPT = "application/rss+xml, application/atom+xml, application/rdf+xml, "
            + "application/feed+json, application/json;q=0.9, application/xml;q=0.9, "
            + "text/xml;q=0.9, text/html;q=0.8, */*;q=0.5";

    private static final Set<Integer> REDIRECT_STATUSES = Set.of(301, 302, 303, 307, 308);

    private final RestClient restClient;
    private final AddressGuard addressGuard;
    private final ProxyRelayClient proxyRelayClient;
    private final FetchProperties properties;
    private final Executor executor;

    public FeedFetcher(@Qualifier("feedFetchRestClient") RestClient restClient,
                       AddressGuard addressGuard,
                       ProxyRelayClient proxyRelayClient,
                       FetchProperties properties,
                       @Qualifier("feedFetchExecutor") Executor executor) {
        this.restClient = restClient;
        this.addressGuard = addressGuard;
        this.proxyRelayClient = proxyRelayClient;
        this.properties = properties;
        this.executor = executor;
    }

    public FetchResponse read(String url) {
        return read(url, FetchOptions.defaults());
    }

    /**
     * Fetches a URL, blocking until the outcome is known.
     *
     * @param url absolute http(s) URL
     * @param options per-call options
     * @return the outcome; never null
     * @throws IllegalArgumentException if the URL is not an absolute http(s) URL
     * @throws IllegalStateException if the relay is requested with a URL but no token
     */
    public FetchResponse read(String url, FetchOptions options) {
        URI uri = parseUrl(url);
        RelayTarget relay = resolveRelay(options);
        long started = System.nanoTime();
        FetchResponse response;
        try {
            if (relay != null) {
                response = readByRelay(url, relay, options);
            } else {
                response = readDirect(uri, options);
            }
        } catch (FetchException e) {
            log.debug("Fetch of {} aborted: {}", url, e.getMessage());
            response = FetchResponse.failure(e.status(), url);
        } catch (RestClientException e) {
            FetchStatus status = classifyTransportFailure(e);
            log.warn("Fetch of {} failed with {}: {}", url, status, e.getMessage());
            response = FetchResponse.failure(status, url);
        } catch (RuntimeException e) {
            log.warn("Fetch of {} failed unexpectedly", url, e);
            response = FetchResponse.failure(FetchStatus.UNKNOWN_ERROR, url);
        }
        log.info("Fetched {} status={} length={} in {} ms", url, FetchStatus.nameOf(response.status()),
                response.content().length, (System.nanoTime() - started) / 1_000_000);
        return response;
    }

    /**
     * Runs {@link #read(String, FetchOptions)} on the fetch worker pool.
     *
     * @param url absolute http(s) URL
     * @param options per-call options
     * @return a future completing with the same outcome the blocking call would return
     */
    public CompletableFuture<FetchResponse> readAsync(String url, FetchOptions options) {
        return CompletableFuture.supplyAsync(() -> read(url, options), executor);
    }

    public CompletableFuture<FetchResponse> readAsync(String url) {
        return readAsync(url, FetchOptions.defaults());
    }

    private FetchResponse readByRelay(String url, RelayTarget relay, FetchOptions options) {
        FetchResponse relayed = proxyRelayClient.relay(url, requestHeaders(options), relay.token(), relay.url());
        if (relayed.status() < 0) {
            return relayed;
        }
        return complete(url, relayed.status(), relayed.mimeType(), relayed.encoding(),
                relayed.content(), relayed.etag(), relayed.lastModified(), options);
    }

    private FetchResponse readDirect(URI uri, FetchOptions options) {
        URI current = uri;
        for (int hop = 0; ; hop++) {
            if (!options.allowPrivateAddress()) {
                addressGuard.check(current);
            }
            URI target = current;
            Hop result = restClient.get()
                    .uri(target)
                    .headers(headers -> headers.setAll(requestHeaders(options)))
                    .exchange((request, response) -> readHop(target, response, options), true);
            if (result.redirect() == null) {
                return result.response();
            }
            if (hop >= properties.maxRedirects()) {
                throw new FetchException(FetchStatus.TOO_MANY_REDIRECT_ERROR,
                        "More than " + properties.maxRedirects() + " redirects from " + uri);
            }
            log.debug("Redirect {} -> {}", current, result.redirect());
            current = result.redirect();
        }
    }

    private Hop readHop(URI target, ClientHttpResponse response, FetchOptions options) throws IOException {
        int status = statusOf(response, target);
        HttpHeaders headers = response.getHeaders();
        if (REDIRECT_STATUSES.contains(status)) {
            URI location = resolveLocation(target, headers.getFirst(HttpHeaders.LOCATION));
            if (location != null) {
                return new Hop(location, null);
            }
        }

        String url = target.toString();
        BodyReader.checkDeclaredLength(headers.getContentLength(), properties.maxContentLength(), url);
        ContentTypeHeader contentType = ContentTypeHeader.parse(headers.getFirst(HttpHeaders.CONTENT_TYPE));
        try (InputStream body = openBody(response, status)) {
            byte[] prefix = BodyReader.readPrefix(body);
            if (isRejected(status, contentType.mimeType(), prefix, options)) {
                return new Hop(null, contentTypeRejected(url, contentType.mimeType()));
            }
            byte[] content = BodyReader.readRemaining(body, prefix, properties.maxContentLength(), url);
            return new Hop(null, complete(url, status, contentType.mimeType(), contentType.charset(),
                    content, headers.getETag(), headers.getFirst(HttpHeaders.LAST_MODIFIED), options));
        }
    }

    /**
     * Final enrichment shared by direct and relayed fetches: content-type policy, encoding and
     * family detection.
     */
    private FetchResponse complete(String url, int status, @Nullable String mimeType,
                                   @Nullable String declaredCharset, byte[] content,
                                   @Nullable String etag, @Nullable String lastModified,
                                   FetchOptions options) {
        if (isRejected(status, mimeType, content, options)) {
            return contentTypeRejected(url, mimeType);
        }
        ContentSniffer.Classification classification = ContentSniffer.classify(mimeType, content);
        String encoding = EncodingDetector.detect(declaredCharset, content);
        return new FetchResponse(status, url, content, encoding, classification.feedType(),
                mimeType, etag, lastModified);
    }

    private boolean isRejected(int status, @Nullable String mimeType, byte[] prefix, FetchOptions options) {
        if (options.allowNonWebpage() || status < 200 || status >= 300) {
            return false;
        }
        return !ContentSniffer.classify(mimeType, prefix).supported();
    }

    private FetchResponse contentTypeRejected(String url, @Nullable String mimeType) {
        log.info("Rejected {}: content type {} is not a webpage or feed", url, mimeType);
        return FetchResponse.failure(FetchStatus.CONTENT_TYPE_NOT_SUPPORT_ERROR, url);
    }

    private Map<String, String> requestHeaders(FetchOptions options) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HttpHeaders.USER_AGENT, properties.userAgent());
        headers.put(HttpHeaders.ACCEPT, ACCEPT);
        headers.put(HttpHeaders.ACCEPT_ENCODING, "identity");
        if (options.etag() != null && !options.etag().isBlank()) {
            headers.put(HttpHeaders.IF_NONE_MATCH, options.etag());
        }
        if (options.lastModified() != null && !options.lastModified().isBlank()) {
            headers.put(HttpHeaders.IF_MODIFIED_SINCE, options.lastModified());
        }
        if (options.referer() != null && !options.referer().isBlank()) {
            headers.put(HttpHeaders.REFERER, options.referer());
        }
        return headers;
    }

    private @Nullable RelayTarget resolveRelay(FetchOptions options) {
        if (!options.useProxy()) {
            return null;
        }
        String url = firstNonBlank(options.proxyUrl(), properties.proxy().url());
        if (url == null) {
            log.debug("Relay requested but none configured, fetching directly");
            return null;
        }
        String token = firstNonBlank(options.proxyToken(), properties.proxy().token());
        if (token == null) {
            throw new IllegalStateException("Relay " + url + " is configured without a token");
        }
        return new RelayTarget(url, token);
    }

    /**
     * Reads the status code of a response. The transport only represents codes from 100 to 999;
     * anything else is reported as {@link FetchStatus#UNKNOWN_ERROR}.
     */
    private static int statusOf(ClientHttpResponse response, URI target) throws IOException {
        try {
            return response.getStatusCode().value();
        } catch (IllegalArgumentException e) {
            log.warn("Unrepresentable status from {}: {}", target, e.getMessage());
            throw new FetchException(FetchStatus.UNKNOWN_ERROR, "Unrepresentable status from " + target, e);
        }
    }

    /**
     * Error bodies of {@link java.net.HttpURLConnection} may be absent entirely, which surfaces as
     * an exception rather than an empty stream.
     */
    private static InputStream openBody(ClientHttpResponse response, int status) throws IOException {
        try {
            return response.getBody();
        } catch (IOException e) {
            if (status >= 400) {
                return InputStream.nullInputStream();
            }
            throw e;
        }
    }

    private static @Nullable URI resolveLocation(URI base, @Nullable String location) {
        if (location == null || location.isBlank()) {
            return null;
        }
        try {
            URI resolved = base.resolve(new URI(location.trim()));
            String scheme = resolved.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                return null;
            }
            return resolved;
        } catch (URISyntaxException | IllegalArgumentException e) {
            log.debug("Ignoring malformed redirect location {} from {}", location, base);
            return null;
        }
    }

    static URI parseUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL must not be blank");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed URL: " + url, e);
        }
        String scheme = uri.getScheme() == null ? null : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!("http".equals(scheme) || "https".equals(scheme)) || uri.getHost() == null) {
            throw new IllegalArgumentException("Not an absolute http(s) URL: " + url);
        }
        return uri;
    }

    static FetchStatus classifyTransportFailure(Throwable failure) {
        boolean io = false;
        for (Throwable cause = failure; cause != null; cause = cause.getCause()) {
            if (cause instanceof UnknownHostException) {
                return FetchStatus.DNS_ERROR;
            }
            if (cause instanceof SocketTimeoutException) {
                String message = String.valueOf(cause.getMessage()).toLowerCase(Locale.ROOT);
                return message.contains("connect") ? FetchStatus.CONNECTION_TIMEOUT : FetchStatus.READ_TIMEOUT;
            }
            if (cause instanceof SSLException) {
                return FetchStatus.SSL_ERROR;
            }
            if (cause instanceof ConnectException) {
                return FetchStatus.CONNECTION_ERROR;
            }
            if (cause instanceof SocketException
                    && String.valueOf(cause.getMessage()).toLowerCase(Locale.ROOT).contains("reset")) {
                return FetchStatus.CONNECTION_RESET;
            }
            io |= cause instanceof IOException;
        }
        return io ? FetchStatus.CONNECTION_ERROR : FetchStatus.UNKNOWN_ERROR;
    }

    private static @Nullable String firstNonBlank(@Nullable String first, @Nullable String second) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        if (second != null && !second.isBlank()) {
            return second;
        }
        return null;
    }

    private record RelayTarget(String url, String token) {}

    /** One transport round trip: either a redirect to follow or a final response. */
    private record Hop(@Nullable URI redirect, @Nullable FetchResponse response) {}
}
