package dev.feedlib.fetch;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.Map;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Fetches a URL through a trusted relay.
 *
 * <p>The relay answers every well-formed request with HTTP 200 and reports the real upstream
 * status in the {@value #STATUS_HEADER} header: an integer, or {@value #ERROR_MARKER} when the relay
 * itself failed. Any other relay status, a missing or unparseable header, the error marker, or a
 * transport failure talking to the relay is reported as {@link FetchStatus#RSS_PROXY_ERROR} with
 * the relay's body discarded.
 *
 * <p>The returned response carries the relayed body verbatim. Its {@code encoding} is the charset
 * the relayed {@code Content-Type} declared, if any; {@link FeedFetcher} replaces it with the
 * detected encoding and fills in {@code feedType}.
 */
@Service
public class ProxyRelayClient {

    private static final Logger log = LoggerFactory.getLogger(ProxyRelayClient.class);

    public static final String STATUS_HEADER = "x-rss-proxy-status";

    public static final String ERROR_MARKER = "ERROR";

    static final String DEFAULT_METHOD = "GET";

    private final RestClient restClient;
    private final long maxContentLength;

    public ProxyRelayClient(@Qualifier("feedFetchRestClient") RestClient restClient,
                            FetchProperties properties) {
        this.restClient = restClient;
        this.maxContentLength = properties.maxContentLength();
    }

    /**
     * Relays a GET of {@code url}.
     *
     * @param url the upstream URL
     * @param headers request headers the relay should send upstream
     * @param token relay shared secret
     * @param proxyUrl relay endpoint
     * @return the upstream outcome, or {@link FetchStatus#RSS_PROXY_ERROR}
     * @throws FetchException with {@link FetchStatus#CONTENT_TOO_LARGE_ERROR} if the relayed body
     *     is too large
     */
    public FetchResponse relay(String url, Map<String, String> headers, String token, String proxyUrl) {
        ProxyRelayRequest request = new ProxyRelayRequest(token, DEFAULT_METHOD, url, headers);
        try {
            return restClient.post()
                    .uri(URI.create(proxyUrl))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .exchange((httpRequest, response) -> {
                        int relayStatus;
                        try {
                            relayStatus = response.getStatusCode().value();
                        } catch (IllegalArgumentException e) {
                            log.warn("Relay {} answered an invalid status for {}: {}", proxyUrl, url,
                                    e.getMessage());
                            return FetchResponse.failure(FetchStatus.RSS_PROXY_ERROR, url);
                        }
                        if (relayStatus != 200) {
                            log.warn("Relay {} answered HTTP {} for {}", proxyUrl, relayStatus, url);
                            return FetchResponse.failure(FetchStatus.RSS_PROXY_ERROR, url);
                        }
                        HttpHeaders responseHeaders = response.getHeaders();
                        Integer upstreamStatus = parseStatus(responseHeaders.getFirst(STATUS_HEADER));
                        if (upstreamStatus == null) {
                            log.warn("Relay {} reported failure for {} ({}={})", proxyUrl, url,
                                    STATUS_HEADER, responseHeaders.getFirst(STATUS_HEADER));
                            return FetchResponse.failure(FetchStatus.RSS_PROXY_ERROR, url);
                        }
                        BodyReader.checkDeclaredLength(
                                responseHeaders.getContentLength(), maxContentLength, url);
                        byte[] content;
                        try (InputStream body = response.getBody()) {
                            content = BodyReader.readAll(body, maxContentLength, url);
                        }
                        ContentTypeHeader contentType =
                                ContentTypeHeader.parse(responseHeaders.getFirst(HttpHeaders.CONTENT_TYPE));
                        log.debug("Relay {} returned status {} for {} ({} bytes)",
                                proxyUrl, upstreamStatus, url, content.length);
                        return new FetchResponse(upstreamStatus, url, content,
                                contentType.charset(), null, contentType.mimeType(),
                                responseHeaders.getETag(),
                                responseHeaders.getFirst(HttpHeaders.LAST_MODIFIED));
                    }, true);
        } catch (RestClientException e) {
            log.warn("Relay {} unreachable for {}: {}", proxyUrl, url, e.getMessage());
            return FetchResponse.failure(FetchStatus.RSS_PROXY_ERROR, url);
        }
    }

    static @Nullable Integer parseStatus(@Nullable String header) {
        if (header == null || header.isBlank() || ERROR_MARKER.equalsIgnoreCase(header.trim())) {
            return null;
        }
        try {
            int status = Integer.parseInt(header.trim());
            return status >= 0 ? status : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
