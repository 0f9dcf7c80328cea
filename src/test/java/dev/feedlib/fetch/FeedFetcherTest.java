package dev.feedlib.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.feedlib.fixture.LocalHttpServer;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import javax.net.ssl.SSLHandshakeException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class FeedFetcherTest {

  private static final String RSS =
      "<?xml version=\"1.0\" encoding=\"utf-8\"?><rss version=\"2.0\"><channel>"
          + "<title>Example</title></channel></rss>";

  private static final FetchOptions LOCAL = FetchOptions.defaults().withAllowPrivateAddress(true);

  private static final FetchOptions LOCAL_ANY_CONTENT = LOCAL.withAllowNonWebpage(true);

  private LocalHttpServer server;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    server = LocalHttpServer.start();
    executor = Executors.newFixedThreadPool(2);
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    server.close();
    executor.shutdown();
    executor.awaitTermination(5, TimeUnit.SECONDS);
  }

  private FeedFetcher fetcher(FetchProperties properties) {
    return fetcher(properties, new AddressGuard());
  }

  private FeedFetcher fetcher(FetchProperties properties, AddressGuard addressGuard) {
    RestClient restClient =
        RestClient.builder()
            .requestFactory(FetchConfig.noRedirectRequestFactory(properties))
            .build();
    return new FeedFetcher(
        restClient,
        addressGuard,
        new ProxyRelayClient(restClient, properties),
        properties,
        executor);
  }

  private FeedFetcher fetcher() {
    return fetcher(FetchProperties.defaults());
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  @Nested
  class Direct {

    @ParameterizedTest
    @ValueSource(ints = {200, 201, 301, 302, 400, 403, 404, 500, 502, 600})
    void statusAndBodyArePassedThroughVerbatim(int status) {
      byte[] body = bytes("status " + status);
      server.respond("/status", status, "text/plain", body);

      FetchResponse response = fetcher().read(server.url("/status"), LOCAL_ANY_CONTENT);

      assertThat(response.status()).isEqualTo(status);
      assertThat(response.content()).isEqualTo(body);
    }

    @Test
    void feedIsReturnedWithEncodingAndFamily() {
      server.respond(
          "/feed.xml",
          200,
          Map.of("Content-Type", "application/rss+xml; charset='UTF-8'", "ETag", "\"v1\""),
          bytes(RSS));

      FetchResponse response = fetcher().read(server.url("/feed.xml"), LOCAL);

      assertThat(response.ok()).isTrue();
      assertThat(response.content()).isEqualTo(bytes(RSS));
      assertThat(response.encoding()).isEqualTo("utf-8");
      assertThat(response.feedType()).isEqualTo(FeedType.RSS);
      assertThat(response.mimeType()).isEqualTo("application/rss+xml");
      assertThat(response.etag()).isEqualTo("\"v1\"");
      assertThat(response.url()).isEqualTo(server.url("/feed.xml"));
    }

    @Test
    void sendsDescriptiveUserAgent() {
      server.respond("/feed.xml", 200, "application/rss+xml", bytes(RSS));

      fetcher().read(server.url("/feed.xml"), LOCAL);

      assertThat(server.requests()).hasSize(1);
      assertThat(server.requests().get(0).headers())
          .containsEntry("user-agent", FetchProperties.DEFAULT_USER_AGENT);
    }

    @Test
    void feedServedAsPlainTextIsSniffed() {
      server.respond("/feed", 200, "text/plain", bytes(RSS));

      FetchResponse response = fetcher().read(server.url("/feed"), LOCAL);

      assertThat(response.ok()).isTrue();
      assertThat(response.feedType()).isEqualTo(FeedType.RSS);
    }

    @ParameterizedTest
    @ValueSource(strings = {"image/png", "text/csv", "application/pdf", "video/mp4"})
    void unsupportedContentTypeIsRejectedWithEmptyContent(String contentType) {
      server.respond("/file", 200, contentType, bytes(RSS));

      FetchResponse response = fetcher().read(server.url("/file"), LOCAL);

      assertThat(response.is(FetchStatus.CONTENT_TYPE_NOT_SUPPORT_ERROR)).isTrue();
      assertThat(response.content()).isEmpty();
      assertThat(response.ok()).isFalse();
    }

    @Test
    void unsupportedContentTypeIsReturnedWhenNonWebpagesAreAllowed() {
      byte[] png = {(byte) 0x89, 'P', 'N', 'G', 0x0d, 0x0a, 0x1a, 0x0a, 0, 0};
      server.respond("/image.png", 200, "image/png", png);

      FetchResponse response = fetcher().read(server.url("/image.png"), LOCAL_ANY_CONTENT);

      assertThat(response.status()).isEqualTo(200);
      assertThat(response.content()).isEqualTo(png);
    }

    @Test
    void errorPagesAreNotSubjectToTheContentTypeGuard() {
      server.respond("/missing", 404, "image/png", bytes("not found"));

      FetchResponse response = fetcher().read(server.url("/missing"), LOCAL);

      assertThat(response.status()).isEqualTo(404);
      assertThat(response.content()).isEqualTo(bytes("not found"));
    }

    @Test
    void emptyErrorResponseHasEmptyContent() {
      server.respond("/gone", 410, "text/html", new byte[0]);

      FetchResponse response = fetcher().read(server.url("/gone"), LOCAL);

      assertThat(response.status()).isEqualTo(410);
      assertThat(response.hasContent()).isFalse();
    }

    @Test
    void followsRedirectsAndReportsFinalUrl() {
      server.respond("/feed.xml", 200, "application/rss+xml", bytes(RSS));
      server.respond("/old", 301, Map.of("Location", "/feed.xml"), new byte[0]);

      FetchResponse response = fetcher().read(server.url("/old"), LOCAL);

      assertThat(response.status()).isEqualTo(200);
      assertThat(response.url()).isEqualTo(server.url("/feed.xml"));
      assertThat(response.content()).isEqualTo(bytes(RSS));
    }

    @Test
    void redirectLoopYieldsTooManyRedirects() {
      server.respond("/loop", 302, Map.of("Location", "/loop"), new byte[0]);
      FetchProperties properties =
          new FetchProperties(
              FetchProperties.DEFAULT_USER_AGENT, 5000, 5000, 1024 * 1024, 3, 2, null);

      FetchResponse response = fetcher(properties).read(server.url("/loop"), LOCAL);

      assertThat(response.is(FetchStatus.TOO_MANY_REDIRECT_ERROR)).isTrue();
      assertThat(server.requests()).hasSize(4);
    }

    @Test
    void redirectWithoutLocationIsReturnedAsIs() {
      server.respond("/moved", 302, "text/html", bytes("moved"));

      FetchResponse response = fetcher().read(server.url("/moved"), LOCAL);

      assertThat(response.status()).isEqualTo(302);
      assertThat(response.content()).isEqualTo(bytes("moved"));
    }

    @Test
    void conditionalRequestYieldsNotModified() {
      server.handle(
          "/feed.xml",
          exchange -> {
            boolean fresh = "\"v1\"".equals(exchange.getRequestHeaders().getFirst("If-None-Match"));
            LocalHttpServer.send(
                exchange,
                fresh ? 304 : 200,
                Map.of("Content-Type", "application/rss+xml"),
                fresh ? new byte[0] : bytes(RSS));
          });

      FetchResponse response =
          fetcher()
              .read(
                  server.url("/feed.xml"),
                  LOCAL.withConditional("\"v1\"", "Sat, 01 Jan 2022 00:00:00 GMT"));

      assertThat(response.notModified()).isTrue();
      assertThat(response.hasContent()).isFalse();
      assertThat(server.requests().get(0).headers())
          .containsEntry("if-modified-since", "Sat, 01 Jan 2022 00:00:00 GMT");
    }

    @Test
    void refererIsForwarded() {
      server.respond("/feed.xml", 200, "application/rss+xml", bytes(RSS));

      fetcher().read(server.url("/feed.xml"), LOCAL.withReferer("https://example.com/"));

      assertThat(server.requests().get(0).headers())
          .containsEntry("referer", "https://example.com/");
    }

    @Test
    void declaredOversizedBodyIsRejected() {
      server.respond("/big", 200, "text/html", new byte[8192]);
      FetchProperties properties =
          new FetchProperties(FetchProperties.DEFAULT_USER_AGENT, 5000, 5000, 1000, 10, 2, null);

      FetchResponse response = fetcher(properties).read(server.url("/big"), LOCAL);

      assertThat(response.is(FetchStatus.CONTENT_TOO_LARGE_ERROR)).isTrue();
      assertThat(response.content()).isEmpty();
    }

    @Test
    void streamedOversizedBodyIsRejected() {
      byte[] html = bytes("<html><body>" + "x".repeat(20_000) + "</body></html>");
      server.handle(
          "/chunked",
          exchange -> {
            exchange.getResponseHeaders().set("Content-Type", "text/html");
            exchange.sendResponseHeaders(200, 0);
            try (OutputStream out = exchange.getResponseBody()) {
              out.write(html);
            }
          });
      FetchProperties properties =
          new FetchProperties(
              FetchProperties.DEFAULT_USER_AGENT, 5000, 5000, 10_000, 10, 2, null);

      FetchResponse response = fetcher(properties).read(server.url("/chunked"), LOCAL);

      assertThat(response.is(FetchStatus.CONTENT_TOO_LARGE_ERROR)).isTrue();
    }

    @Test
    void readAsyncMatchesBlockingRead() throws Exception {
      server.respond("/feed.xml", 200, "application/atom+xml", bytes("<feed></feed>"));
      FeedFetcher fetcher = fetcher();

      FetchResponse blocking = fetcher.read(server.url("/feed.xml"), LOCAL);
      FetchResponse async = fetcher.readAsync(server.url("/feed.xml"), LOCAL).get(10, TimeUnit.SECONDS);

      assertThat(async.status()).isEqualTo(blocking.status());
      assertThat(async.content()).isEqualTo(blocking.content());
      assertThat(async.encoding()).isEqualTo(blocking.encoding());
      assertThat(async.feedType()).isEqualTo(FeedType.ATOM).isEqualTo(blocking.feedType());
    }
  }

  @Nested
  class AddressPolicy {

    @Test
    void loopbackTargetIsRejectedWithoutSendingRequest() {
      server.respond("/feed.xml", 200, "application/rss+xml", bytes(RSS));

      FetchResponse response = fetcher().read(server.url("/feed.xml"));

      assertThat(response.is(FetchStatus.PRIVATE_ADDRESS_ERROR)).isTrue();
      assertThat(response.content()).isEmpty();
      assertThat(server.requests()).isEmpty();
    }

    @Test
    void localhostNameIsRejected() {
      String url = server.url("/feed.xml").replace("127.0.0.1", "localhost");

      FetchResponse response = fetcher().read(url);

      assertThat(response.is(FetchStatus.PRIVATE_ADDRESS_ERROR)).isTrue();
      assertThat(server.requests()).isEmpty();
    }

    @Test
    void redirectTargetIsCheckedAgain() {
      server.respond("/feed.xml", 200, "application/rss+xml", bytes(RSS));
      server.respond("/hop", 302, Map.of("Location", "/feed.xml"), new byte[0]);
      AddressGuard guard = mock(AddressGuard.class);
      doNothing()
          .doThrow(new FetchException(FetchStatus.PRIVATE_ADDRESS_ERROR, "private"))
          .when(guard)
          .check(any(URI.class));

      FetchResponse response =
          fetcher(FetchProperties.defaults(), guard).read(server.url("/hop"));

      assertThat(response.is(FetchStatus.PRIVATE_ADDRESS_ERROR)).isTrue();
      assertThat(server.requests()).extracting(LocalHttpServer.RecordedRequest::path)
          .containsExactly("/hop");
    }

    @Test
    void unresolvableHostIsDnsError() {
      FetchResponse response = fetcher().read("http://feedlib-test.invalid/feed.xml");

      assertThat(response.is(FetchStatus.DNS_ERROR)).isTrue();
    }
  }

  @Nested
  class Relay {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient = HttpClient.newHttpClient();

    /** Relay that performs the real fetch and reports the upstream status in its header. */
    private void startForwardingRelay() {
      server.handle(
          "/relay",
          exchange -> {
            JsonNode request = objectMapper.readTree(LocalHttpServer.recorded(exchange).body());
            HttpRequest.Builder upstream =
                HttpRequest.newBuilder(URI.create(request.get("url").asText())).GET();
            request.get("headers").fields()
                .forEachRemaining(h -> upstream.header(h.getKey(), h.getValue().asText()));
            try {
              HttpResponse<byte[]> response =
                  httpClient.send(upstream.build(), HttpResponse.BodyHandlers.ofByteArray());
              Map<String, String> headers = new HashMap<>();
              headers.put(ProxyRelayClient.STATUS_HEADER, String.valueOf(response.statusCode()));
              response.headers().firstValue("Content-Type")
                  .ifPresent(value -> headers.put("Content-Type", value));
              LocalHttpServer.send(exchange, 200, headers, response.body());
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
              throw new IOException(e);
            }
          });
    }

    private FetchOptions viaRelay() {
      return FetchOptions.defaults()
          .withUseProxy(true)
          .withProxy(server.url("/relay"), "secret-token");
    }

    @ParameterizedTest
    @ValueSource(ints = {200, 201, 404, 500, 503})
    void upstreamStatusIsReportedThroughRelay(int status) {
      startForwardingRelay();
      server.respond("/upstream", status, "application/rss+xml", bytes(RSS));

      FetchResponse response = fetcher().read(server.url("/upstream"), viaRelay());

      assertThat(response.status()).isEqualTo(status);
      assertThat(response.content()).isEqualTo(bytes(RSS));
    }

    @Test
    void relayedFeedIsEnriched() {
      startForwardingRelay();
      server.respond("/upstream", 200, "application/atom+xml", bytes("<feed></feed>"));

      FetchResponse response = fetcher().read(server.url("/upstream"), viaRelay());

      assertThat(response.feedType()).isEqualTo(FeedType.ATOM);
      assertThat(response.encoding()).isEqualTo("utf-8");
    }

    @Test
    void relayedUnsupportedContentIsRejected() {
      startForwardingRelay();
      server.respond("/upstream", 200, "text/csv", bytes("a,b,c"));

      FetchResponse response = fetcher().read(server.url("/upstream"), viaRelay());

      assertThat(response.is(FetchStatus.CONTENT_TYPE_NOT_SUPPORT_ERROR)).isTrue();
      assertThat(response.content()).isEmpty();
    }

    @Test
    void relayRequestCarriesTokenMethodUrlAndHeaders() throws IOException {
      server.respond(
          "/relay",
          200,
          Map.of(ProxyRelayClient.STATUS_HEADER, "200", "Content-Type", "text/html"),
          bytes("<html></html>"));

      fetcher().read("https://example.com/feed.xml", viaRelay());

      LocalHttpServer.RecordedRequest request = server.requests().get(0);
      JsonNode body = objectMapper.readTree(request.body());
      assertThat(request.method()).isEqualTo("POST");
      assertThat(body.get("token").asText()).isEqualTo("secret-token");
      assertThat(body.get("method").asText()).isEqualTo("GET");
      assertThat(body.get("url").asText()).isEqualTo("https://example.com/feed.xml");
      assertThat(body.get("headers").get("User-Agent").asText())
          .isEqualTo(FetchProperties.DEFAULT_USER_AGENT);
    }

    @Test
    void relayErrorMarkerIsProxyErrorWithEmptyContent() {
      server.respond(
          "/relay",
          200,
          Map.of(ProxyRelayClient.STATUS_HEADER, "ERROR", "Content-Type", "text/plain"),
          bytes("relay timed out"));

      FetchResponse response = fetcher().read("https://example.com/feed.xml", viaRelay());

      assertThat(response.is(FetchStatus.RSS_PROXY_ERROR)).isTrue();
      assertThat(response.content()).isEmpty();
    }

    @Test
    void relayHttpFailureIsProxyError() {
      server.respond(
          "/relay",
          401,
          Map.of(ProxyRelayClient.STATUS_HEADER, "200", "Content-Type", "text/plain"),
          bytes("bad token"));

      FetchResponse response = fetcher().read("https://example.com/feed.xml", viaRelay());

      assertThat(response.is(FetchStatus.RSS_PROXY_ERROR)).isTrue();
      assertThat(response.content()).isEmpty();
    }

    @Test
    void unreachableRelayIsProxyError() throws IOException {
      int port;
      try (ServerSocket socket = new ServerSocket(0)) {
        port = socket.getLocalPort();
      }
      FetchOptions options =
          FetchOptions.defaults().withUseProxy(true)
              .withProxy("http://127.0.0.1:" + port + "/relay", "secret-token");

      FetchResponse response = fetcher().read("https://example.com/feed.xml", options);

      assertThat(response.is(FetchStatus.RSS_PROXY_ERROR)).isTrue();
    }

    @Test
    void configuredRelayIsUsedWhenCallDoesNotOverrideIt() {
      server.respond(
          "/relay",
          200,
          Map.of(ProxyRelayClient.STATUS_HEADER, "404", "Content-Type", "text/html"),
          bytes("missing"));
      FetchProperties properties =
          new FetchProperties(
              FetchProperties.DEFAULT_USER_AGENT,
              5000,
              5000,
              1024 * 1024,
              10,
              2,
              new FetchProperties.Proxy(server.url("/relay"), "configured-token"));

      FetchResponse response =
          fetcher(properties).read("https://example.com/feed.xml", FetchOptions.defaults().withUseProxy(true));

      assertThat(response.status()).isEqualTo(404);
      assertThat(server.requests()).hasSize(1);
    }

    @Test
    void relayUrlWithoutTokenIsConfigurationError() {
      FetchOptions options = FetchOptions.defaults().withUseProxy(true)
          .withProxy(server.url("/relay"), null);

      assertThatThrownBy(() -> fetcher().read("https://example.com/feed.xml", options))
          .isInstanceOf(IllegalStateException.class)
          .hasMessageContaining("without a token");
    }

    @Test
    void proxyRequestWithoutConfiguredRelayFetchesDirectly() {
      server.respond("/feed.xml", 200, "application/rss+xml", bytes(RSS));

      FetchResponse response =
          fetcher().read(server.url("/feed.xml"), LOCAL.withUseProxy(true));

      assertThat(response.status()).isEqualTo(200);
      assertThat(server.requests()).extracting(LocalHttpServer.RecordedRequest::path)
          .containsExactly("/feed.xml");
    }
  }

  @Nested
  class Failures {

    @ParameterizedTest
    @ValueSource(strings = {"", "not a url", "ftp://example.com/feed", "/relative/feed.xml", "http://"})
    void malformedUrlIsRejected(String url) {
      assertThatThrownBy(() -> fetcher().read(url)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void refusedConnectionIsConnectionError() throws IOException {
      int port;
      try (ServerSocket socket = new ServerSocket(0)) {
        port = socket.getLocalPort();
      }

      FetchResponse response = fetcher().read("http://127.0.0.1:" + port + "/feed.xml", LOCAL);

      assertThat(response.is(FetchStatus.CONNECTION_ERROR)).isTrue();
      assertThat(response.content()).isEmpty();
    }

    @Test
    void statusTheTransportCannotRepresentIsUnknownError() throws Exception {
      try (ServerSocket upstream = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
        Future<?> answered = executor.submit(() -> {
          answerOnce(upstream, "HTTP/1.1 099 Weird\r\nContent-Length: 0\r\nConnection: close\r\n\r\n");
          return null;
        });

        FetchResponse response = fetcher().read(
            "http://127.0.0.1:" + upstream.getLocalPort() + "/feed.xml", LOCAL_ANY_CONTENT);

        assertThat(response.is(FetchStatus.UNKNOWN_ERROR)).isTrue();
        assertThat(response.content()).isEmpty();
        answered.get(5, TimeUnit.SECONDS);
      }
    }

    private void answerOnce(ServerSocket upstream, String rawResponse) throws IOException {
      try (Socket socket = upstream.accept()) {
        BufferedReader reader = new BufferedReader(
            new InputStreamReader(socket.getInputStream(), StandardCharsets.ISO_8859_1));
        String line = reader.readLine();
        while (line != null && !line.isEmpty()) {
          line = reader.readLine();
        }
        OutputStream out = socket.getOutputStream();
        out.write(rawResponse.getBytes(StandardCharsets.ISO_8859_1));
        out.flush();
      }
    }

    @Test
    void unexpectedRuntimeFailureIsUnknownError() {
      AddressGuard guard = mock(AddressGuard.class);
      doThrow(new IllegalStateException("resolver unavailable")).when(guard).check(any(URI.class));

      FetchResponse response =
          fetcher(FetchProperties.defaults(), guard).read("https://example.com/feed.xml");

      assertThat(response.is(FetchStatus.UNKNOWN_ERROR)).isTrue();
      assertThat(response.url()).isEqualTo("https://example.com/feed.xml");
    }

    @Test
    void transportFailuresAreClassifiedByCause() {
      assertThat(classify(new UnknownHostException("example.com")))
          .isEqualTo(FetchStatus.DNS_ERROR);
      assertThat(classify(new SocketTimeoutException("Connect timed out")))
          .isEqualTo(FetchStatus.CONNECTION_TIMEOUT);
      assertThat(classify(new SocketTimeoutException("Read timed out")))
          .isEqualTo(FetchStatus.READ_TIMEOUT);
      assertThat(classify(new SSLHandshakeException("PKIX path building failed")))
          .isEqualTo(FetchStatus.SSL_ERROR);
      assertThat(classify(new ConnectException("Connection refused")))
          .isEqualTo(FetchStatus.CONNECTION_ERROR);
      assertThat(classify(new SocketException("Connection reset")))
          .isEqualTo(FetchStatus.CONNECTION_RESET);
      assertThat(classify(new IOException("Premature EOF")))
          .isEqualTo(FetchStatus.CONNECTION_ERROR);
      assertThat(FeedFetcher.classifyTransportFailure(new IllegalStateException("boom")))
          .isEqualTo(FetchStatus.UNKNOWN_ERROR);
    }

    private FetchStatus classify(IOException cause) {
      return FeedFetcher.classifyTransportFailure(
          new ResourceAccessException("I/O error on GET request", cause));
    }

    @Test
    void sentinelsNeverCollideWithUpstreamStatuses() {
      assertThat(Arrays.stream(FetchStatus.values()).mapToInt(FetchStatus::code))
          .allMatch(code -> code < 0)
          .doesNotHaveDuplicates();
      assertThat(FetchStatus.nameOf(600)).isEqualTo("600");
      assertThat(FetchStatus.nameOf(FetchStatus.RSS_PROXY_ERROR.code())).isEqualTo("RSS_PROXY_ERROR");
    }
  }
}
