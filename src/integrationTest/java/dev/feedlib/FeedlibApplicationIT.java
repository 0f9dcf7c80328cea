package dev.feedlib;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.feedlib.fetch.FeedFetcher;
import dev.feedlib.fetch.FeedType;
import dev.feedlib.fetch.FetchOptions;
import dev.feedlib.fetch.FetchProperties;
import dev.feedlib.fetch.FetchResponse;
import dev.feedlib.fetch.FetchStatus;
import dev.feedlib.fixture.LocalHttpServer;
import dev.feedlib.parse.FeedParserFactory;
import dev.feedlib.parse.FeedResult;
import dev.feedlib.parse.ParseProperties;
import dev.feedlib.parse.RawFeedResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
    "feedlib.fetch.max-redirects=3",
    "feedlib.parse.checksum-limit=50"
})
class FeedlibApplicationIT {

    private static final String FEED_JSON = """
        {
          "feed": {"version": "json1", "title": "Local <b>feed</b>", "url": "%s"},
          "storys": [
            {"ident": "first", "title": "First", "content": "<p><a href=\\"/a\\">a</a></p>"},
            {"ident": "second", "title": "Second", "content": "<p>two</p>"}
          ]
        }
        """;

    @Autowired
    private FeedFetcher fetcher;

    @Autowired
    private FeedParserFactory parserFactory;

    @Autowired
    private FetchProperties fetchProperties;

    @Autowired
    private ParseProperties parseProperties;

    @Autowired
    private ObjectMapper objectMapper;

    private LocalHttpServer server;

    @BeforeEach
    void startServer() {
        server = LocalHttpServer.start();
    }

    @AfterEach
    void stopServer() {
        server.close();
    }

    @Test
    void propertiesAreBoundFromConfiguration() {
        assertThat(fetchProperties.maxRedirects()).isEqualTo(3);
        assertThat(fetchProperties.userAgent()).startsWith("Mozilla/5.0 (compatible; feedlib/");
        assertThat(parseProperties.checksumLimit()).isEqualTo(50);
        assertThat(parserFactory.newChecksum().limit()).isEqualTo(50);
    }

    @Test
    void fetchedDocumentFlowsThroughParser() throws IOException {
        String feedUrl = server.url("/feed.json");
        server.respond("/feed.json", 200, "application/json",
            FEED_JSON.formatted(feedUrl).getBytes(StandardCharsets.UTF_8));

        FetchResponse response = fetcher.read(feedUrl,
            FetchOptions.defaults().withAllowPrivateAddress(true));

        assertThat(response.ok()).isTrue();
        assertThat(response.feedType()).isEqualTo(FeedType.JSON_FEED);

        RawFeedResult raw = objectMapper.readValue(response.content(), RawFeedResult.class);
        FeedResult result = parserFactory.create(null).parse(raw);

        assertThat(result.feed().title()).isEqualTo("Local feed");
        assertThat(result.stories()).hasSize(2);
        assertThat(result.stories().get(0).content())
            .contains("href=\"" + server.url("/a") + "\"");
        assertThat(parserFactory.create(result.checksum()).parse(raw).stories()).isEmpty();
    }

    @Test
    void loopbackIsRejectedByDefault() {
        server.respond("/feed.json", 200, "application/json", "{}".getBytes(StandardCharsets.UTF_8));

        FetchResponse response = fetcher.read(server.url("/feed.json"));

        assertThat(response.is(FetchStatus.PRIVATE_ADDRESS_ERROR)).isTrue();
        assertThat(server.requests()).isEmpty();
    }
}
