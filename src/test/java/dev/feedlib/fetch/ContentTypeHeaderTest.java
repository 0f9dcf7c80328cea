package dev.feedlib.fetch;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ContentTypeHeaderTest {

    @Test
    void parsesMimeTypeAndCharset() {
        ContentTypeHeader header = ContentTypeHeader.parse("Text/HTML; Charset=UTF-8");

        assertThat(header.mimeType()).isEqualTo("text/html");
        assertThat(header.charset()).isEqualTo("UTF-8");
    }

    @Test
    void stripsSingleAndDoubleQuotes() {
        assertThat(ContentTypeHeader.parse("text/xml; charset='gbk'").charset()).isEqualTo("gbk");
        assertThat(ContentTypeHeader.parse("text/xml; charset=\"gbk\"").charset()).isEqualTo("gbk");
    }

    @Test
    void findsCharsetAmongOtherParameters() {
        ContentTypeHeader header = ContentTypeHeader.parse("application/rss+xml; q=0.9 ; charset=big5");

        assertThat(header.charset()).isEqualTo("big5");
    }

    @Test
    void malformedValuesParseToNull() {
        assertThat(ContentTypeHeader.parse(null).mimeType()).isNull();
        assertThat(ContentTypeHeader.parse("  ").mimeType()).isNull();
        assertThat(ContentTypeHeader.parse("html").mimeType()).isNull();
        assertThat(ContentTypeHeader.parse("text/").mimeType()).isNull();
        assertThat(ContentTypeHeader.parse("text/html; charset=").charset()).isNull();
    }
}
