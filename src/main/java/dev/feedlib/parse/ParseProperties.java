package dev.feedlib.parse;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Parser settings bound from {@code feedlib.parse.*}.
 *
 * @param checksumLimit identities kept by each new {@link FeedChecksum}
 * @param contentSizeLimit sanitized story content of at least this many characters is reduced to
 *     plain text
 * @param validate whether parsers run the schema validation pass by default
 */
@ConfigurationProperties(prefix = "feedlib.parse")
public record ParseProperties(
        @DefaultValue("300") int checksumLimit,
        @DefaultValue("1048576") int contentSizeLimit,
        @DefaultValue("true") boolean validate
) {

    public ParseProperties {
        if (checksumLimit <= 0) {
            throw new IllegalStateException(
                    "feedlib.parse.checksum-limit must be positive, got: " + checksumLimit);
        }
        if (contentSizeLimit <= 0) {
            throw new IllegalStateException(
                    "feedlib.parse.content-size-limit must be positive, got: " + contentSizeLimit);
        }
    }

    public static ParseProperties defaults() {
        return new ParseProperties(FeedChecksum.DEFAULT_LIMIT, 1024 * 1024, true);
    }
}
