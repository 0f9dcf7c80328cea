package dev.feedlib.parse;

import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Creates {@link FeedParser}s bound to the application's validator and parse settings.
 */
@Component
public class FeedParserFactory {

    private final FeedSchemaValidator schemaValidator;
    private final ParseProperties properties;

    public FeedParserFactory(FeedSchemaValidator schemaValidator, ParseProperties properties) {
        this.schemaValidator = schemaValidator;
        this.properties = properties;
    }

    /** Empty checksum sized by {@code feedlib.parse.checksum-limit}, for a new subscription. */
    public FeedChecksum newChecksum() {
        return new FeedChecksum(properties.checksumLimit());
    }

    public FeedParser create(@Nullable FeedChecksum checksum) {
        return create(checksum, properties.validate());
    }

    /**
     * Creates a parser.
     *
     * @param checksum state from the previous cycle, copied by the parser; null starts from
     *     {@link #newChecksum()}
     * @param validate whether to run the schema validation pass
     * @return a new single-owner parser
     */
    public FeedParser create(@Nullable FeedChecksum checksum, boolean validate) {
        FeedChecksum initial = checksum == null ? newChecksum() : checksum;
        return new FeedParser(initial, validate, schemaValidator, properties.contentSizeLimit());
    }
}
