package dev.feedlib.fetch;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Structural family of a fetched document, used to route it to the right tokenizer.
 */
public enum FeedType {
    RSS("rss"),
    ATOM("atom"),
    RDF("rdf"),
    JSON_FEED("json"),
    HTML("html"),
    XML("xml"),
    UNKNOWN("unknown");

    private final String value;

    FeedType(String value) {
        this.value = value;
    }

    /** Lowercase name used when a response is rendered or serialized. */
    @JsonValue
    public String value() {
        return value;
    }

    /** Whether the family is a syndication format rather than a webpage or unclassified text. */
    public boolean isFeed() {
        return this == RSS || this == ATOM || this == RDF || this == JSON_FEED;
    }
}
