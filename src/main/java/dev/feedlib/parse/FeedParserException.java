package dev.feedlib.parse;

/**
 * Raised when a parsed feed fails schema validation.
 *
 * <p>{@link #storyIndex()} is the position of the offending story among the stories retained by
 * the parse, or {@link #FEED_LEVEL} when the feed-level fields are invalid.
 */
public class FeedParserException extends RuntimeException {

    public static final int FEED_LEVEL = -1;

    private final int storyIndex;

    public FeedParserException(String message, int storyIndex) {
        super(message);
        this.storyIndex = storyIndex;
    }

    public int storyIndex() {
        return storyIndex;
    }
}
