package dev.feedlib.parse;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Output of the external feed format tokenizer and input of {@link FeedParser}.
 *
 * @param feed feed-level fields
 * @param stories stories in document order
 */
public record RawFeedResult(RawFeed feed, @JsonProperty("storys") List<RawStory> stories) {
  public RawFeedResult {
    if (feed == null) {
      throw new IllegalArgumentException("feed must not be null");
    }
    stories = stories == null ? List.of() : List.copyOf(stories);
  }
}
