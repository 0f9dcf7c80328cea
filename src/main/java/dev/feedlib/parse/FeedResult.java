package dev.feedlib.parse;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Outcome of {@link FeedParser#parse(RawFeedResult)}.
 *
 * @param feed normalized feed fields
 * @param stories new or changed stories, in document order
 * @param checksum checksum advanced by this parse; persist it to carry state into the next cycle
 */
public record FeedResult(
    FeedRecord feed,
    @JsonProperty("storys") List<StoryRecord> stories,
    @JsonIgnore FeedChecksum checksum) {

  public FeedResult {
    stories = stories == null ? List.of() : List.copyOf(stories);
  }

  @Override
  public String toString() {
    return "FeedResult[url=" + feed.url() + ", version=" + feed.version() + ", title="
        + feed.title() + ", " + stories.size() + " stories]";
  }
}
