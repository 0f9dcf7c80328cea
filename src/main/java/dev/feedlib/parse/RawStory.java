package dev.feedlib.parse;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Story-level fields as produced by the feed format tokenizer, before any normalization.
 *
 * @param ident stable identity of the story within its feed; the checksum key
 * @param title story title, may contain markup
 * @param url story link, possibly relative to the feed URL
 * @param content full HTML content
 * @param summary HTML summary
 * @param imageUrl lead image URL
 * @param dtPublished publication time as text
 * @param dtUpdated last update time as text
 * @param authorName author name, may contain markup
 * @param authorUrl author page URL
 * @param authorAvatarUrl author avatar URL
 */
public record RawStory(
    @Nullable String ident,
    @Nullable String title,
    @Nullable String url,
    @Nullable String content,
    @Nullable String summary,
    @JsonProperty("image_url") @Nullable String imageUrl,
    @JsonProperty("dt_published") @Nullable String dtPublished,
    @JsonProperty("dt_updated") @Nullable String dtUpdated,
    @JsonProperty("author_name") @Nullable String authorName,
    @JsonProperty("author_url") @Nullable String authorUrl,
    @JsonProperty("author_avatar_url") @Nullable String authorAvatarUrl) {

  /** Story with only identity, title and content set. */
  public static RawStory of(String ident, String title, @Nullable String content) {
    return new RawStory(ident, title, null, content, null, null, null, null, null, null, null);
  }
}
