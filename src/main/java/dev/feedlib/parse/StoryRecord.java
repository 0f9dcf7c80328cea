package dev.feedlib.parse;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Normalized and validated story fields.
 *
 * <p>{@code ident} is carried over from the raw story unchanged: it is the checksum key, so it is
 * never truncated or rewritten, and an over-long value fails validation.
 *
 * @param ident stable identity of the story
 * @param title plain-text title
 * @param url absolute story URL, null if neither the raw URL nor the ident is a valid URL
 * @param content sanitized HTML, or plain text for oversized content
 * @param summary plain-text summary, at most {@value StoryHtml#SUMMARY_LENGTH} characters
 * @param hasMathjax whether the content contains math markup
 * @param imageUrl lead image URL
 * @param dtPublished publication time
 * @param dtUpdated last update time
 * @param authorName plain-text author name
 * @param authorUrl author page URL
 * @param authorAvatarUrl author avatar URL
 */
public record StoryRecord(
    @NotBlank @Size(max = StoryRecord.IDENT_LENGTH) String ident,
    @NotNull @Size(max = FeedRecord.TITLE_LENGTH) String title,
    @HttpUrl @Nullable String url,
    @Nullable String content,
    @Size(max = StoryHtml.SUMMARY_LENGTH) @Nullable String summary,
    @JsonProperty("has_mathjax") boolean hasMathjax,
    @JsonProperty("image_url") @HttpUrl @Nullable String imageUrl,
    @JsonProperty("dt_published") @Nullable Instant dtPublished,
    @JsonProperty("dt_updated") @Nullable Instant dtUpdated,
    @JsonProperty("author_name") @Size(max = FeedRecord.AUTHOR_NAME_LENGTH) @Nullable
        String authorName,
    @JsonProperty("author_url") @HttpUrl @Nullable String authorUrl,
    @JsonProperty("author_avatar_url") @HttpUrl @Nullable String authorAvatarUrl) {

  public static final int IDENT_LENGTH = 200;
}
