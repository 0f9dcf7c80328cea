package dev.feedlib.parse;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Normalized and validated feed-level fields.
 *
 * <p>{@code version}, {@code title} and {@code url} are required; the other fields are optional
 * and are set to null during normalization when their raw value is unusable.
 *
 * @param version format version reported by the tokenizer
 * @param title plain-text title
 * @param url the feed's own URL
 * @param homeUrl website URL
 * @param iconUrl icon URL
 * @param description plain-text description
 * @param dtUpdated last update time
 * @param authorName plain-text author name
 * @param authorUrl author page URL
 * @param authorAvatarUrl author avatar URL
 */
public record FeedRecord(
    @NotNull @Size(max = FeedRecord.TITLE_LENGTH) String version,
    @NotNull @Size(max = FeedRecord.TITLE_LENGTH) String title,
    @NotBlank @HttpUrl String url,
    @JsonProperty("home_url") @HttpUrl @Nullable String homeUrl,
    @JsonProperty("icon_url") @HttpUrl @Nullable String iconUrl,
    @Size(max = FeedRecord.DESCRIPTION_LENGTH) @Nullable String description,
    @JsonProperty("dt_updated") @Nullable Instant dtUpdated,
    @JsonProperty("author_name") @Size(max = FeedRecord.AUTHOR_NAME_LENGTH) @Nullable
        String authorName,
    @JsonProperty("author_url") @HttpUrl @Nullable String authorUrl,
    @JsonProperty("author_avatar_url") @HttpUrl @Nullable String authorAvatarUrl) {

  public static final int TITLE_LENGTH = 200;
  public static final int DESCRIPTION_LENGTH = 300;
  public static final int AUTHOR_NAME_LENGTH = 100;
}
