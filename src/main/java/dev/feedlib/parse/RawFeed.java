package dev.feedlib.parse;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Feed-level fields as produced by the feed format tokenizer, before any normalization.
 *
 * <p>Every field is an unvalidated string. Dates are kept in their textual form (ISO-8601 or
 * RFC 1123) and parsed by {@link FeedParser}.
 *
 * @param version format version reported by the tokenizer, e.g. {@code rss20} or {@code atom10}
 * @param title feed title, may contain markup
 * @param url the feed's own URL
 * @param homeUrl website URL, possibly relative to {@code url}
 * @param iconUrl icon URL, possibly relative to {@code url}
 * @param description feed description, may contain markup
 * @param dtUpdated last update time as text
 * @param authorName author name, may contain markup
 * @param authorUrl author page URL
 * @param authorAvatarUrl author avatar URL
 */
public record RawFeed(
    @Nullable String version,
    @Nullable String title,
    @Nullable String url,
    @JsonProperty("home_url") @Nullable String homeUrl,
    @JsonProperty("icon_url") @Nullable String iconUrl,
    @Nullable String description,
    @JsonProperty("dt_updated") @Nullable String dtUpdated,
    @JsonProperty("author_name") @Nullable String authorName,
    @JsonProperty("author_url") @Nullable String authorUrl,
    @JsonProperty("author_avatar_url") @Nullable String authorAvatarUrl) {}
