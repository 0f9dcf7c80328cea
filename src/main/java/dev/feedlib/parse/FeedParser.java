package dev.feedlib.parse;

import java.util.ArrayList;
import java.util.List;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the tokenizer output of one feed into normalized, deduplicated and validated records.
 *
 * <p>Pipeline, per {@link #parse(RawFeedResult)} call:
 * <ol>
 *   <li>keep only stories whose raw content is new or changed according to the checksum</li>
 *   <li>normalize the feed: markup flattened to text and truncated, URLs made absolute,
 *       unusable optional URLs and dates dropped</li>
 *   <li>normalize each kept story the same way, sanitize its content, make its links absolute
 *       and derive its summary; oversized content is reduced to plain text</li>
 *   <li>when validation is enabled, check every record against the schema; only required fields
 *       can fail at this point</li>
 * </ol>
 *
 * <p>The parser works on a private copy of the checksum it is given; the caller's instance is
 * never modified. Each call advances a working copy that replaces the parser's state only when the
 * call succeeds, so a failed parse can be retried. The working copy can always hold every story of
 * the feed being parsed, otherwise a feed larger than the limit would evict its own stories and
 * report them as new on every refresh. Each result carries a snapshot of the advanced checksum. A
 * parser is not thread-safe.
 */
public class FeedParser {

    private static final Logger log = LoggerFactory.getLogger(FeedParser.class);

    private FeedChecksum checksum;
    private final boolean validate;
    private final FeedSchemaValidator schemaValidator;
    private final int contentSizeLimit;

    /**
     * Creates a parser; prefer {@link FeedParserFactory}.
     *
     * @param checksum state from the previous cycle, or null to start empty
     * @param validate whether to run the schema validation pass
     * @param schemaValidator validator for the hard pass
     * @param contentSizeLimit sanitized content length at which content is reduced to plain text
     */
    public FeedParser(@Nullable FeedChecksum checksum, boolean validate,
                      FeedSchemaValidator schemaValidator, int contentSizeLimit) {
        this.checksum = checksum == null ? new FeedChecksum() : checksum.copy();
        this.validate = validate;
        this.schemaValidator = schemaValidator;
        this.contentSizeLimit = contentSizeLimit;
    }

    /**
     * Parses one tokenizer result.
     *
     * @param raw tokenizer output
     * @return normalized feed, new or changed stories and the advanced checksum
     * @throws FeedParserException if validation is enabled and a required field is invalid
     */
    public FeedResult parse(RawFeedResult raw) {
        FeedChecksum working = checksum.copy(raw.stories().size());
        List<RawStory> updated = checkUpdatedStories(working, raw.stories());
        FeedRecord feed = parseFeed(raw.feed());
        List<StoryRecord> stories = new ArrayList<>(updated.size());
        for (RawStory story : updated) {
            stories.add(parseStory(story, feed.url()));
        }
        if (validate) {
            schemaValidator.validate(feed, stories);
        }
        checksum = working;
        log.debug("Parsed {}: {} of {} stories new or changed", feed.url(), stories.size(),
                raw.stories().size());
        return new FeedResult(feed, stories, working.copy());
    }

    private static List<RawStory> checkUpdatedStories(FeedChecksum checksum, List<RawStory> stories) {
        List<RawStory> updated = new ArrayList<>();
        for (RawStory story : stories) {
            String ident = story.ident() == null ? "" : story.ident();
            String content = story.content() == null ? "" : story.content();
            if (checksum.update(ident, content)) {
                updated.add(story);
            }
        }
        return updated;
    }

    private FeedRecord parseFeed(RawFeed feed) {
        String url = feed.url() == null ? null : feed.url().trim();
        String normalizedUrl = UrlNormalizer.normalize(url, null);
        if (normalizedUrl != null) {
            url = normalizedUrl;
        }
        return new FeedRecord(
                feed.version(),
                truncate(StoryHtml.htmlToText(feed.title()), FeedRecord.TITLE_LENGTH),
                url,
                UrlNormalizer.normalize(feed.homeUrl(), url),
                UrlNormalizer.normalize(feed.iconUrl(), url),
                truncate(StoryHtml.htmlToText(feed.description()), FeedRecord.DESCRIPTION_LENGTH),
                FeedDates.parse(feed.dtUpdated()),
                truncate(StoryHtml.htmlToText(feed.authorName()), FeedRecord.AUTHOR_NAME_LENGTH),
                UrlNormalizer.normalize(feed.authorUrl(), url),
                UrlNormalizer.normalize(feed.authorAvatarUrl(), url));
    }

    private StoryRecord parseStory(RawStory story, @Nullable String feedUrl) {
        String link = isBlank(story.url()) ? story.ident() : story.url();
        String url = UrlNormalizer.normalize(link, feedUrl);
        String baseUrl = url != null ? url : feedUrl;

        String cleaned = StoryHtml.clean(story.content(), baseUrl);
        String content = processContent(cleaned, baseUrl);
        String summarySource = isBlank(story.summary()) ? cleaned : StoryHtml.clean(story.summary(), baseUrl);
        String summary = StoryHtml.shorten(StoryHtml.htmlToText(summarySource), StoryHtml.SUMMARY_LENGTH);

        return new StoryRecord(
                story.ident(),
                truncate(StoryHtml.htmlToText(story.title()), FeedRecord.TITLE_LENGTH),
                url,
                content,
                summary,
                StoryHtml.hasMathjax(story.content()),
                UrlNormalizer.normalize(story.imageUrl(), baseUrl),
                FeedDates.parse(story.dtPublished()),
                FeedDates.parse(story.dtUpdated()),
                truncate(StoryHtml.htmlToText(story.authorName()), FeedRecord.AUTHOR_NAME_LENGTH),
                UrlNormalizer.normalize(story.authorUrl(), baseUrl),
                UrlNormalizer.normalize(story.authorAvatarUrl(), baseUrl));
    }

    private @Nullable String processContent(@Nullable String cleaned, @Nullable String link) {
        if (cleaned == null) {
            return null;
        }
        if (cleaned.length() >= contentSizeLimit) {
            log.warn("too large story link={} content length={}, will only save plain text!",
                    link, cleaned.length());
            return StoryHtml.htmlToText(cleaned);
        }
        return StoryHtml.processLinks(cleaned, link);
    }

    private static @Nullable String truncate(@Nullable String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        int end = Character.isHighSurrogate(text.charAt(maxLength - 1)) ? maxLength - 1 : maxLength;
        return text.substring(0, end);
    }

    private static boolean isBlank(@Nullable String value) {
        return value == null || value.isBlank();
    }
}
