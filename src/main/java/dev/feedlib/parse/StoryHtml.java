package dev.feedlib.parse;

import java.util.regex.Pattern;

import org.jspecify.annotations.Nullable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.safety.Safelist;

/**
 * HTML helpers for feed and story fields, built on jsoup.
 *
 * <p>All methods accept null and return null for null input.
 */
public final class StoryHtml {

    /** Maximum summary length including the trailing ellipsis. */
    public static final int SUMMARY_LENGTH = 300;

    private static final String ELLIPSIS = "...";

    private static final Pattern TEX_MATH = Pattern.compile(
            "\\$\\$.+?\\$\\$|\\\\\\(.+?\\\\\\)|\\\\\\[.+?\\\\\\]", Pattern.DOTALL);

    private static final Pattern MATHML = Pattern.compile("<math[\\s>]", Pattern.CASE_INSENSITIVE);

    private static final String[][] LINK_ATTRIBUTES = {
        {"a[href]", "href"},
        {"img[src]", "src"},
        {"video[src]", "src"},
        {"video[poster]", "poster"},
        {"audio[src]", "src"},
        {"source[src]", "src"},
    };

    private StoryHtml() {
        // utility class
    }

    /**
     * Flattens HTML to plain text with collapsed whitespace and decoded entities.
     *
     * @param html HTML or plain text
     * @return the text content
     */
    public static @Nullable String htmlToText(@Nullable String html) {
        if (html == null) {
            return null;
        }
        return Jsoup.parse(html).text();
    }

    /**
     * Strips unsafe markup (scripts, styles, event handlers, {@code javascript:} links) while
     * keeping text formatting, links, images and media.
     *
     * @param html untrusted HTML
     * @param baseUrl absolute URL relative links are checked against; relative links are kept
     *     relative. Without a base URL relative links are dropped.
     * @return the sanitized HTML fragment
     */
    public static @Nullable String clean(@Nullable String html, @Nullable String baseUrl) {
        if (html == null) {
            return null;
        }
        Document.OutputSettings output = new Document.OutputSettings().prettyPrint(false);
        return Jsoup.clean(html, baseUrl == null ? "" : baseUrl, safelist(), output);
    }

    /**
     * Rewrites relative link and media URLs to absolute ones.
     *
     * @param html sanitized HTML fragment
     * @param baseUrl absolute URL to resolve against
     * @return the fragment with absolute links; links that cannot be resolved are removed
     */
    public static @Nullable String processLinks(@Nullable String html, @Nullable String baseUrl) {
        if (html == null) {
            return null;
        }
        Document doc = Jsoup.parseBodyFragment(html, baseUrl == null ? "" : baseUrl);
        doc.outputSettings().prettyPrint(false);
        for (String[] selector : LINK_ATTRIBUTES) {
            String attribute = selector[1];
            for (Element element : doc.select(selector[0])) {
                String absolute = element.absUrl(attribute);
                if (absolute.isEmpty()) {
                    element.removeAttr(attribute);
                } else {
                    element.attr(attribute, absolute);
                }
            }
        }
        return doc.body().html();
    }

    /**
     * Detects TeX ({@code $$..$$}, {@code \(..\)}, {@code \[..\]}) or MathML math markup.
     *
     * @param content story content
     * @return true if math markup is present
     */
    public static boolean hasMathjax(@Nullable String content) {
        if (content == null || content.isEmpty()) {
            return false;
        }
        return MATHML.matcher(content).find() || TEX_MATH.matcher(content).find();
    }

    /**
     * Truncates text to at most {@code width} characters, preferring a word boundary and ending
     * with an ellipsis when anything was cut.
     *
     * @param text plain text
     * @param width maximum length of the result, at least 4
     * @return the shortened text
     */
    public static @Nullable String shorten(@Nullable String text, int width) {
        if (text == null || text.length() <= width) {
            return text;
        }
        int end = width - ELLIPSIS.length();
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        String cut = text.substring(0, end);
        int space = cut.lastIndexOf(' ');
        if (space > cut.length() / 2) {
            cut = cut.substring(0, space);
        }
        return cut.stripTrailing() + ELLIPSIS;
    }

    private static Safelist safelist() {
        return Safelist.relaxed()
                .addTags("figure", "figcaption", "picture", "video", "audio", "source", "hr", "del",
                        "ins", "mark")
                .addAttributes("video", "src", "poster", "controls", "width", "height")
                .addAttributes("audio", "src", "controls")
                .addAttributes("source", "src", "type")
                .addProtocols("video", "src", "http", "https")
                .addProtocols("video", "poster", "http", "https")
                .addProtocols("audio", "src", "http", "https")
                .addProtocols("source", "src", "http", "https")
                .preserveRelativeLinks(true);
    }
}
