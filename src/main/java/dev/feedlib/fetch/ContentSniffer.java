package dev.feedlib.fetch;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jspecify.annotations.Nullable;

/**
 * Decides whether a response body is a webpage or feed worth keeping, and which family it is.
 *
 * <p>The declared content type is only a hint: feeds are routinely served as {@code text/plain},
 * {@code application/octet-stream} or with no content type at all, so the family is taken from
 * structural markers in the first bytes of the body whenever they are conclusive, and from the
 * declared type otherwise. Declared types that can never hold a feed (images, media, fonts, CSV,
 * archives) are rejected regardless of the body.
 */
public final class ContentSniffer {

    /** Number of leading body bytes inspected. */
    public static final int PREFIX_LENGTH = 4096;

    private static final Set<String> UNSUPPORTED_PREFIXES = Set.of(
            "image/", "audio/", "video/", "font/", "model/", "multipart/");

    private static final Set<String> UNSUPPORTED_TYPES = Set.of(
            "text/csv", "text/css", "text/calendar", "text/javascript", "text/tab-separated-values",
            "application/javascript", "application/pdf", "application/zip", "application/gzip",
            "application/x-gzip", "application/x-tar", "application/x-7z-compressed",
            "application/vnd.rar", "application/x-rar-compressed", "application/msword",
            "application/wasm", "application/x-shockwave-flash", "application/vnd.ms-excel",
            "application/x-bittorrent");

    private static final Set<String> HTML_TYPES = Set.of("text/html", "application/xhtml+xml");

    private static final Pattern ROOT_ELEMENT = Pattern.compile(
            "<(rss|feed|rdf:rdf|html|!doctype\\s+html)[\\s>]");

    private ContentSniffer() {
        // static utility
    }

    /**
     * Outcome of classification.
     *
     * @param supported whether the body is an acceptable webpage or feed
     * @param feedType best family guess, {@link FeedType#UNKNOWN} if inconclusive
     */
    public record Classification(boolean supported, FeedType feedType) {}

    /**
     * Classifies a body from its declared content type and leading bytes.
     *
     * @param declaredContentType raw {@code Content-Type} header value, may be null or malformed
     * @param prefix leading body bytes (at most {@link #PREFIX_LENGTH} are inspected)
     * @return the classification, never null
     */
    public static Classification classify(@Nullable String declaredContentType, byte @Nullable [] prefix) {
        byte[] bytes = prefix == null ? new byte[0] : prefix;
        String mimeType = ContentTypeHeader.parse(declaredContentType).mimeType();
        boolean binary = looksBinary(bytes);
        FeedType sniffed = binary ? FeedType.UNKNOWN : sniffFamily(bytes);

        if (mimeType == null) {
            return new Classification(!binary, sniffed);
        }
        if (isUnsupportedType(mimeType)) {
            return new Classification(false, sniffed);
        }
        if (HTML_TYPES.contains(mimeType)) {
            return new Classification(true, sniffed != FeedType.UNKNOWN ? sniffed : FeedType.HTML);
        }
        FeedType declared = familyFromMimeType(mimeType);
        if (declared != FeedType.UNKNOWN) {
            return new Classification(true, sniffed != FeedType.UNKNOWN ? sniffed : declared);
        }
        if (mimeType.equals("text/plain")) {
            return new Classification(!binary, sniffed);
        }
        // application/octet-stream and anything unrecognised: trust the body only
        return new Classification(sniffed != FeedType.UNKNOWN, sniffed);
    }

    static boolean isUnsupportedType(String mimeType) {
        if (UNSUPPORTED_TYPES.contains(mimeType)) {
            return true;
        }
        for (String prefix : UNSUPPORTED_PREFIXES) {
            if (mimeType.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    static FeedType familyFromMimeType(String mimeType) {
        if (mimeType.contains("atom")) {
            return FeedType.ATOM;
        }
        if (mimeType.contains("rss")) {
            return FeedType.RSS;
        }
        if (mimeType.contains("rdf")) {
            return FeedType.RDF;
        }
        if (mimeType.contains("json")) {
            return FeedType.JSON_FEED;
        }
        if (mimeType.contains("html")) {
            return FeedType.HTML;
        }
        if (mimeType.contains("xml")) {
            return FeedType.XML;
        }
        return FeedType.UNKNOWN;
    }

    /**
     * Identifies the family from structural markers alone.
     *
     * @param bytes leading body bytes
     * @return the family, or {@link FeedType#UNKNOWN} if no marker is conclusive
     */
    static FeedType sniffFamily(byte[] bytes) {
        String text = prefixAsText(bytes).toLowerCase(Locale.ROOT).strip();
        if (text.isEmpty()) {
            return FeedType.UNKNOWN;
        }
        if (text.charAt(0) == '{') {
            return FeedType.JSON_FEED;
        }
        if (text.charAt(0) != '<') {
            return FeedType.UNKNOWN;
        }
        Matcher matcher = ROOT_ELEMENT.matcher(text);
        if (matcher.find()) {
            String element = matcher.group(1);
            switch (element) {
                case "rss":
                    return FeedType.RSS;
                case "feed":
                    return FeedType.ATOM;
                case "rdf:rdf":
                    return FeedType.RDF;
                default:
                    return FeedType.HTML;
            }
        }
        if (text.contains("<head") || text.contains("<body")) {
            return FeedType.HTML;
        }
        if (text.startsWith("<?xml")) {
            return FeedType.XML;
        }
        return FeedType.UNKNOWN;
    }

    private static String prefixAsText(byte[] bytes) {
        int length = Math.min(bytes.length, PREFIX_LENGTH);
        if (length >= 2 && (bytes[0] & 0xff) == 0xfe && (bytes[1] & 0xff) == 0xff) {
            return new String(bytes, 2, length - 2, StandardCharsets.UTF_16BE);
        }
        if (length >= 2 && (bytes[0] & 0xff) == 0xff && (bytes[1] & 0xff) == 0xfe) {
            return new String(bytes, 2, length - 2, StandardCharsets.UTF_16LE);
        }
        int offset = 0;
        if (length >= 3 && (bytes[0] & 0xff) == 0xef && (bytes[1] & 0xff) == 0xbb
                && (bytes[2] & 0xff) == 0xbf) {
            offset = 3;
        }
        // markers are ASCII, so a byte-per-char view is enough for any ASCII-compatible charset
        return new String(bytes, offset, length - offset, StandardCharsets.ISO_8859_1);
    }

    /**
     * Recognises common binary formats by magic number, or NUL bytes in a body without a UTF-16
     * byte order mark.
     */
    static boolean looksBinary(byte[] bytes) {
        if (startsWith(bytes, 0x89, 'P', 'N', 'G')
                || startsWith(bytes, 'G', 'I', 'F', '8')
                || startsWith(bytes, 0xff, 0xd8, 0xff)
                || startsWith(bytes, '%', 'P', 'D', 'F')
                || startsWith(bytes, 'P', 'K', 0x03, 0x04)
                || startsWith(bytes, 0x1f, 0x8b)) {
            return true;
        }
        if (startsWith(bytes, 0xfe, 0xff) || startsWith(bytes, 0xff, 0xfe)) {
            return false;
        }
        int limit = Math.min(bytes.length, 512);
        for (int i = 0; i < limit; i++) {
            if (bytes[i] == 0) {
                return true;
            }
        }
        return false;
    }

    private static boolean startsWith(byte[] bytes, int... magic) {
        if (bytes.length < magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if ((bytes[i] & 0xff) != magic[i]) {
                return false;
            }
        }
        return true;
    }
}
