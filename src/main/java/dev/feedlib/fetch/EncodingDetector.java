package dev.feedlib.fetch;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jspecify.annotations.Nullable;

/**
 * Best-effort text encoding detection for fetched bodies.
 *
 * <p>Order of evidence:
 * <ol>
 *   <li>the declared charset (transport header), if it decodes the leading bytes cleanly</li>
 *   <li>a byte order mark</li>
 *   <li>an in-document declaration ({@code <?xml encoding=...?>} or {@code <meta charset=...>}),
 *       if it decodes cleanly</li>
 *   <li>the first candidate of UTF-8, GB18030, windows-1252 that decodes cleanly</li>
 *   <li>ISO-8859-1, which decodes anything</li>
 * </ol>
 * Only the first {@link #CHECK_LENGTH} bytes are decoded. Detection never fails.
 */
public final class EncodingDetector {

    /** Number of leading bytes that must decode without error for a charset to be accepted. */
    static final int CHECK_LENGTH = 64 * 1024;

    private static final String FALLBACK = "iso-8859-1";

    private static final List<String> CANDIDATES = List.of("utf-8", "gb18030", "windows-1252");

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("utf8", "utf-8"),
            Map.entry("unicode-1-1-utf-8", "utf-8"),
            Map.entry("x-unicode20utf8", "utf-8"),
            Map.entry("ascii", "us-ascii"),
            Map.entry("latin1", "iso-8859-1"),
            Map.entry("latin-1", "iso-8859-1"),
            Map.entry("iso8859-1", "iso-8859-1"),
            Map.entry("iso_8859-1", "iso-8859-1"),
            Map.entry("cp1252", "windows-1252"),
            Map.entry("x-gbk", "gbk"),
            Map.entry("cp936", "gbk"),
            Map.entry("sjis", "shift_jis"),
            Map.entry("x-sjis", "shift_jis"),
            Map.entry("shift-jis", "shift_jis"),
            Map.entry("euckr", "euc-kr"),
            Map.entry("eucjp", "euc-jp"));

    private static final Pattern XML_DECLARATION = Pattern.compile(
            "<\\?xml[^>]*?encoding\\s*=\\s*[\"']([A-Za-z0-9._:-]+)[\"']", Pattern.CASE_INSENSITIVE);

    private static final Pattern META_CHARSET = Pattern.compile(
            "<meta[^>]+?charset\\s*=\\s*[\"']?([A-Za-z0-9._:-]+)", Pattern.CASE_INSENSITIVE);

    private EncodingDetector() {
        // static utility
    }

    /**
     * Detects the encoding of a body.
     *
     * @param declaredCharset charset from the transport, possibly quoted or oddly cased
     * @param content raw body bytes
     * @return a lowercase encoding name that Java can decode, never null
     */
    public static String detect(@Nullable String declaredCharset, byte @Nullable [] content) {
        byte[] bytes = content == null ? new byte[0] : content;

        String declared = normalize(declaredCharset);
        if (declared != null && decodesCleanly(declared, bytes)) {
            return declared;
        }

        String bom = fromByteOrderMark(bytes);
        if (bom != null) {
            return bom;
        }

        String embedded = normalize(fromDocumentDeclaration(bytes));
        if (embedded != null && decodesCleanly(embedded, bytes)) {
            return embedded;
        }

        for (String candidate : CANDIDATES) {
            if (decodesCleanly(candidate, bytes)) {
                return candidate;
            }
        }
        return FALLBACK;
    }

    /**
     * Normalizes a charset label: strips quotes, lowercases, maps common aliases.
     *
     * @param charset raw label
     * @return the normalized name, or null if absent or not supported by this JVM
     */
    static @Nullable String normalize(@Nullable String charset) {
        if (charset == null) {
            return null;
        }
        String name = ContentTypeHeader.stripQuotes(charset.trim()).toLowerCase(Locale.ROOT);
        if (name.isEmpty()) {
            return null;
        }
        name = ALIASES.getOrDefault(name, name);
        try {
            return Charset.isSupported(name) ? name : null;
        } catch (IllegalCharsetNameException e) {
            return null;
        }
    }

    static boolean decodesCleanly(String charsetName, byte[] bytes) {
        CharsetDecoder decoder = Charset.forName(charsetName).newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        int length = Math.min(bytes.length, CHECK_LENGTH);
        boolean endOfInput = length == bytes.length;
        ByteBuffer in = ByteBuffer.wrap(bytes, 0, length);
        CharBuffer out = CharBuffer.allocate(
                (int) Math.ceil(length * (double) decoder.maxCharsPerByte()) + 16);
        // with endOfInput a truncated trailing sequence is reported as malformed
        CoderResult result = decoder.decode(in, out, endOfInput);
        if (result.isError()) {
            return false;
        }
        return !endOfInput || !decoder.flush(out).isError();
    }

    private static @Nullable String fromByteOrderMark(byte[] bytes) {
        if (bytes.length >= 3 && (bytes[0] & 0xff) == 0xef && (bytes[1] & 0xff) == 0xbb
                && (bytes[2] & 0xff) == 0xbf) {
            return "utf-8";
        }
        if (bytes.length >= 2 && (bytes[0] & 0xff) == 0xfe && (bytes[1] & 0xff) == 0xff) {
            return "utf-16be";
        }
        if (bytes.length >= 2 && (bytes[0] & 0xff) == 0xff && (bytes[1] & 0xff) == 0xfe) {
            return "utf-16le";
        }
        return null;
    }

    private static @Nullable String fromDocumentDeclaration(byte[] bytes) {
        String head = new String(bytes, 0, Math.min(bytes.length, 2048), StandardCharsets.ISO_8859_1);
        Matcher xml = XML_DECLARATION.matcher(head);
        if (xml.find()) {
            return xml.group(1);
        }
        Matcher meta = META_CHARSET.matcher(head);
        if (meta.find()) {
            return meta.group(1);
        }
        return null;
    }
}
