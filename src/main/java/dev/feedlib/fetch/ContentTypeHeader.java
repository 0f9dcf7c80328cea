package dev.feedlib.fetch;

import java.util.Locale;

import org.jspecify.annotations.Nullable;

/**
 * Lenient parse of a {@code Content-Type} header value.
 *
 * <p>Unlike {@link org.springframework.http.MediaType#parseMediaType(String)} this never throws:
 * single quotes, odd casing, stray whitespace and missing subtypes are tolerated, and anything
 * unusable parses to null fields.
 *
 * @param mimeType lowercase {@code type/subtype}, or null if absent or malformed
 * @param charset charset parameter with quotes stripped, or null
 */
public record ContentTypeHeader(@Nullable String mimeType, @Nullable String charset) {

    private static final ContentTypeHeader EMPTY = new ContentTypeHeader(null, null);

    public static ContentTypeHeader parse(@Nullable String header) {
        if (header == null || header.isBlank()) {
            return EMPTY;
        }
        String[] parts = header.split(";");
        String mimeType = parts[0].trim().toLowerCase(Locale.ROOT);
        if (mimeType.isEmpty() || mimeType.indexOf('/') <= 0 || mimeType.endsWith("/")) {
            mimeType = null;
        }

        String charset = null;
        for (int i = 1; i < parts.length; i++) {
            String param = parts[i].trim();
            int eq = param.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String name = param.substring(0, eq).trim();
            if (!"charset".equalsIgnoreCase(name)) {
                continue;
            }
            String value = stripQuotes(param.substring(eq + 1).trim());
            if (!value.isEmpty()) {
                charset = value;
            }
            break;
        }
        return new ContentTypeHeader(mimeType, charset);
    }

    static String stripQuotes(String value) {
        String result = value;
        while (result.length() >= 1
                && (result.charAt(0) == '"' || result.charAt(0) == '\'')) {
            result = result.substring(1);
        }
        while (!result.isEmpty()
                && (result.charAt(result.length() - 1) == '"'
                        || result.charAt(result.length() - 1) == '\'')) {
            result = result.substring(0, result.length() - 1);
        }
        return result.trim();
    }
}
