package dev.feedlib.fetch;

import java.io.IOException;
import java.io.InputStream;

/**
 * Bounded body reads. A body is read in two steps so a rejected content type never buffers more
 * than {@link ContentSniffer#PREFIX_LENGTH} bytes.
 */
final class BodyReader {

    private BodyReader() {
        // static utility
    }

    static byte[] readPrefix(InputStream in) throws IOException {
        return in.readNBytes(ContentSniffer.PREFIX_LENGTH);
    }

    /**
     * Reads the rest of a body after its prefix.
     *
     * @throws FetchException with {@link FetchStatus#CONTENT_TOO_LARGE_ERROR} if the whole body
     *     exceeds {@code maxLength}
     */
    static byte[] readRemaining(InputStream in, byte[] prefix, long maxLength, String url)
            throws IOException {
        if (prefix.length > maxLength) {
            throw tooLarge(url, maxLength);
        }
        if (prefix.length < ContentSniffer.PREFIX_LENGTH) {
            return prefix;
        }
        long budget = maxLength - prefix.length + 1;
        byte[] rest = in.readNBytes((int) Math.min(budget, Integer.MAX_VALUE - 8));
        if (prefix.length + (long) rest.length > maxLength) {
            throw tooLarge(url, maxLength);
        }
        byte[] content = new byte[prefix.length + rest.length];
        System.arraycopy(prefix, 0, content, 0, prefix.length);
        System.arraycopy(rest, 0, content, prefix.length, rest.length);
        return content;
    }

    static byte[] readAll(InputStream in, long maxLength, String url) throws IOException {
        return readRemaining(in, readPrefix(in), maxLength, url);
    }

    static void checkDeclaredLength(long contentLength, long maxLength, String url) {
        if (contentLength > maxLength) {
            throw tooLarge(url, maxLength);
        }
    }

    private static FetchException tooLarge(String url, long maxLength) {
        return new FetchException(FetchStatus.CONTENT_TOO_LARGE_ERROR,
                "Response from " + url + " exceeds " + maxLength + " bytes");
    }
}
