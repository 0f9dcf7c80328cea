package dev.feedlib.fetch;

import java.util.Arrays;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * Uniform outcome of a single fetch attempt.
 *
 * <p>{@code content} is always the raw body, never decoded; {@code encoding} is the best guess a
 * caller should decode it with. Failure outcomes carry a {@link FetchStatus} code and empty
 * content.
 *
 * @param status upstream status verbatim, or a negative {@link FetchStatus} code
 * @param url the final URL after redirects (the requested URL for failures)
 * @param content raw body bytes, empty for failures
 * @param encoding detected text encoding, null when there is no body to decode
 * @param feedType document family, null when there is no body to classify
 * @param mimeType declared mime type without parameters, if any
 * @param etag {@code ETag} response header, if any
 * @param lastModified {@code Last-Modified} response header, if any
 */
public record FetchResponse(
        int status,
        String url,
        byte[] content,
        @Nullable String encoding,
        @Nullable FeedType feedType,
        @Nullable String mimeType,
        @Nullable String etag,
        @Nullable String lastModified
) {

    private static final byte[] EMPTY = new byte[0];

    public FetchResponse {
        content = content == null || content.length == 0 ? EMPTY : content.clone();
    }

    /**
     * Builds a failure outcome with empty content.
     *
     * @param status the sentinel describing the failure
     * @param url the URL the failure relates to
     * @return a response that is never {@link #ok()}
     */
    public static FetchResponse failure(FetchStatus status, String url) {
        return new FetchResponse(status.code(), url, EMPTY, null, null, null, null, null);
    }

    @Override
    public byte[] content() {
        return content.length == 0 ? EMPTY : content.clone();
    }

    public boolean ok() {
        return status >= 200 && status < 300;
    }

    public boolean notModified() {
        return status == 304;
    }

    public boolean is(FetchStatus sentinel) {
        return status == sentinel.code();
    }

    public boolean hasContent() {
        return content.length > 0;
    }

    @Override
    public String toString() {
        return "FetchResponse[status=" + FetchStatus.nameOf(status) + ", url=" + url
                + ", length=" + content.length + ", encoding=" + encoding
                + ", feedType=" + (feedType == null ? null : feedType.value()) + "]";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FetchResponse other)) {
            return false;
        }
        return status == other.status
                && Objects.equals(url, other.url)
                && Arrays.equals(content, other.content)
                && Objects.equals(encoding, other.encoding)
                && feedType == other.feedType
                && Objects.equals(mimeType, other.mimeType)
                && Objects.equals(etag, other.etag)
                && Objects.equals(lastModified, other.lastModified);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(status, url, encoding, feedType, mimeType, etag, lastModified);
        return 31 * result + Arrays.hashCode(content);
    }
}
