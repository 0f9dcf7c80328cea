package dev.feedlib.fetch;

import org.jspecify.annotations.Nullable;

/**
 * Sentinel outcomes of a fetch that did not produce an upstream status.
 *
 * <p>Codes are negative so they never collide with any upstream status, including non-standard
 * ones such as {@code 600}. A {@link FetchResponse} carries either an upstream status verbatim or
 * one of these codes.
 */
public enum FetchStatus {
    UNKNOWN_ERROR(-100),
    CONNECTION_ERROR(-200),
    DNS_ERROR(-201),
    PRIVATE_ADDRESS_ERROR(-202),
    CONNECTION_TIMEOUT(-203),
    SSL_ERROR(-204),
    READ_TIMEOUT(-205),
    CONNECTION_RESET(-206),
    RSS_PROXY_ERROR(-301),
    TOO_MANY_REDIRECT_ERROR(-401),
    CONTENT_TOO_LARGE_ERROR(-404),
    CONTENT_TYPE_NOT_SUPPORT_ERROR(-407);

    private final int code;

    FetchStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Looks up the sentinel for a status code.
     *
     * @param code any status code
     * @return the sentinel, or {@code null} if the code is an upstream status
     */
    public static @Nullable FetchStatus fromCode(int code) {
        for (FetchStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        return null;
    }

    /**
     * Renders a status for logs: the sentinel name, or the upstream number.
     *
     * @param code any status code
     * @return e.g. {@code "PRIVATE_ADDRESS_ERROR"} or {@code "404"}
     */
    public static String nameOf(int code) {
        FetchStatus status = fromCode(code);
        return status != null ? status.name() : Integer.toString(code);
    }
}
