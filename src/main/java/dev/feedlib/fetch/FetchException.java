package dev.feedlib.fetch;

/**
 * Raised inside the fetch pipeline to abort with a sentinel outcome. Never escapes
 * {@link FeedFetcher}; it is converted to a {@link FetchResponse} at the read boundary.
 */
class FetchException extends RuntimeException {

    private final FetchStatus status;

    FetchException(FetchStatus status, String message) {
        super(message);
        this.status = status;
    }

    FetchException(FetchStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    FetchStatus status() {
        return status;
    }
}
