package org.smileyface.scopedcrawler.fetch;

/**
 * Classification of fetch failures and whether a retry on another proxy may help.
 */
public enum FetchErrorKind {
    /** Connect or read timeout. */
    TIMEOUT(true),
    /** Connection refused/reset, proxy failure and other transport errors. */
    CONNECTION(true),
    /** HTTP 5xx. */
    SERVER_ERROR(true),
    /** HTTP 408 or 429. */
    THROTTLED(true),
    /** HTTP 407: the proxy refused its credentials. Another proxy may accept. */
    PROXY_AUTH(true),
    /** Other HTTP 4xx. */
    CLIENT_ERROR(false),
    /** Host name could not be resolved. */
    UNKNOWN_HOST(false),
    /** URL could not be requested at all. */
    INVALID_URL(false);

    private final boolean retriable;

    FetchErrorKind(boolean retriable) {
        this.retriable = retriable;
    }

    public boolean isRetriable() {
        return retriable;
    }

    public static FetchErrorKind forHttpStatus(int status) {
        if (status == 408 || status == 429) return THROTTLED;
        if (status == 407) return PROXY_AUTH;
        if (status >= 500) return SERVER_ERROR;
        return CLIENT_ERROR;
    }
}
