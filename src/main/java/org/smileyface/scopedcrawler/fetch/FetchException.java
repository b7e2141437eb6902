package org.smileyface.scopedcrawler.fetch;

import java.util.Objects;

/**
 * A failed fetch attempt.
 */
public class FetchException extends Exception {

    private final FetchErrorKind kind;
    private final boolean retriable;

    public FetchException(FetchErrorKind kind, String message) {
        this(kind, kind.isRetriable(), message, null);
    }

    public FetchException(FetchErrorKind kind, String message, Throwable cause) {
        this(kind, kind.isRetriable(), message, cause);
    }

    public FetchException(FetchErrorKind kind, boolean retriable, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.retriable = retriable;
    }

    public FetchErrorKind getKind() {
        return kind;
    }

    public boolean isRetriable() {
        return retriable;
    }
}
