package org.smileyface.scopedcrawler.sink;

import org.smileyface.scopedcrawler.model.CrawlResult;

import java.util.Objects;

/**
 * Receives each {@link CrawlResult} as it is produced. Calls are serialized by the engine:
 * one call at a time, at most once per URL per session.
 */
@FunctionalInterface
public interface ResultSink {

    void accept(CrawlResult result);

    default ResultSink andThen(ResultSink next) {
        Objects.requireNonNull(next, "next");
        return result -> {
            accept(result);
            next.accept(result);
        };
    }
}
