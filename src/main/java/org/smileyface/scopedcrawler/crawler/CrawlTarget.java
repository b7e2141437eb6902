package org.smileyface.scopedcrawler.crawler;

import java.util.Objects;

/**
 * A URL waiting in, or popped from, the frontier.
 *
 * @param url          normalized URL, the identity key
 * @param depth        link distance from the seed (seed = 0)
 * @param parentUrl    page the link was found on, null for the seed
 * @param discoveredAt monotonically increasing discovery sequence within a session
 * @param score        relevance score computed at discovery, 0 when unscored
 */
public record CrawlTarget(String url, int depth, String parentUrl, long discoveredAt, double score) {

    public CrawlTarget {
        Objects.requireNonNull(url, "url");
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
    }

    public CrawlTarget(String url, int depth, String parentUrl, long discoveredAt) {
        this(url, depth, parentUrl, discoveredAt, 0.0);
    }
}
