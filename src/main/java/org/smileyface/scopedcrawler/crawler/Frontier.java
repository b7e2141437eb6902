package org.smileyface.scopedcrawler.crawler;

/**
 * The set of discovered-but-not-yet-fetched URLs plus the visited set used for deduplication.
 *
 * <p>Implementations are not synchronized; the crawl session serializes every call under its
 * own lock so that pop/push and visited-set membership change together.</p>
 */
public interface Frontier {

    /**
     * Enqueue a candidate. A candidate deeper than the frontier's max depth, or whose URL was
     * already enqueued once in this session, is ignored.
     *
     * @param target   candidate with a normalized URL
     * @param priority relevance score; ignored by breadth-first frontiers
     * @return true if the candidate was enqueued
     */
    boolean push(CrawlTarget target, double priority);

    /**
     * Remove the next candidate to dispatch. Non-blocking.
     *
     * @return next candidate or null if none
     */
    CrawlTarget pop();

    boolean isEmpty();

    int size();

    /**
     * @return true if the URL has been enqueued at any point in this session
     */
    boolean isVisited(String url);

    int visitedCount();

    int getMaxDepth();
}
