package org.smileyface.scopedcrawler.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.scopedcrawler.crawler.CrawlTarget;
import org.smileyface.scopedcrawler.crawler.Frontier;
import org.smileyface.scopedcrawler.filter.FilterChain;
import org.smileyface.scopedcrawler.model.CrawlResult;
import org.smileyface.scopedcrawler.proxy.ProxyEntry;
import org.smileyface.scopedcrawler.proxy.ProxyRotator;
import org.smileyface.scopedcrawler.scorer.RelevanceScorer;
import org.smileyface.scopedcrawler.sink.ResultSink;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable state of one crawl: frontier and visited set, page and in-flight counters, proxy
 * cursor and lifecycle state. Frontier, counters and state change together under one lock;
 * the proxy cursor is synchronized separately inside the rotator.
 *
 * <p>Dispatch is only allowed while {@code pagesFetched + inFlight < maxPages}, so emissions
 * can never overrun the budget.</p>
 */
final class CrawlSession {

    private static final Logger log = LoggerFactory.getLogger(CrawlSession.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private final Frontier frontier;
    private final FilterChain filterChain;
    private final RelevanceScorer scorer;
    private final ProxyRotator proxyRotator;
    private final ResultSink sink;
    private final int maxPages;
    private final int maxRetries;

    // guarded by lock
    private int pagesFetched;
    private int inFlight;
    private long discoverySeq;

    private volatile CrawlState state = CrawlState.RUNNING;

    CrawlSession(Frontier frontier, FilterChain filterChain, RelevanceScorer scorer, ProxyRotator proxyRotator,
                 ResultSink sink, int maxPages, int maxRetries) {
        this.frontier = Objects.requireNonNull(frontier, "frontier");
        this.filterChain = Objects.requireNonNull(filterChain, "filterChain");
        this.scorer = scorer;
        this.proxyRotator = proxyRotator;
        this.sink = Objects.requireNonNull(sink, "sink");
        this.maxPages = maxPages;
        this.maxRetries = maxRetries;
    }

    /**
     * Pushes the operator-supplied seed at depth 0. Domain and pattern admission do not apply.
     */
    void seed(String url) {
        lock.lock();
        try {
            frontier.push(new CrawlTarget(url, 0, null, discoverySeq++), 0.0);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a candidate can be dispatched or the crawl is over.
     *
     * @return the next candidate, counted as in flight, or null once the session left RUNNING
     */
    CrawlTarget take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            for (;;) {
                if (state != CrawlState.RUNNING) return null;
                if (pagesFetched + inFlight < maxPages) {
                    CrawlTarget next = frontier.pop();
                    if (next != null) {
                        inFlight++;
                        return next;
                    }
                }
                if (inFlight == 0) {
                    // nothing queued and no fetch left that could discover more
                    transition(CrawlState.COMPLETED);
                    return null;
                }
                changed.await();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Settles an in-flight candidate that produced a result: counts it, emits it, and pushes
     * the discovered links unless this emission used up the budget. Results arriving after the
     * session left RUNNING are discarded.
     *
     * @return true if the result was emitted
     */
    boolean complete(CrawlTarget target, CrawlResult result, List<ScoredLink> discovered) {
        lock.lock();
        try {
            if (state != CrawlState.RUNNING) return false;
            pagesFetched++;
            try {
                sink.accept(result);
            } finally {
                if (pagesFetched >= maxPages) {
                    transition(CrawlState.BUDGET_EXHAUSTED);
                } else {
                    pushAll(target, discovered);
                }
            }
            return true;
        } finally {
            inFlight--;
            changed.signalAll();
            lock.unlock();
        }
    }

    /**
     * Settles an in-flight candidate that redirected to an admitted location. The location takes
     * the candidate's place in the frontier at the same depth and parent; nothing is counted
     * against the budget.
     */
    void redirect(CrawlTarget target, String location) {
        lock.lock();
        try {
            if (state == CrawlState.RUNNING) {
                CrawlTarget moved = new CrawlTarget(location, target.depth(), target.parentUrl(), discoverySeq++, target.score());
                if (!frontier.push(moved, moved.score())) {
                    log.debug("Redirect {} -> {} already visited", target.url(), location);
                }
            }
        } finally {
            inFlight--;
            changed.signalAll();
            lock.unlock();
        }
    }

    /**
     * Settles an in-flight candidate that produced nothing (fetch dropped, filtered, cancelled).
     */
    void discard(CrawlTarget target) {
        lock.lock();
        try {
            inFlight--;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
        log.debug("Discarded {}", target.url());
    }

    /**
     * @return true if this call moved the session to CANCELLED
     */
    boolean cancel() {
        lock.lock();
        try {
            if (state != CrawlState.RUNNING) return false;
            transition(CrawlState.CANCELLED);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return next proxy for a request attempt, or null when crawling without proxies
     */
    ProxyEntry nextProxy() {
        return proxyRotator == null ? null : proxyRotator.next();
    }

    private void pushAll(CrawlTarget parent, List<ScoredLink> discovered) {
        int added = 0;
        for (ScoredLink link : discovered) {
            CrawlTarget child = new CrawlTarget(link.url(), parent.depth() + 1, parent.url(), discoverySeq++, link.score());
            if (frontier.push(child, child.score())) added++;
        }
        if (added > 0) {
            log.debug("Queued {} of {} links from {} (frontier={})", added, discovered.size(), parent.url(), frontier.size());
        }
    }

    // caller holds the lock
    private void transition(CrawlState newState) {
        CrawlState old = state;
        state = newState;
        changed.signalAll();
        log.info("Crawl state {} -> {} (pagesFetched={}, visited={}, pending={})",
                old, newState, pagesFetched, frontier.visitedCount(), frontier.size());
    }

    CrawlState getState() {
        return state;
    }

    boolean isRunning() {
        return state == CrawlState.RUNNING;
    }

    int getPagesFetched() {
        lock.lock();
        try {
            return pagesFetched;
        } finally {
            lock.unlock();
        }
    }

    int getVisitedCount() {
        lock.lock();
        try {
            return frontier.visitedCount();
        } finally {
            lock.unlock();
        }
    }

    FilterChain getFilterChain() {
        return filterChain;
    }

    RelevanceScorer getScorer() {
        return scorer;
    }

    int getMaxDepth() {
        return frontier.getMaxDepth();
    }

    int getMaxRetries() {
        return maxRetries;
    }

    /**
     * A discovered link that passed pre-push admission, with its discovery-time score.
     */
    record ScoredLink(String url, double score) {}
}
