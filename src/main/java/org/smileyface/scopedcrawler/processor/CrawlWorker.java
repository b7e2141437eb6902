package org.smileyface.scopedcrawler.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.scopedcrawler.crawler.CrawlTarget;
import org.smileyface.scopedcrawler.fetch.FetchException;
import org.smileyface.scopedcrawler.fetch.FetchOutcome;
import org.smileyface.scopedcrawler.fetch.Fetcher;
import org.smileyface.scopedcrawler.filter.FilterChain;
import org.smileyface.scopedcrawler.model.CrawlResult;
import org.smileyface.scopedcrawler.processor.CrawlSession.ScoredLink;
import org.smileyface.scopedcrawler.proxy.ProxyEntry;
import org.smileyface.scopedcrawler.scorer.RelevanceScorer;
import org.smileyface.scopedcrawler.util.CrawlerUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pulls candidates from a {@link CrawlSession}, fetches them through the rotating proxy pool,
 * and hands results and discovered links back to the session. Exits when the session stops
 * dispatching or the thread is interrupted.
 */
public class CrawlWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CrawlWorker.class);

    private final String id;
    private final CrawlSession session;
    private final Fetcher fetcher;

    private final AtomicLong processedCount = new AtomicLong(0);
    private final AtomicLong emittedCount = new AtomicLong(0);

    private volatile WorkerState state = WorkerState.NEW;
    private volatile String lastUrl;
    private volatile String lastError;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    CrawlWorker(String id, CrawlSession session, Fetcher fetcher) {
        this.id = Objects.requireNonNull(id, "id");
        this.session = Objects.requireNonNull(session, "session");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    public WorkerStatus getStatus() {
        return new WorkerStatus(id, state, processedCount.get(), emittedCount.get(), lastUrl, lastError, startedAt, finishedAt);
    }

    @Override
    public void run() {
        transitionTo(WorkerState.RUNNING, null);
        try {
            for (;;) {
                CrawlTarget target = session.take();
                if (target == null) {
                    transitionTo(session.getState() == CrawlState.CANCELLED ? WorkerState.STOPPED : WorkerState.COMPLETED, null);
                    return;
                }
                lastUrl = target.url();
                process(target);
                processedCount.incrementAndGet();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            transitionTo(WorkerState.STOPPED, null);
        } catch (Throwable t) {
            lastError = t.getMessage();
            transitionTo(WorkerState.ERROR, t);
        }
    }

    private void process(CrawlTarget target) throws InterruptedException {
        boolean settled = false;
        try {
            Fetched fetched = fetchWithRetries(target.url());
            if (fetched == null) return;

            FetchOutcome outcome = fetched.outcome();
            if (outcome.isRedirect()) {
                settled = followRedirect(target, outcome.redirectLocation());
                return;
            }
            if (!session.getFilterChain().admitResponse(target.url(), outcome.contentType())) {
                log.debug("Worker {} dropped {}: content type {} not allowed", id, target.url(), outcome.contentType());
                return;
            }

            List<String> links = normalizeLinks(outcome.rawLinks());
            List<ScoredLink> discovered = discover(target, outcome, links);
            CrawlResult result = new CrawlResult(target.url(), target.parentUrl(), target.depth(), target.score(),
                    outcome.renderedText(), links, outcome.contentType(), fetched.proxy(), Instant.now());
            settled = true;
            if (session.complete(target, result, discovered)) {
                emittedCount.incrementAndGet();
            }
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            log.error("Worker {} failed to process {}: {}", id, target.url(), e.getMessage(), e);
        } finally {
            if (!settled) session.discard(target);
        }
    }

    /**
     * Fetches a URL, moving to the next proxy after each retriable failure.
     *
     * @return the outcome and the proxy that produced it, or null if the URL was dropped
     */
    private Fetched fetchWithRetries(String url) throws InterruptedException {
        int attempts = 1 + session.getMaxRetries();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (!session.isRunning()) return null;
            ProxyEntry proxy = session.nextProxy();
            try {
                return new Fetched(fetcher.fetch(url, proxy), proxy);
            } catch (FetchException e) {
                if (!e.isRetriable()) {
                    log.info("Worker {} dropping {} after {} error: {}", id, url, e.getKind(), e.getMessage());
                    lastError = e.getMessage();
                    return null;
                }
                if (attempt == attempts) {
                    log.warn("Worker {} dropping {} after {} attempts: {}", id, url, attempts, e.getMessage());
                    lastError = e.getMessage();
                    return null;
                }
                log.debug("Worker {} retrying {} on next proxy (attempt {}/{}): {}", id, url, attempt + 1, attempts, e.getMessage());
            }
        }
        return null;
    }

    /**
     * Re-queues an admitted redirect target in place of {@code target}.
     *
     * @return true if the session took the redirect, false if the caller must discard
     */
    private boolean followRedirect(CrawlTarget target, String location) {
        String url = CrawlerUtils.normalizeUrl(location);
        boolean fromSeed = target.parentUrl() == null;
        if (url == null || url.equals(target.url()) || !session.getFilterChain().admitRedirect(url, fromSeed)) {
            log.info("Worker {} dropped {}: redirect to {} not admitted", id, target.url(), location);
            return false;
        }
        log.debug("Worker {} following redirect {} -> {}", id, target.url(), url);
        session.redirect(target, url);
        return true;
    }

    private static List<String> normalizeLinks(List<String> rawLinks) {
        Set<String> out = new LinkedHashSet<>();
        for (String raw : rawLinks) {
            String normalized = CrawlerUtils.normalizeUrl(raw);
            if (normalized != null) out.add(normalized);
        }
        return new ArrayList<>(out);
    }

    /**
     * Runs pre-push admission and scoring on the page's links. Frontier depth and dedup checks
     * happen later, under the session lock.
     */
    private List<ScoredLink> discover(CrawlTarget parent, FetchOutcome outcome, List<String> links) {
        List<ScoredLink> discovered = new ArrayList<>();
        if (parent.depth() + 1 > session.getMaxDepth()) return discovered;

        FilterChain chain = session.getFilterChain();
        RelevanceScorer scorer = session.getScorer();
        Set<String> seen = new LinkedHashSet<>();
        for (String raw : outcome.rawLinks()) {
            String url = CrawlerUtils.normalizeUrl(raw);
            if (url == null || url.equals(parent.url()) || !seen.add(url)) continue;
            if (!chain.admit(url, null)) continue;
            double score = 0.0;
            if (scorer != null) {
                String context = outcome.anchorContext(raw);
                score = scorer.score(context != null ? context : url);
            }
            discovered.add(new ScoredLink(url, score));
        }
        if (log.isDebugEnabled()) {
            log.debug("Worker {} found {} links on {}, {} admitted", id, links.size(), parent.url(), discovered.size());
        }
        return discovered;
    }

    private void transitionTo(WorkerState newState, Throwable error) {
        WorkerState old = this.state;
        if (newState == WorkerState.RUNNING) {
            if (this.startedAt == null) {
                this.startedAt = Instant.now();
            }
            this.state = WorkerState.RUNNING;
            log.info("Worker {} state {} -> {} (startedAt={})", id, old, this.state, startedAt);
            return;
        }

        this.finishedAt = Instant.now();
        this.state = newState;
        long dur = startedAt != null ? durationMs(startedAt, finishedAt) : 0L;
        long count = processedCount.get();
        switch (newState) {
            case STOPPED -> log.info("Worker {} state {} -> STOPPED after {} ms (processed={}, lastUrl={})", id, old, dur, count, lastUrl);
            case COMPLETED -> log.info("Worker {} state {} -> COMPLETED after {} ms (processed={}, emitted={})", id, old, dur, count, emittedCount.get());
            case ERROR -> log.error("Worker {} state {} -> ERROR after {} ms (processed={}, lastUrl={}, error={})", id, old, dur, count, lastUrl, lastError, error);
            default -> log.info("Worker {} state {} -> {}", id, old, newState);
        }
    }

    private static long durationMs(Instant start, Instant end) {
        return Math.max(0, end.toEpochMilli() - start.toEpochMilli());
    }

    private record Fetched(FetchOutcome outcome, ProxyEntry proxy) {}
}
