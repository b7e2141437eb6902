package org.smileyface.scopedcrawler.processor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.scopedcrawler.config.ConfigurationException;
import org.smileyface.scopedcrawler.crawler.Frontier;
import org.smileyface.scopedcrawler.crawler.TraversalType;
import org.smileyface.scopedcrawler.fetch.Fetcher;
import org.smileyface.scopedcrawler.filter.FilterChain;
import org.smileyface.scopedcrawler.proxy.ProxyRotator;
import org.smileyface.scopedcrawler.proxy.RoundRobinProxyRotator;
import org.smileyface.scopedcrawler.scorer.KeywordRelevanceScorer;
import org.smileyface.scopedcrawler.scorer.RelevanceScorer;
import org.smileyface.scopedcrawler.sink.ResultSink;
import org.smileyface.scopedcrawler.util.CrawlerUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one deep crawl on a pool of {@link CrawlWorker}s. Engines are single-use: after a
 * terminal state a new engine is needed for the next crawl.
 *
 * <pre>
 * IDLE -> RUNNING -> COMPLETED | BUDGET_EXHAUSTED | CANCELLED
 * IDLE -> FAILED (invalid strategy or seed, nothing emitted)
 * </pre>
 */
public class CrawlEngine {

    private static final Logger log = LogManager.getLogger();

    private final Fetcher fetcher;
    private final ResultSink sink;
    private final List<CrawlWorker> workers = new CopyOnWriteArrayList<>();
    private final List<Future<?>> futures = new CopyOnWriteArrayList<>();

    private volatile CrawlStrategy strategy;
    private volatile CrawlSession session;
    private volatile boolean failed;
    private ExecutorService executor;

    public CrawlEngine(Fetcher fetcher, ResultSink sink) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public CrawlEngine(Fetcher fetcher, ResultSink sink, CrawlStrategy strategy) {
        this(fetcher, sink);
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    public synchronized void setStrategy(CrawlStrategy strategy) {
        if (getState() != CrawlState.IDLE) {
            throw new IllegalStateException("Cannot change strategy of a " + getState() + " CrawlEngine");
        }
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    public CrawlStrategy getStrategy() {
        return strategy;
    }

    /**
     * Validates the strategy, seeds the frontier and starts the workers. Returns immediately.
     *
     * @throws CrawlerNotConfiguredException if no strategy was set; the engine stays IDLE
     * @throws ConfigurationException        if the strategy or seed is invalid; the engine is FAILED
     * @throws IllegalStateException         if the engine was already started
     */
    public synchronized void start(String seedUrl) {
        CrawlState current = getState();
        if (current != CrawlState.IDLE) {
            throw new IllegalStateException("CrawlEngine already " + current);
        }
        CrawlStrategy s = strategy;
        if (s == null) {
            throw new CrawlerNotConfiguredException();
        }
        CrawlSession newSession;
        try {
            newSession = openSession(s, seedUrl);
        } catch (ConfigurationException e) {
            failed = true;
            log.error("CrawlEngine FAILED: {}", e.getMessage());
            throw e;
        }

        int n = s.getConcurrency();
        workers.clear();
        futures.clear();
        executor = Executors.newFixedThreadPool(n, workerThreads());
        session = newSession;
        for (int i = 0; i < n; i++) {
            CrawlWorker w = new CrawlWorker("worker-" + i, newSession, fetcher);
            workers.add(w);
            futures.add(executor.submit(w));
        }
        log.info("CrawlEngine STARTED seed={} with {} workers: {}", seedUrl, n, s);
    }

    /**
     * Starts a crawl and blocks until it reaches a terminal state.
     */
    public CrawlState crawl(String seedUrl) {
        start(seedUrl);
        awaitCompletion(null);
        return getState();
    }

    /**
     * Wait until all workers exit or the timeout elapses.
     *
     * @param timeout maximum wait, null for no limit
     * @return true if the crawl finished before the timeout
     */
    public boolean awaitCompletion(Duration timeout) {
        if (session == null) return true;
        long remainingMs = timeout == null ? Long.MAX_VALUE : Math.max(0, timeout.toMillis());
        long deadline = remainingMs == Long.MAX_VALUE ? Long.MAX_VALUE : System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(remainingMs);
        for (Future<?> f : futures) {
            long nanosLeft = deadline == Long.MAX_VALUE ? Long.MAX_VALUE : deadline - System.nanoTime();
            if (nanosLeft <= 0) return false;
            try {
                f.get(nanosLeft, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                logAggregate("AWAIT TIMEOUT");
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logAggregate("AWAIT INTERRUPTED");
                return false;
            } catch (Exception e) {
                // ExecutionException or CancellationException: worker is done either way
                log.debug("Worker future ended abnormally: {}", e.toString());
            }
        }
        executor.shutdown();
        if (!getState().isTerminal()) {
            log.warn("All workers exited while crawl still RUNNING; see worker statuses");
        }
        logAggregate("FINISHED " + getState());
        return true;
    }

    /**
     * Stops dispatching, wakes idle workers and interrupts in-flight fetches. Results that
     * complete afterwards are discarded.
     *
     * @return true if the crawl was running and is now cancelled
     */
    public synchronized boolean cancel() {
        CrawlSession s = session;
        if (s == null || !s.cancel()) return false;
        for (Runnable pending : executor.shutdownNow()) {
            if (pending instanceof Future<?> f) f.cancel(false);
        }
        log.info("CrawlEngine CANCEL requested after {} pages", s.getPagesFetched());
        return true;
    }

    public CrawlState getState() {
        CrawlSession s = session;
        if (s != null) return s.getState();
        return failed ? CrawlState.FAILED : CrawlState.IDLE;
    }

    public int getPagesFetched() {
        CrawlSession s = session;
        return s == null ? 0 : s.getPagesFetched();
    }

    public int getVisitedCount() {
        CrawlSession s = session;
        return s == null ? 0 : s.getVisitedCount();
    }

    public List<WorkerStatus> getWorkerStatuses() {
        List<WorkerStatus> list = new ArrayList<>(workers.size());
        for (CrawlWorker w : workers) {
            list.add(w.getStatus());
        }
        return list;
    }

    private CrawlSession openSession(CrawlStrategy s, String seedUrl) {
        String seed = CrawlerUtils.normalizeUrl(seedUrl);
        if (seed == null) {
            throw new ConfigurationException("Seed URL must be an absolute http(s) URL, got '" + seedUrl + "'");
        }
        if (s.getMaxPages() <= 0) {
            throw new ConfigurationException("max_pages must be > 0, got " + s.getMaxPages());
        }
        if (s.getMaxDepth() < 0) {
            throw new ConfigurationException("max_depth must be >= 0, got " + s.getMaxDepth());
        }
        if (s.getConcurrency() < 1) {
            throw new ConfigurationException("Concurrency must be >= 1, got " + s.getConcurrency());
        }
        if (s.getMaxRetries() < 0) {
            throw new ConfigurationException("max_retries must be >= 0, got " + s.getMaxRetries());
        }

        FilterChain chain = FilterChain.from(s.getFilterSpec());

        RelevanceScorer scorer = null;
        if (s.getTraversal() == TraversalType.BEST_FIRST) {
            if (s.getScoreSpec() == null) {
                throw new ConfigurationException("best_first crawl requires keywords to score links");
            }
            scorer = new KeywordRelevanceScorer(s.getScoreSpec());
        }

        ProxyRotator rotator = null;
        if (!s.getProxies().isEmpty() || s.isProxiesRequired()) {
            rotator = new RoundRobinProxyRotator(s.getProxies());
        } else {
            log.warn("No proxies configured, fetching directly");
        }

        Frontier frontier = s.getTraversal().newFrontier(s.getMaxDepth());
        CrawlSession created = new CrawlSession(frontier, chain, scorer, rotator, sink, s.getMaxPages(), s.getMaxRetries());
        created.seed(seed);
        return created;
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "crawl-worker-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }

    private void logAggregate(String event) {
        int completed = 0;
        int stopped = 0;
        int error = 0;
        long processed = 0L;
        long emitted = 0L;
        List<WorkerStatus> statuses = getWorkerStatuses();
        for (WorkerStatus s : statuses) {
            processed += s.getProcessedCount();
            emitted += s.getEmittedCount();
            WorkerState st = s.getState();
            if (st == WorkerState.COMPLETED) completed++;
            else if (st == WorkerState.STOPPED) stopped++;
            else if (st == WorkerState.ERROR) error++;
        }
        log.info("CrawlEngine {}: workers -> completed={}, stopped={}, error={}, totalProcessed={}, emitted={}, visited={} (workers={})",
                event, completed, stopped, error, processed, emitted, getVisitedCount(), statuses.size());
    }
}
