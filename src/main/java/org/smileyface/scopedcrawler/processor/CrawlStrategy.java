package org.smileyface.scopedcrawler.processor;

import org.smileyface.scopedcrawler.crawler.TraversalType;
import org.smileyface.scopedcrawler.filter.FilterSpec;
import org.smileyface.scopedcrawler.proxy.ProxyEntry;
import org.smileyface.scopedcrawler.scorer.ScoreSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of one deep crawl: traversal discipline, admission rules, relevance
 * scoring, budgets, concurrency and the proxy pool.
 *
 * <p>Values are not validated here. {@link CrawlEngine#start(String)} compiles the strategy and
 * reports problems as {@link org.smileyface.scopedcrawler.config.ConfigurationException}.</p>
 */
public final class CrawlStrategy {

    public static final int DEFAULT_MAX_DEPTH = 2;
    public static final int DEFAULT_MAX_PAGES = 50;
    public static final int DEFAULT_CONCURRENCY = 5;
    public static final int DEFAULT_MAX_RETRIES = 2;

    private final TraversalType traversal;
    private final FilterSpec filterSpec;
    private final ScoreSpec scoreSpec;
    private final int maxDepth;
    private final int maxPages;
    private final int concurrency;
    private final int maxRetries;
    private final List<ProxyEntry> proxies;
    private final boolean proxiesRequired;

    private CrawlStrategy(Builder b) {
        this.traversal = b.traversal;
        this.filterSpec = b.filterSpec;
        this.scoreSpec = b.scoreSpec;
        this.maxDepth = b.maxDepth;
        this.maxPages = b.maxPages;
        this.concurrency = b.concurrency;
        this.maxRetries = b.maxRetries;
        this.proxies = List.copyOf(b.proxies);
        this.proxiesRequired = b.proxiesRequired;
    }

    public static Builder builder(TraversalType traversal, FilterSpec filterSpec) {
        return new Builder(traversal, filterSpec);
    }

    public TraversalType getTraversal() { return traversal; }
    public FilterSpec getFilterSpec() { return filterSpec; }
    /** @return scoring settings, null for breadth-first crawls */
    public ScoreSpec getScoreSpec() { return scoreSpec; }
    public int getMaxDepth() { return maxDepth; }
    public int getMaxPages() { return maxPages; }
    public int getConcurrency() { return concurrency; }
    public int getMaxRetries() { return maxRetries; }
    public List<ProxyEntry> getProxies() { return proxies; }
    public boolean isProxiesRequired() { return proxiesRequired; }

    public Builder toBuilder() {
        return new Builder(traversal, filterSpec)
                .scoreSpec(scoreSpec)
                .maxDepth(maxDepth)
                .maxPages(maxPages)
                .concurrency(concurrency)
                .maxRetries(maxRetries)
                .proxies(proxies)
                .proxiesRequired(proxiesRequired);
    }

    @Override
    public String toString() {
        return "CrawlStrategy{traversal=" + traversal + ", filters=" + filterSpec + ", score=" + scoreSpec
                + ", maxDepth=" + maxDepth + ", maxPages=" + maxPages + ", concurrency=" + concurrency
                + ", maxRetries=" + maxRetries + ", proxies=" + proxies.size()
                + ", proxiesRequired=" + proxiesRequired + "}";
    }

    public static final class Builder {
        private final TraversalType traversal;
        private final FilterSpec filterSpec;
        private ScoreSpec scoreSpec;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private int maxPages = DEFAULT_MAX_PAGES;
        private int concurrency = DEFAULT_CONCURRENCY;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private List<ProxyEntry> proxies = new ArrayList<>();
        private boolean proxiesRequired = true;

        private Builder(TraversalType traversal, FilterSpec filterSpec) {
            this.traversal = Objects.requireNonNull(traversal, "traversal");
            this.filterSpec = Objects.requireNonNull(filterSpec, "filterSpec");
        }

        public Builder scoreSpec(ScoreSpec scoreSpec) { this.scoreSpec = scoreSpec; return this; }
        public Builder maxDepth(int maxDepth) { this.maxDepth = maxDepth; return this; }
        public Builder maxPages(int maxPages) { this.maxPages = maxPages; return this; }
        public Builder concurrency(int concurrency) { this.concurrency = concurrency; return this; }
        public Builder maxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }

        public Builder proxies(List<ProxyEntry> proxies) {
            this.proxies = proxies == null ? new ArrayList<>() : new ArrayList<>(proxies);
            return this;
        }

        public Builder proxiesRequired(boolean proxiesRequired) { this.proxiesRequired = proxiesRequired; return this; }

        public CrawlStrategy build() {
            return new CrawlStrategy(this);
        }
    }
}
