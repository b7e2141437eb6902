package org.smileyface.scopedcrawler.processor;

import org.smileyface.scopedcrawler.config.CrawlConfig;
import org.smileyface.scopedcrawler.crawler.TraversalType;
import org.smileyface.scopedcrawler.filter.FilterSpec;
import org.smileyface.scopedcrawler.proxy.ProxyEntry;
import org.smileyface.scopedcrawler.scorer.ScoreSpec;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ready-made crawl strategies.
 */
public final class CrawlStrategies {

    public static final String HTML = "text/html";

    private CrawlStrategies() {
    }

    /**
     * Breadth-first discovery of HTML pages on one domain whose URLs match the given globs.
     */
    public static CrawlStrategy webContentDiscovery(String domain, List<String> urlPatterns, int maxPages,
                                                    List<ProxyEntry> proxies) {
        return CrawlStrategy.builder(TraversalType.BFS, FilterSpec.of(domain, urlPatterns, HTML))
                .maxPages(maxPages)
                .proxies(proxies)
                .build();
    }

    /**
     * Best-first crawl of daily news pages, ranked by the "news" and "daily" keywords.
     */
    public static CrawlStrategy smartCrawl(String domain, List<ProxyEntry> proxies) {
        return CrawlStrategy.builder(TraversalType.BEST_FIRST, FilterSpec.of(domain, List.of("*news/daily*"), HTML))
                .scoreSpec(new ScoreSpec(Set.of("news", "daily"), 0.7))
                .maxPages(10)
                .proxies(proxies)
                .build();
    }

    /**
     * Strategy described by a crawl config file. Call {@link CrawlConfig#validate()} first.
     */
    public static CrawlStrategy fromConfig(CrawlConfig config, List<ProxyEntry> proxies, boolean proxiesRequired,
                                           int concurrency, int maxRetries) {
        FilterSpec filters = new FilterSpec(Set.of(config.siteDomain()), config.urlPatterns(),
                new LinkedHashSet<>(config.allowedContentTypes()));
        CrawlStrategy.Builder builder = CrawlStrategy.builder(config.strategy(), filters)
                .maxPages(config.maxPages())
                .maxDepth(config.maxDepth())
                .concurrency(concurrency)
                .maxRetries(maxRetries)
                .proxies(proxies)
                .proxiesRequired(proxiesRequired);
        if (!config.keywords().isEmpty() || config.strategy() == TraversalType.BEST_FIRST) {
            builder.scoreSpec(new ScoreSpec(new LinkedHashSet<>(config.keywords()), config.keywordWeight()));
        }
        return builder.build();
    }
}
