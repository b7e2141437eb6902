package org.smileyface.scopedcrawler.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.scopedcrawler.config.ConfigurationException;
import org.smileyface.scopedcrawler.config.CrawlConfig;
import org.smileyface.scopedcrawler.config.CrawlerProperties;
import org.smileyface.scopedcrawler.fetch.Fetcher;
import org.smileyface.scopedcrawler.processor.CrawlEngine;
import org.smileyface.scopedcrawler.processor.CrawlState;
import org.smileyface.scopedcrawler.processor.CrawlStrategies;
import org.smileyface.scopedcrawler.processor.CrawlStrategy;
import org.smileyface.scopedcrawler.proxy.ProxyEntry;
import org.smileyface.scopedcrawler.proxy.ProxyListLoader;
import org.smileyface.scopedcrawler.sink.LoggingResultSink;
import org.smileyface.scopedcrawler.sink.MarkdownFileResultSink;
import org.smileyface.scopedcrawler.sink.ResultSink;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Runs crawls for the application: loads the crawl config and proxy list, builds the strategy
 * and drives a {@link CrawlEngine} that writes pages as markdown and logs each result.
 */
@Service
public class CrawlerService {

    private static final Logger log = LoggerFactory.getLogger(CrawlerService.class);

    public static final String DEFAULT_CONFIG_RESOURCE = "crawler-config.json";

    private final CrawlerProperties properties;
    private final Fetcher fetcher;

    public CrawlerService(CrawlerProperties properties, Fetcher fetcher) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    /**
     * Crawls from the seed using the configured crawl config file.
     *
     * @return terminal state of the crawl
     * @throws ConfigurationException if config, proxies or result directory are invalid
     */
    public CrawlState crawl(String seedUrl) {
        CrawlConfig config = loadConfig();
        CrawlStrategy strategy = CrawlStrategies.fromConfig(config, loadProxies(), properties.isProxiesRequired(),
                properties.getWorkerCount(), properties.getMaxRetries());
        return crawl(seedUrl, strategy);
    }

    /**
     * Breadth-first crawl of {@code domain} restricted to URLs matching {@code urlPatterns}.
     */
    public CrawlState webContentDiscovery(String seedUrl, String domain, List<String> urlPatterns, int maxPages) {
        return crawl(seedUrl, withProcessSettings(
                CrawlStrategies.webContentDiscovery(domain, urlPatterns, maxPages, loadProxies())));
    }

    /**
     * Best-first crawl of daily news pages on {@code domain}.
     */
    public CrawlState smartCrawl(String seedUrl, String domain) {
        return crawl(seedUrl, withProcessSettings(CrawlStrategies.smartCrawl(domain, loadProxies())));
    }

    public CrawlState crawl(String seedUrl, CrawlStrategy strategy) {
        return crawl(seedUrl, strategy, defaultSink());
    }

    public CrawlState crawl(String seedUrl, CrawlStrategy strategy, ResultSink sink) {
        CrawlEngine engine = new CrawlEngine(fetcher, sink, strategy);
        log.info("Crawling {} with {}", seedUrl, strategy);
        CrawlState state = engine.crawl(seedUrl);
        log.info("Crawl of {} finished: state={}, pages={}, visited={}",
                seedUrl, state, engine.getPagesFetched(), engine.getVisitedCount());
        return state;
    }

    public CrawlConfig loadConfig() {
        String file = properties.getConfigFile();
        if (file == null || file.isBlank()) {
            return CrawlConfig.fromClasspath(DEFAULT_CONFIG_RESOURCE);
        }
        return CrawlConfig.fromFile(Path.of(file));
    }

    /**
     * @return the proxy list; empty only when proxies are optional and no file is configured
     */
    public List<ProxyEntry> loadProxies() {
        String file = properties.getProxiesFile();
        if (file == null || file.isBlank()) {
            if (!properties.isProxiesRequired()) {
                log.warn("No proxy file configured, crawling without proxies");
                return List.of();
            }
            return ProxyListLoader.load(null);
        }
        return ProxyListLoader.load(Path.of(file));
    }

    ResultSink defaultSink() {
        return new MarkdownFileResultSink(Path.of(properties.getResultDir()))
                .andThen(new LoggingResultSink());
    }

    private CrawlStrategy withProcessSettings(CrawlStrategy preset) {
        return preset.toBuilder()
                .concurrency(properties.getWorkerCount())
                .maxRetries(properties.getMaxRetries())
                .proxiesRequired(properties.isProxiesRequired())
                .build();
    }
}
