package org.smileyface.scopedcrawler.processor;

/**
 * Thrown when a crawl is started on an engine that has no {@link CrawlStrategy} set.
 */
public class CrawlerNotConfiguredException extends IllegalStateException {

    public CrawlerNotConfiguredException() {
        super("Crawl strategy not found. Call setStrategy(...) before start(...)");
    }
}
