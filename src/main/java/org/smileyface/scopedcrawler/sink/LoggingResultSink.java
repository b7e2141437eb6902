package org.smileyface.scopedcrawler.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.scopedcrawler.model.CrawlResult;

import java.util.concurrent.atomic.AtomicLong;

public class LoggingResultSink implements ResultSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingResultSink.class);

    private final AtomicLong total = new AtomicLong();

    @Override
    public void accept(CrawlResult result) {
        long n = total.incrementAndGet();
        log.info("Crawled: {} (Depth: {}, score={}, via={}) - total crawled {}",
                result.url(), result.depth(), result.score(), result.fetchedViaProxy(), n);
    }

    public long getTotal() {
        return total.get();
    }
}
