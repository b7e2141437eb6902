package org.smileyface.scopedcrawler.config;

import org.smileyface.scopedcrawler.fetch.Fetcher;
import org.smileyface.scopedcrawler.fetch.JsoupFetcher;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the default {@link Fetcher}: jsoup with the configured user agent and timeout.
 * Tests may replace it with their own bean.
 */
@Configuration
public class BeanConfig {

    @Bean
    @ConditionalOnMissingBean(Fetcher.class)
    public Fetcher fetcher(CrawlerProperties properties) {
        return new JsoupFetcher(properties.getUserAgent(), properties.getRequestTimeoutMs());
    }
}
