package org.smileyface.scopedcrawler.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.smileyface.scopedcrawler.crawler.TraversalType;
import org.smileyface.scopedcrawler.processor.CrawlStrategies;
import org.smileyface.scopedcrawler.processor.CrawlStrategy;
import org.smileyface.scopedcrawler.scorer.ScoreSpec;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CrawlConfigTest {

    @TempDir
    Path tmp;

    private Path write(String json) throws Exception {
        return Files.writeString(tmp.resolve("config.json"), json);
    }

    @Test
    void minimalConfigGetsDefaults() throws Exception {
        CrawlConfig cfg = CrawlConfig.fromFile(write("""
                {"site_domain": "example.com", "url_patterns": ["*news*"], "max_pages": 5}
                """));

        assertThat(cfg.siteDomain()).isEqualTo("example.com");
        assertThat(cfg.urlPatterns()).containsExactly("*news*");
        assertThat(cfg.maxPages()).isEqualTo(5);
        assertThat(cfg.maxDepth()).isEqualTo(CrawlConfig.DEFAULT_MAX_DEPTH);
        assertThat(cfg.allowedContentTypes()).containsExactly("text/html");
        assertThat(cfg.strategy()).isEqualTo(TraversalType.BFS);
        assertThat(cfg.keywords()).isEmpty();
        assertThat(cfg.keywordWeight()).isEqualTo(ScoreSpec.DEFAULT_WEIGHT);
    }

    @Test
    void fullConfigBuildsBestFirstStrategy() throws Exception {
        CrawlConfig cfg = CrawlConfig.fromFile(write("""
                {
                  "site_domain": "example.com",
                  "url_patterns": ["*/news/*"],
                  "max_pages": 20,
                  "max_depth": 3,
                  "allowed_content_types": ["text/html", "application/xhtml+xml"],
                  "strategy": "best_first",
                  "keywords": ["news", "daily"],
                  "keyword_weight": 0.5
                }
                """));

        CrawlStrategy strategy = CrawlStrategies.fromConfig(cfg, List.of(), false, 3, 1);

        assertThat(strategy.getTraversal()).isEqualTo(TraversalType.BEST_FIRST);
        assertThat(strategy.getMaxPages()).isEqualTo(20);
        assertThat(strategy.getMaxDepth()).isEqualTo(3);
        assertThat(strategy.getConcurrency()).isEqualTo(3);
        assertThat(strategy.getMaxRetries()).isEqualTo(1);
        assertThat(strategy.isProxiesRequired()).isFalse();
        assertThat(strategy.getFilterSpec().allowedContentTypes()).containsExactlyInAnyOrder("text/html", "application/xhtml+xml");
        assertThat(strategy.getScoreSpec().keywords()).containsExactlyInAnyOrder("news", "daily");
        assertThat(strategy.getScoreSpec().weight()).isEqualTo(0.5);
    }

    @Test
    void unknownFieldIsRejected() throws Exception {
        Path file = write("""
                {"site_domain": "example.com", "url_patterns": [], "max_pages": 5, "max_pagez": 7}
                """);
        assertThatThrownBy(() -> CrawlConfig.fromFile(file))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("max_pagez");
    }

    @Test
    void missingRequiredFieldIsRejected() throws Exception {
        Path file = write("""
                {"site_domain": "example.com", "url_patterns": ["*"]}
                """);
        assertThatThrownBy(() -> CrawlConfig.fromFile(file))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("max_pages");
    }

    @Test
    void nonPositivePageBudgetIsRejected() throws Exception {
        Path file = write("""
                {"site_domain": "example.com", "url_patterns": ["*"], "max_pages": 0}
                """);
        assertThatThrownBy(() -> CrawlConfig.fromFile(file))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("max_pages");
    }

    @Test
    void unknownStrategyIsRejected() throws Exception {
        Path file = write("""
                {"site_domain": "example.com", "url_patterns": ["*"], "max_pages": 3, "strategy": "dfs"}
                """);
        assertThatThrownBy(() -> CrawlConfig.fromFile(file))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void bestFirstWithoutKeywordsIsRejected() throws Exception {
        Path file = write("""
                {"site_domain": "example.com", "url_patterns": ["*"], "max_pages": 3, "strategy": "best_first"}
                """);
        assertThatThrownBy(() -> CrawlConfig.fromFile(file))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("keywords");
    }

    @Test
    void malformedJsonAndMissingFileAreRejected() throws Exception {
        Path file = write("{ not json");
        assertThatThrownBy(() -> CrawlConfig.fromFile(file)).isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> CrawlConfig.fromFile(tmp.resolve("missing.json")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void bundledClasspathConfigLoads() {
        CrawlConfig cfg = CrawlConfig.fromClasspath("crawler-config.json");
        assertThat(cfg.siteDomain()).isEqualTo("delfi.lt");
        assertThat(cfg.maxPages()).isEqualTo(10);
        assertThatThrownBy(() -> CrawlConfig.fromClasspath("nope.json"))
                .isInstanceOf(ConfigurationException.class);
    }
}
