package org.smileyface.scopedcrawler.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.scopedcrawler.crawler.TraversalType;
import org.smileyface.scopedcrawler.scorer.ScoreSpec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Crawl configuration file. The structure is closed: unknown fields fail the load.
 *
 * <pre>
 * {
 *   "site_domain": "example.com",
 *   "url_patterns": ["*example.com/news*"],
 *   "max_pages": 25,
 *   "max_depth": 2,
 *   "allowed_content_types": ["text/html"],
 *   "strategy": "best_first",
 *   "keywords": ["news", "daily"],
 *   "keyword_weight": 0.7
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = false)
public record CrawlConfig(@JsonProperty("site_domain") String siteDomain,
                          @JsonProperty("url_patterns") List<String> urlPatterns,
                          @JsonProperty("max_pages") Integer maxPages,
                          @JsonProperty("max_depth") Integer maxDepth,
                          @JsonProperty("allowed_content_types") List<String> allowedContentTypes,
                          @JsonProperty("strategy") TraversalType strategy,
                          @JsonProperty("keywords") List<String> keywords,
                          @JsonProperty("keyword_weight") Double keywordWeight) {

    private static final Logger log = LogManager.getLogger(CrawlConfig.class);

    public static final int DEFAULT_MAX_DEPTH = 2;
    public static final List<String> DEFAULT_CONTENT_TYPES = List.of("text/html");

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    public CrawlConfig {
        maxDepth = maxDepth == null ? DEFAULT_MAX_DEPTH : maxDepth;
        allowedContentTypes = allowedContentTypes == null ? DEFAULT_CONTENT_TYPES : List.copyOf(allowedContentTypes);
        strategy = strategy == null ? TraversalType.BFS : strategy;
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        keywordWeight = keywordWeight == null ? ScoreSpec.DEFAULT_WEIGHT : keywordWeight;
        urlPatterns = urlPatterns == null ? null : List.copyOf(urlPatterns);
    }

    /**
     * Reads and validates a config file.
     *
     * @throws ConfigurationException if the file is missing, unreadable, malformed or invalid
     */
    public static CrawlConfig fromFile(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new ConfigurationException("Crawl config file not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            CrawlConfig cfg = read(in, file.toString());
            log.info("Loaded crawl config from {}: {}", file, cfg);
            return cfg;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read crawl config " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads and validates a config from the classpath.
     */
    public static CrawlConfig fromClasspath(String resource) {
        try (InputStream in = CrawlConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Crawl config resource not found on classpath: " + resource);
            }
            CrawlConfig cfg = read(in, "classpath:" + resource);
            log.info("Loaded crawl config from classpath:{}: {}", resource, cfg);
            return cfg;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read crawl config classpath:" + resource + ": " + e.getMessage(), e);
        }
    }

    static CrawlConfig read(InputStream in, String source) throws IOException {
        CrawlConfig cfg = MAPPER.readValue(in, CrawlConfig.class);
        if (cfg == null) {
            throw new ConfigurationException("Crawl config " + source + " is empty");
        }
        return cfg.validate();
    }

    /**
     * @return this config
     * @throws ConfigurationException naming the first invalid field
     */
    public CrawlConfig validate() {
        if (siteDomain == null || siteDomain.isBlank()) {
            throw new ConfigurationException("site_domain is required");
        }
        if (urlPatterns == null) {
            throw new ConfigurationException("url_patterns is required");
        }
        if (maxPages == null) {
            throw new ConfigurationException("max_pages is required");
        }
        if (maxPages <= 0) {
            throw new ConfigurationException("max_pages must be > 0, got " + maxPages);
        }
        if (maxDepth < 0) {
            throw new ConfigurationException("max_depth must be >= 0, got " + maxDepth);
        }
        if (keywordWeight.isNaN() || keywordWeight < 0.0 || keywordWeight > 1.0) {
            throw new ConfigurationException("keyword_weight must be within [0, 1], got " + keywordWeight);
        }
        if (strategy == TraversalType.BEST_FIRST && keywords.isEmpty()) {
            throw new ConfigurationException("best_first strategy requires keywords");
        }
        return this;
    }
}
