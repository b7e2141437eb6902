package org.smileyface.scopedcrawler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Process-level crawler settings. What to crawl lives in the crawl config file
 * ({@link CrawlConfig}); how the process crawls lives here.
 */
@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {

    /** Seed URL. When blank the application starts without crawling. */
    private String seedUrl;

    /** Path of the JSON crawl config. Blank means the classpath resource crawler-config.json. */
    private String configFile;

    /** Path of the proxy list, one ip:port:username:password per line. */
    private String proxiesFile;

    /** When false a missing proxy file is tolerated and pages are fetched directly. */
    private boolean proxiesRequired = true;

    /** Directory receiving one markdown file per crawled page. */
    private String resultDir = ".tmp_data/";

    private int workerCount = 5;

    /** Additional attempts, each on the next proxy, after a retriable fetch error. */
    private int maxRetries = 2;

    private String userAgent = "SmileyfaceScopedCrawler/0.1";

    /** Fetch timeout in milliseconds. */
    private int requestTimeoutMs = 10000;

    public String getSeedUrl() {
        return seedUrl;
    }

    public void setSeedUrl(String seedUrl) {
        this.seedUrl = seedUrl;
    }

    public String getConfigFile() {
        return configFile;
    }

    public void setConfigFile(String configFile) {
        this.configFile = configFile;
    }

    public String getProxiesFile() {
        return proxiesFile;
    }

    public void setProxiesFile(String proxiesFile) {
        this.proxiesFile = proxiesFile;
    }

    public boolean isProxiesRequired() {
        return proxiesRequired;
    }

    public void setProxiesRequired(boolean proxiesRequired) {
        this.proxiesRequired = proxiesRequired;
    }

    public String getResultDir() {
        return resultDir;
    }

    public void setResultDir(String resultDir) {
        this.resultDir = (resultDir == null || resultDir.isBlank()) ? ".tmp_data/" : resultDir;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = workerCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public int getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(int requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }
}
