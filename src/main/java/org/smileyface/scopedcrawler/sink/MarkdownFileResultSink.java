package org.smileyface.scopedcrawler.sink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.scopedcrawler.config.ConfigurationException;
import org.smileyface.scopedcrawler.model.CrawlResult;
import org.smileyface.scopedcrawler.util.CrawlerUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes each page's text to {@code <resultDir>/<last path segment>.md}. Pages sharing a last
 * segment overwrite each other.
 */
public class MarkdownFileResultSink implements ResultSink {

    private static final Logger log = LoggerFactory.getLogger(MarkdownFileResultSink.class);

    private final Path resultDir;

    /**
     * @throws ConfigurationException if the result directory cannot be created
     */
    public MarkdownFileResultSink(Path resultDir) {
        this.resultDir = resultDir;
        try {
            Files.createDirectories(resultDir);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot create result directory " + resultDir, e);
        }
    }

    @Override
    public void accept(CrawlResult result) {
        Path file = resolve(result);
        try {
            Files.writeString(file, result.content(), StandardCharsets.UTF_8);
            log.debug("Saved {} to {}", result.url(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save result for " + result.url() + " to " + file, e);
        }
    }

    public Path resolve(CrawlResult result) {
        return resultDir.resolve(CrawlerUtils.resultFileName(result.url()));
    }

    public Path getResultDir() {
        return resultDir;
    }
}
