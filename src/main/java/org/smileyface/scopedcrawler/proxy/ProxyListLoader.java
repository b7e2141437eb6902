package org.smileyface.scopedcrawler.proxy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.scopedcrawler.config.ConfigurationException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads proxies from a colon-separated file, one {@code ip:port:username:password} record per
 * line. Blank lines are skipped. A single malformed record rejects the whole file; a partial
 * proxy list is never returned.
 */
public final class ProxyListLoader {

    private static final Logger log = LoggerFactory.getLogger(ProxyListLoader.class);

    private ProxyListLoader() {
    }

    /**
     * @param file proxy file
     * @return the proxies in file order, never empty
     * @throws ConfigurationException if the path is missing, the file is unreadable or empty,
     *                                or any line is malformed
     */
    public static List<ProxyEntry> load(Path file) {
        if (file == null) {
            throw new ConfigurationException(
                    "Proxy file is missing. Set crawler.proxies-file or the PROXIES_FILE environment variable");
        }
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Proxy file not found: " + file);
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read proxy file " + file, e);
        }
        List<ProxyEntry> proxies = parse(lines);
        log.info("Loaded {} proxies from {}", proxies.size(), file);
        return proxies;
    }

    static List<ProxyEntry> parse(List<String> lines) {
        List<ProxyEntry> proxies = new ArrayList<>();
        for (int idx = 0; idx < lines.size(); idx++) {
            String line = lines.get(idx).strip();
            if (line.isEmpty()) continue;
            try {
                proxies.add(ProxyEntry.parse(line));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid proxy at line " + (idx + 1) + ": " + e.getMessage(), e);
            }
        }
        if (proxies.isEmpty()) {
            throw new ConfigurationException("Proxy file is empty");
        }
        return List.copyOf(proxies);
    }
}
