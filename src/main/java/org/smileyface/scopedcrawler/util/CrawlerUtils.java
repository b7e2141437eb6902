package org.smileyface.scopedcrawler.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

public class CrawlerUtils {

    private CrawlerUtils() {
        // No instanciation
    }

    /**
     * Normalizes an absolute http(s) URL into the identity key used by the frontier:
     * lower-case scheme and host, default port removed, empty path resolved to "/",
     * query parameters sorted and the fragment stripped.
     *
     * @param raw absolute URL string (may be null/blank)
     * @return normalized URL, or null when the input is not a usable http(s) URL
     */
    public static String normalizeUrl(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            URI uri = new URI(raw.trim());
            String scheme = uri.getScheme();
            if (scheme == null) return null;
            String lowerScheme = scheme.toLowerCase(Locale.ROOT);
            if (!lowerScheme.equals("http") && !lowerScheme.equals("https")) {
                return null; // skip mailto:, javascript:, ftp: ...
            }
            String host = uri.getHost();
            if (host == null) return null;
            String path = uri.getRawPath();
            if (path == null || path.isBlank()) path = "/";

            StringBuilder sb = new StringBuilder();
            sb.append(lowerScheme).append("://").append(host.toLowerCase(Locale.ROOT));
            if (uri.getPort() != -1 && uri.getPort() != defaultPort(lowerScheme)) {
                sb.append(':').append(uri.getPort());
            }
            sb.append(path);
            String query = sortQuery(uri.getRawQuery());
            if (query != null) sb.append('?').append(query);
            return sb.toString();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * @return lower-cased host of the URL, or null if it cannot be parsed
     */
    public static String hostOf(String url) {
        if (url == null) return null;
        try {
            String host = new URI(url.trim()).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * File name used when persisting a page: the last path segment of the URL plus ".md".
     * URLs ending in "/" map to "index.md". Characters that are unsafe in file names are
     * replaced with '_'.
     */
    public static String resultFileName(String url) {
        String segment = "";
        if (url != null) {
            String withoutQuery = url.split("[?#]", 2)[0];
            int slash = withoutQuery.lastIndexOf('/');
            segment = slash >= 0 ? withoutQuery.substring(slash + 1) : withoutQuery;
            // a bare "https://host" has its host as last segment
            if (withoutQuery.endsWith("://" + segment)) segment = "";
        }
        if (segment.isBlank()) segment = "index";
        return segment.replaceAll("[^A-Za-z0-9._-]", "_") + ".md";
    }

    private static String sortQuery(String query) {
        if (query == null || query.isBlank()) return null;
        return Arrays.stream(query.split("&"))
                .filter(p -> !p.isEmpty())
                .sorted()
                .collect(Collectors.joining("&"));
    }

    private static int defaultPort(String scheme) {
        return "https".equals(scheme) ? 443 : 80;
    }
}
