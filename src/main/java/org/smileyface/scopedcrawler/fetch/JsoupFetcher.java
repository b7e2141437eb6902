package org.smileyface.scopedcrawler.fetch;

import org.jsoup.Connection;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.scopedcrawler.proxy.ProxyEntry;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.MalformedURLException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * {@link Fetcher} backed by jsoup. Routes through the given proxy with its credentials and
 * extracts {@code a[href]} links with their anchor text from HTML responses. Redirects are
 * not followed; they come back as {@link FetchOutcome#redirect} so the target passes admission
 * like any other link.
 */
public class JsoupFetcher implements Fetcher {

    private static final Logger log = LoggerFactory.getLogger(JsoupFetcher.class);

    static final String TUNNELING_DISABLED_SCHEMES = "jdk.http.auth.tunneling.disabledSchemes";

    static {
        // HttpURLConnection refuses Basic proxy auth on CONNECT unless this is cleared before it loads
        if (System.getProperty(TUNNELING_DISABLED_SCHEMES) == null) {
            System.setProperty(TUNNELING_DISABLED_SCHEMES, "");
        }
    }

    private final String userAgent;
    private final int timeoutMs;

    public JsoupFetcher(String userAgent, int timeoutMs) {
        this.userAgent = Objects.toString(userAgent, "SmileyfaceScopedCrawler/0.1");
        this.timeoutMs = Math.max(0, timeoutMs);
    }

    @Override
    public FetchOutcome fetch(String url, ProxyEntry proxy) throws FetchException, InterruptedException {
        if (Thread.interrupted()) throw new InterruptedException("Fetch cancelled before start: " + url);
        Connection conn;
        try {
            conn = Jsoup.connect(url);
        } catch (IllegalArgumentException e) {
            throw new FetchException(FetchErrorKind.INVALID_URL, "Invalid URL " + url, e);
        }
        conn.userAgent(userAgent)
                .timeout(timeoutMs)
                .followRedirects(false)
                .ignoreHttpErrors(false)
                .ignoreContentType(true);
        if (proxy != null) {
            conn.proxy(proxy.host(), proxy.port());
            if (proxy.hasCredentials()) {
                conn.auth(ctx -> ctx.isProxy() ? ctx.credentials(proxy.username(), Objects.toString(proxy.password(), "")) : null);
            }
        }

        Connection.Response res;
        try {
            res = conn.execute();
        } catch (HttpStatusException e) {
            FetchErrorKind kind = FetchErrorKind.forHttpStatus(e.getStatusCode());
            throw new FetchException(kind, "HTTP " + e.getStatusCode() + " for " + url, e);
        } catch (SocketTimeoutException e) {
            throw new FetchException(FetchErrorKind.TIMEOUT, "Timed out fetching " + url + " via " + proxy, e);
        } catch (UnknownHostException e) {
            throw new FetchException(FetchErrorKind.UNKNOWN_HOST, "Unknown host for " + url, e);
        } catch (MalformedURLException | IllegalArgumentException e) {
            throw new FetchException(FetchErrorKind.INVALID_URL, "Invalid URL " + url, e);
        } catch (IOException e) {
            if (e instanceof InterruptedIOException || Thread.currentThread().isInterrupted()) {
                throw interrupted(url, e);
            }
            throw new FetchException(FetchErrorKind.CONNECTION, "Failed to fetch " + url + " via " + proxy + ": " + e.getMessage(), e);
        }
        if (Thread.interrupted()) throw new InterruptedException("Fetch cancelled: " + url);

        int status = res.statusCode();
        String location = res.header("Location");
        if (status >= 300 && status < 400 && location != null && !location.isBlank()) {
            String target = resolve(url, location);
            log.debug("{} redirected ({}) to {}", url, status, target);
            return FetchOutcome.redirect(status, target);
        }

        String contentType = res.contentType();
        try {
            if (isHtml(contentType)) {
                return fromDocument(status, contentType, res.parse());
            }
            return new FetchOutcome(status, contentType, List.of(), res.body(), Map.of());
        } catch (IOException e) {
            throw new FetchException(FetchErrorKind.CONNECTION, "Failed to read body of " + url, e);
        }
    }

    static FetchOutcome fromDocument(int status, String contentType, Document doc) {
        List<String> links = new ArrayList<>();
        Map<String, String> contexts = new LinkedHashMap<>();
        for (Element a : doc.select("a[href]")) {
            String abs = a.absUrl("href");
            if (abs.isBlank()) continue;
            links.add(abs);
            String text = a.text();
            if (text.isBlank()) text = a.attr("title");
            if (!text.isBlank()) contexts.putIfAbsent(abs, text.trim());
        }
        String text = doc.body() != null ? doc.body().text() : "";
        log.debug("Parsed {}: {} links, {} chars", doc.location(), links.size(), text.length());
        return new FetchOutcome(status, contentType, links, text, contexts);
    }

    private static String resolve(String base, String location) throws FetchException {
        try {
            return URI.create(base).resolve(location.trim()).toString();
        } catch (IllegalArgumentException e) {
            throw new FetchException(FetchErrorKind.INVALID_URL, "Invalid redirect location '" + location + "' from " + base, e);
        }
    }

    private static boolean isHtml(String contentType) {
        if (contentType == null) return true;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.startsWith("text/html") || ct.startsWith("application/xhtml+xml");
    }

    private static InterruptedException interrupted(String url, IOException cause) {
        InterruptedException ie = new InterruptedException("Fetch interrupted: " + url);
        ie.initCause(cause);
        return ie;
    }
}
