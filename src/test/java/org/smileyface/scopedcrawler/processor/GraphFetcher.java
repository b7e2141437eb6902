package org.smileyface.scopedcrawler.processor;

import org.smileyface.scopedcrawler.fetch.FetchErrorKind;
import org.smileyface.scopedcrawler.fetch.FetchException;
import org.smileyface.scopedcrawler.fetch.FetchOutcome;
import org.smileyface.scopedcrawler.fetch.Fetcher;
import org.smileyface.scopedcrawler.proxy.ProxyEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * In-memory link graph served as a {@link Fetcher}. Records every attempt with the proxy used,
 * can redirect chosen URLs, can fail chosen URLs a number of times and can block chosen URLs until interrupted.
 */
class GraphFetcher implements Fetcher {

    static final String HTML = "text/html; charset=UTF-8";

    record Page(String contentType, List<String> links, Map<String, String> anchors) {}

    record Call(String url, ProxyEntry proxy) {}

    private final Map<String, Page> pages = new ConcurrentHashMap<>();
    private final Map<String, String> redirects = new ConcurrentHashMap<>();
    private final Map<String, Deque<FetchException>> failures = new ConcurrentHashMap<>();
    private final List<Call> calls = Collections.synchronizedList(new ArrayList<>());
    private volatile Function<String, Page> generator;
    private volatile Predicate<String> blocking = url -> false;
    private final CountDownLatch never = new CountDownLatch(1);

    GraphFetcher page(String url, String... links) {
        pages.put(url, new Page(HTML, Arrays.asList(links), Map.of()));
        return this;
    }

    /**
     * Page whose links carry anchor text; a null text means the link has no anchor context.
     */
    GraphFetcher anchoredPage(String url, String... linkAndText) {
        List<String> links = new ArrayList<>();
        Map<String, String> anchors = new LinkedHashMap<>();
        for (int i = 0; i < linkAndText.length; i += 2) {
            links.add(linkAndText[i]);
            if (linkAndText[i + 1] != null) anchors.put(linkAndText[i], linkAndText[i + 1]);
        }
        pages.put(url, new Page(HTML, links, anchors));
        return this;
    }

    GraphFetcher typedPage(String url, String contentType, String... links) {
        pages.put(url, new Page(contentType, Arrays.asList(links), Map.of()));
        return this;
    }

    GraphFetcher redirecting(String from, String to) {
        redirects.put(from, to);
        return this;
    }

    GraphFetcher failing(String url, FetchErrorKind kind, int times) {
        Deque<FetchException> queue = failures.computeIfAbsent(url, k -> new ArrayDeque<>());
        for (int i = 0; i < times; i++) {
            queue.add(new FetchException(kind, kind + " for " + url));
        }
        return this;
    }

    GraphFetcher generating(Function<String, Page> generator) {
        this.generator = generator;
        return this;
    }

    GraphFetcher blocking(Predicate<String> blocking) {
        this.blocking = blocking;
        return this;
    }

    @Override
    public FetchOutcome fetch(String url, ProxyEntry proxy) throws FetchException, InterruptedException {
        calls.add(new Call(url, proxy));
        if (blocking.test(url)) {
            never.await();
        }
        Deque<FetchException> queue = failures.get(url);
        if (queue != null) {
            FetchException e;
            synchronized (queue) {
                e = queue.poll();
            }
            if (e != null) throw e;
        }
        String location = redirects.get(url);
        if (location != null) return FetchOutcome.redirect(302, location);
        Page page = pages.get(url);
        if (page == null && generator != null) page = generator.apply(url);
        if (page == null) throw new FetchException(FetchErrorKind.CLIENT_ERROR, "HTTP 404 for " + url);
        return new FetchOutcome(200, page.contentType(), page.links(), "content of " + url, page.anchors());
    }

    List<Call> calls() {
        synchronized (calls) {
            return new ArrayList<>(calls);
        }
    }

    List<Call> callsFor(String url) {
        return calls().stream().filter(c -> c.url().equals(url)).toList();
    }
}
