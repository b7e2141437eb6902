package org.smileyface.scopedcrawler.fetch;

import org.smileyface.scopedcrawler.proxy.ProxyEntry;

/**
 * Retrieves and renders one page. The crawl engine does not know about HTTP, TLS or HTML; it
 * hands over one URL plus one proxy and gets one outcome back. Implementations must not follow
 * redirects themselves: a redirect is returned as {@link FetchOutcome#redirect} so the engine
 * can admit or reject the target.
 *
 * <p>Cancellation is delivered by interrupting the calling thread. Implementations should
 * check the interrupt flag around blocking work and throw {@link InterruptedException}.</p>
 */
@FunctionalInterface
public interface Fetcher {

    /**
     * @param url   normalized absolute URL
     * @param proxy proxy to route the request through, or null for a direct connection
     * @return the fetched page, or the redirect it answered with
     * @throws FetchException       if the page could not be retrieved
     * @throws InterruptedException if the crawl was cancelled while fetching
     */
    FetchOutcome fetch(String url, ProxyEntry proxy) throws FetchException, InterruptedException;
}
