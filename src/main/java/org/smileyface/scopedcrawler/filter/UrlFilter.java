package org.smileyface.scopedcrawler.filter;

/**
 * A single admission rule evaluated by {@link FilterChain}.
 */
@FunctionalInterface
public interface UrlFilter {

    /**
     * Returns true if the candidate may be enqueued / kept.
     *
     * @param url         normalized absolute URL
     * @param contentType response content type, or null when the URL has not been fetched yet
     * @return true if admitted
     */
    boolean admit(String url, String contentType);

    /**
     * Whether this filter looks at response metadata and must be re-run after fetch.
     */
    default boolean inspectsResponse() {
        return false;
    }

    /**
     * Whether this filter bounds which hosts may be contacted. Such filters also apply to
     * redirects of the seed, which otherwise bypasses admission.
     */
    default boolean scopesHost() {
        return false;
    }
}
