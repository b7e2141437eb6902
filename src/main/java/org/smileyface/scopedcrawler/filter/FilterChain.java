package org.smileyface.scopedcrawler.filter;

import java.util.List;
import java.util.Objects;

/**
 * Ordered AND-composition of {@link UrlFilter}s. Evaluation runs left to right and stops at
 * the first rejection.
 */
public final class FilterChain {

    private final List<UrlFilter> filters;

    public FilterChain(List<UrlFilter> filters) {
        this.filters = List.copyOf(Objects.requireNonNull(filters, "filters"));
    }

    /**
     * Builds the standard domain, pattern, content-type chain.
     *
     * @throws org.smileyface.scopedcrawler.config.ConfigurationException for an empty domain
     *         set or a malformed glob
     */
    public static FilterChain from(FilterSpec spec) {
        Objects.requireNonNull(spec, "spec");
        return new FilterChain(List.of(
                new DomainFilter(spec.allowedDomains()),
                new UrlPatternFilter(spec.urlPatterns()),
                new ContentTypeFilter(spec.allowedContentTypes())
        ));
    }

    /**
     * Pre-push admission. Content-type filters pass when {@code contentType} is null.
     */
    public boolean admit(String url, String contentType) {
        for (UrlFilter f : filters) {
            if (!f.admit(url, contentType)) return false;
        }
        return true;
    }

    /**
     * Post-fetch admission: re-runs only the filters that inspect response metadata.
     */
    public boolean admitResponse(String url, String contentType) {
        for (UrlFilter f : filters) {
            if (f.inspectsResponse() && !f.admit(url, contentType)) return false;
        }
        return true;
    }

    /**
     * Admission of a redirect target. A redirect of a discovered page goes through full
     * pre-push admission; a redirect of the seed only has to stay within the allowed hosts.
     */
    public boolean admitRedirect(String url, boolean fromSeed) {
        if (!fromSeed) return admit(url, null);
        for (UrlFilter f : filters) {
            if (f.scopesHost() && !f.admit(url, null)) return false;
        }
        return true;
    }

    public List<UrlFilter> getFilters() {
        return filters;
    }

    @Override
    public String toString() {
        return "FilterChain" + filters;
    }
}
