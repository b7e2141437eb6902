package org.smileyface.scopedcrawler.filter;

import java.util.List;
import java.util.Set;

/**
 * Immutable admission settings supplied at session start.
 *
 * @param allowedDomains      domains (and their subdomains) that may be crawled
 * @param urlPatterns         ordered globs; empty means match all
 * @param allowedContentTypes primary content types kept after fetch; empty means any
 */
public record FilterSpec(Set<String> allowedDomains, List<String> urlPatterns, Set<String> allowedContentTypes) {

    public FilterSpec {
        allowedDomains = allowedDomains == null ? Set.of() : Set.copyOf(allowedDomains);
        urlPatterns = urlPatterns == null ? List.of() : List.copyOf(urlPatterns);
        allowedContentTypes = allowedContentTypes == null ? Set.of() : Set.copyOf(allowedContentTypes);
    }

    public static FilterSpec of(String domain, List<String> urlPatterns, String... contentTypes) {
        return new FilterSpec(Set.of(domain), urlPatterns, Set.of(contentTypes));
    }
}
