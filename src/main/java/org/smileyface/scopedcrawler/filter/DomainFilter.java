package org.smileyface.scopedcrawler.filter;

import org.smileyface.scopedcrawler.config.ConfigurationException;
import org.smileyface.scopedcrawler.util.CrawlerUtils;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Admits URLs whose host equals, or is a subdomain of, one of the allowed domains.
 * Everything else, including every external domain, is rejected.
 */
public final class DomainFilter implements UrlFilter {

    private final Set<String> allowedDomains = new LinkedHashSet<>();

    public DomainFilter(Collection<String> allowedDomains) {
        if (allowedDomains != null) {
            for (String d : allowedDomains) {
                if (d == null || d.isBlank()) continue;
                String domain = d.trim().toLowerCase(Locale.ROOT);
                if (domain.startsWith(".")) domain = domain.substring(1);
                this.allowedDomains.add(domain);
            }
        }
        if (this.allowedDomains.isEmpty()) {
            throw new ConfigurationException("At least one allowed domain is required");
        }
    }

    public Set<String> getAllowedDomains() {
        return Set.copyOf(allowedDomains);
    }

    @Override
    public boolean admit(String url, String contentType) {
        String host = CrawlerUtils.hostOf(url);
        if (host == null) return false;
        for (String domain : allowedDomains) {
            if (host.equals(domain) || host.endsWith("." + domain)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean scopesHost() {
        return true;
    }

    @Override
    public String toString() {
        return "DomainFilter" + allowedDomains;
    }
}
