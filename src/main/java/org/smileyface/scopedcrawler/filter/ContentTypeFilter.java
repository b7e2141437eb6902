package org.smileyface.scopedcrawler.filter;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Admits responses whose primary content type (charset and other parameters stripped) is
 * in the allowed set. URLs without content-type metadata are always admitted; an empty
 * allowed set admits everything.
 */
public final class ContentTypeFilter implements UrlFilter {

    private final Set<String> allowedTypes = new LinkedHashSet<>();

    public ContentTypeFilter(Collection<String> allowedTypes) {
        if (allowedTypes != null) {
            for (String t : allowedTypes) {
                String primary = primaryType(t);
                if (primary != null) this.allowedTypes.add(primary);
            }
        }
    }

    /**
     * @return "text/html" for "Text/HTML; charset=UTF-8", or null for a null/blank header
     */
    public static String primaryType(String contentType) {
        if (contentType == null) return null;
        String primary = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return primary.isEmpty() ? null : primary;
    }

    @Override
    public boolean admit(String url, String contentType) {
        if (contentType == null || allowedTypes.isEmpty()) return true;
        String primary = primaryType(contentType);
        return primary == null || allowedTypes.contains(primary);
    }

    @Override
    public boolean inspectsResponse() {
        return true;
    }

    @Override
    public String toString() {
        return "ContentTypeFilter" + allowedTypes;
    }
}
