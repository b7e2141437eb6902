package org.smileyface.scopedcrawler.filter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Admits URLs matching at least one of the configured globs. No globs means "match all".
 */
public final class UrlPatternFilter implements UrlFilter {

    private final List<GlobPattern> patterns = new ArrayList<>();

    public UrlPatternFilter(Collection<String> globs) {
        if (globs != null) {
            for (String glob : globs) {
                patterns.add(GlobPattern.compile(glob));
            }
        }
    }

    public List<GlobPattern> getPatterns() {
        return List.copyOf(patterns);
    }

    @Override
    public boolean admit(String url, String contentType) {
        if (patterns.isEmpty()) return true;
        for (GlobPattern p : patterns) {
            if (p.matches(url)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "UrlPatternFilter" + patterns;
    }
}
