package org.smileyface.scopedcrawler.scorer;

import org.smileyface.scopedcrawler.config.ConfigurationException;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Scores text by the fraction of configured keywords it contains, scaled by the weight:
 * {@code weight * hits / keywords}. No keyword hit yields 0.
 */
public final class KeywordRelevanceScorer implements RelevanceScorer {

    private final List<String> keywords;
    private final double weight;

    public KeywordRelevanceScorer(ScoreSpec spec) {
        Objects.requireNonNull(spec, "spec");
        if (Double.isNaN(spec.weight()) || spec.weight() < 0.0 || spec.weight() > 1.0) {
            throw new ConfigurationException("Keyword weight must be within [0, 1], got " + spec.weight());
        }
        this.keywords = spec.keywords().stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
        this.weight = spec.weight();
    }

    @Override
    public double score(String text) {
        if (keywords.isEmpty() || text == null || text.isBlank()) return 0.0;
        String haystack = text.toLowerCase(Locale.ROOT);
        long hits = keywords.stream().filter(haystack::contains).count();
        return weight * ((double) hits / keywords.size());
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public double getWeight() {
        return weight;
    }
}
