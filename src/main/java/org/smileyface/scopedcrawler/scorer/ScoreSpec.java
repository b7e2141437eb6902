package org.smileyface.scopedcrawler.scorer;

import java.util.Set;

/**
 * Keyword relevance settings.
 *
 * @param keywords keywords looked up case-insensitively
 * @param weight   scale applied to the keyword hit ratio, in [0, 1]
 */
public record ScoreSpec(Set<String> keywords, double weight) {

    public static final double DEFAULT_WEIGHT = 0.7;

    public ScoreSpec {
        keywords = keywords == null ? Set.of() : Set.copyOf(keywords);
    }
}
