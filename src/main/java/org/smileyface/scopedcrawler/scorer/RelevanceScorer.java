package org.smileyface.scopedcrawler.scorer;

/**
 * Maps the text known about a link at discovery time to a priority in [0, 1].
 * Implementations must be pure and safe to call from several workers at once.
 */
@FunctionalInterface
public interface RelevanceScorer {

    double score(String text);
}
