package org.smileyface.scopedcrawler.crawler;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Frontier discipline used by a crawl.
 */
public enum TraversalType {
    BFS("bfs"),
    BEST_FIRST("best_first");

    private final String key;

    TraversalType(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public Frontier newFrontier(int maxDepth) {
        return this == BEST_FIRST ? new BestFirstFrontier(maxDepth) : new BreadthFirstFrontier(maxDepth);
    }

    @JsonCreator
    public static TraversalType fromKey(String value) {
        if (value == null) return BFS;
        String v = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (TraversalType t : values()) {
            if (t.key.equals(v) || t.name().toLowerCase(Locale.ROOT).equals(v)) return t;
        }
        throw new IllegalArgumentException("Unknown crawl strategy '" + value + "', expected bfs or best_first");
    }
}
