package org.smileyface.scopedcrawler.crawler;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BestFirstFrontierTest {

    @Test
    void popsHighestScoreFirstWithDiscoveryOrderTieBreak() {
        BestFirstFrontier f = new BestFirstFrontier(2);
        f.push(new CrawlTarget("https://example.com/low", 1, null, 0), 0.1);
        f.push(new CrawlTarget("https://example.com/high-a", 1, null, 1), 0.7);
        f.push(new CrawlTarget("https://example.com/mid", 1, null, 2), 0.35);
        f.push(new CrawlTarget("https://example.com/high-b", 1, null, 3), 0.7);

        assertThat(f.peekPriority()).isEqualTo(0.7);
        List<String> order = new ArrayList<>();
        CrawlTarget t;
        while ((t = f.pop()) != null) order.add(t.url());

        assertThat(order).containsExactly(
                "https://example.com/high-a",
                "https://example.com/high-b",
                "https://example.com/mid",
                "https://example.com/low");
        assertThat(f.peekPriority()).isNaN();
    }

    @Test
    void breadthFirstIgnoresPriority() {
        BreadthFirstFrontier f = new BreadthFirstFrontier(2);
        f.push(new CrawlTarget("https://example.com/first", 1, null, 0), 0.0);
        f.push(new CrawlTarget("https://example.com/second", 1, null, 1), 1.0);
        assertThat(f.pop().url()).isEqualTo("https://example.com/first");
    }

    @Test
    void traversalTypeParsesConfigKeys() {
        assertThat(TraversalType.fromKey("best_first")).isEqualTo(TraversalType.BEST_FIRST);
        assertThat(TraversalType.fromKey("Best-First")).isEqualTo(TraversalType.BEST_FIRST);
        assertThat(TraversalType.fromKey(null)).isEqualTo(TraversalType.BFS);
        assertThat(TraversalType.BEST_FIRST.newFrontier(1)).isInstanceOf(BestFirstFrontier.class);
        assertThat(TraversalType.BFS.newFrontier(1)).isInstanceOf(BreadthFirstFrontier.class);
    }
}
