package org.smileyface.scopedcrawler.crawler;

import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * Max-priority frontier keyed by relevance score. Equal scores pop in discovery order.
 */
public class BestFirstFrontier extends AbstractFrontier {

    private static final Comparator<Scored> ORDER = Comparator
            .comparingDouble(Scored::priority).reversed()
            .thenComparingLong(s -> s.target().discoveredAt());

    private final PriorityQueue<Scored> queue = new PriorityQueue<>(ORDER);

    public BestFirstFrontier(int maxDepth) {
        super(maxDepth);
    }

    @Override
    protected void enqueue(CrawlTarget target, double priority) {
        queue.add(new Scored(target, priority));
    }

    @Override
    public CrawlTarget pop() {
        Scored next = queue.poll();
        return next == null ? null : next.target();
    }

    /**
     * @return score of the next candidate without removing it, or NaN when empty
     */
    public double peekPriority() {
        Scored next = queue.peek();
        return next == null ? Double.NaN : next.priority();
    }

    @Override
    public int size() {
        return queue.size();
    }

    private record Scored(CrawlTarget target, double priority) {}
}
