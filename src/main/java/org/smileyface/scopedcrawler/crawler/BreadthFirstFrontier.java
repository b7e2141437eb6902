package org.smileyface.scopedcrawler.crawler;

import java.util.ArrayDeque;
import java.util.Queue;

/**
 * FIFO frontier. Children are only pushed after their parent was popped, so with a single
 * worker every depth-d page is dispatched before any depth-(d+1) page.
 */
public class BreadthFirstFrontier extends AbstractFrontier {

    private final Queue<CrawlTarget> queue = new ArrayDeque<>();

    public BreadthFirstFrontier(int maxDepth) {
        super(maxDepth);
    }

    @Override
    protected void enqueue(CrawlTarget target, double priority) {
        queue.add(target);
    }

    @Override
    public CrawlTarget pop() {
        return queue.poll();
    }

    @Override
    public int size() {
        return queue.size();
    }
}
