package org.smileyface.scopedcrawler.crawler;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Shared depth and deduplication handling. The visited set only ever grows; a URL is added
 * before it is inserted into the backing queue.
 */
abstract class AbstractFrontier implements Frontier {

    private final Set<String> visited = new HashSet<>();
    private final int maxDepth;

    protected AbstractFrontier(int maxDepth) {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        this.maxDepth = maxDepth;
    }

    @Override
    public final boolean push(CrawlTarget target, double priority) {
        Objects.requireNonNull(target, "target");
        if (target.depth() > maxDepth) return false;
        if (!visited.add(target.url())) return false;
        enqueue(target, priority);
        return true;
    }

    protected abstract void enqueue(CrawlTarget target, double priority);

    @Override
    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public boolean isVisited(String url) {
        return visited.contains(url);
    }

    @Override
    public int visitedCount() {
        return visited.size();
    }

    @Override
    public int getMaxDepth() {
        return maxDepth;
    }
}
