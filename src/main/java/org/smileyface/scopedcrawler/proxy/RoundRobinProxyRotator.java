package org.smileyface.scopedcrawler.proxy;

import org.smileyface.scopedcrawler.config.ConfigurationException;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cycles through an immutable proxy list. The cursor is advanced with a single atomic
 * increment-and-wrap, so concurrent callers never skip or repeat a slot.
 */
public final class RoundRobinProxyRotator implements ProxyRotator {

    private final List<ProxyEntry> entries;
    private final AtomicInteger cursor = new AtomicInteger(0);

    /**
     * @throws ConfigurationException if {@code entries} is null or empty
     */
    public RoundRobinProxyRotator(List<ProxyEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new ConfigurationException("Proxy list is empty; at least one proxy is required");
        }
        this.entries = List.copyOf(entries);
    }

    @Override
    public ProxyEntry next() {
        int size = entries.size();
        int i = cursor.getAndUpdate(c -> (c + 1) % size);
        return entries.get(i);
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public List<ProxyEntry> entries() {
        return entries;
    }
}
