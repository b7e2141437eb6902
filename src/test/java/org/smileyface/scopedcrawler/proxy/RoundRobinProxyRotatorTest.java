package org.smileyface.scopedcrawler.proxy;

import org.junit.jupiter.api.Test;
import org.smileyface.scopedcrawler.config.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoundRobinProxyRotatorTest {

    private static final ProxyEntry P1 = new ProxyEntry("10.0.0.1", 8080, "u1", "p1");
    private static final ProxyEntry P2 = new ProxyEntry("10.0.0.2", 8080, "u2", "p2");
    private static final ProxyEntry P3 = new ProxyEntry("10.0.0.3", 8080, "u3", "p3");

    @Test
    void cyclesInListOrder() {
        RoundRobinProxyRotator rotator = new RoundRobinProxyRotator(List.of(P1, P2, P3));
        List<ProxyEntry> picked = new ArrayList<>();
        for (int i = 0; i < 7; i++) picked.add(rotator.next());
        assertThat(picked).containsExactly(P1, P2, P3, P1, P2, P3, P1);
        assertThat(rotator.size()).isEqualTo(3);
        assertThat(rotator.entries()).containsExactly(P1, P2, P3);
    }

    @Test
    void singleProxyIsAlwaysReturned() {
        RoundRobinProxyRotator rotator = new RoundRobinProxyRotator(List.of(P1));
        assertThat(rotator.next()).isEqualTo(P1);
        assertThat(rotator.next()).isEqualTo(P1);
    }

    @Test
    void emptyListIsConfigurationError() {
        assertThatThrownBy(() -> new RoundRobinProxyRotator(List.of()))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new RoundRobinProxyRotator(null))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void concurrentCallersShareTheCursorEvenly() throws Exception {
        RoundRobinProxyRotator rotator = new RoundRobinProxyRotator(List.of(P1, P2, P3));
        int threads = 8;
        int perThread = 300;
        Map<ProxyEntry, AtomicInteger> counts = new ConcurrentHashMap<>();
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        for (int t = 0; t < threads; t++) {
            pool.submit(() -> {
                go.await();
                for (int i = 0; i < perThread; i++) {
                    counts.computeIfAbsent(rotator.next(), k -> new AtomicInteger()).incrementAndGet();
                }
                return null;
            });
        }
        go.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        int expected = threads * perThread / 3;
        assertThat(counts).hasSize(3);
        assertThat(counts.values()).allSatisfy(c -> assertThat(c.get()).isEqualTo(expected));
    }

    @Test
    void proxyToStringMasksPassword() {
        assertThat(P1.toString()).contains("10.0.0.1:8080").contains("u1").doesNotContain("p1");
    }
}
