package com.fibheap.x.metrics;

import com.fibheap.x.config.HeapMetricsConfig;
import com.fibheap.x.models.FibNode;
import com.fibheap.x.models.FibonacciHeap;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FibonacciHeapMetricsTest {

    @Test
    void publishesHeapBookkeeping() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        FibonacciHeap<Integer> heap = FibonacciHeap.naturalOrder();
        new FibonacciHeapMetrics(heap).bindTo(registry);

        List<FibNode<Integer>> nodes = new ArrayList<>();
        for (int i = 1; i <= 9; i++) {
            nodes.add(heap.insert(i));
        }
        heap.extractMin();
        heap.decreaseKey(nodes.get(8), 0);

        assertThat(registry.get("fibheap_size").gauge().value()).isEqualTo(8.0);
        assertThat(registry.get("fibheap_trees").gauge().value()).isEqualTo(2.0);
        assertThat(registry.get("fibheap_marked_nodes").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get("fibheap_links_total").functionCounter().count()).isEqualTo(7.0);
        assertThat(registry.get("fibheap_cuts_total").functionCounter().count()).isEqualTo(1.0);
    }

    @Test
    void usesConfiguredPrefixAndTags() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        FibonacciHeap<Integer> heap = FibonacciHeap.naturalOrder();
        HeapMetricsConfig config = HeapMetricsConfig.builder()
                .prefix("router_queue")
                .tag(Tag.of("graph", "roads"))
                .build();
        new FibonacciHeapMetrics(heap, config).bindTo(registry);
        heap.insert(3);

        assertThat(registry.get("router_queue_size").tag("graph", "roads").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void consumedHeapReportsZeroSize() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        FibonacciHeap<Integer> target = FibonacciHeap.naturalOrder();
        FibonacciHeap<Integer> absorbed = FibonacciHeap.naturalOrder();
        new FibonacciHeapMetrics(absorbed).bindTo(registry);
        target.insert(1);
        absorbed.insert(2);

        target.union(absorbed);

        assertThat(registry.get("fibheap_size").gauge().value()).isZero();
        assertThat(registry.get("fibheap_trees").gauge().value()).isZero();
    }
}
