package com.fibheap.x.metrics;

import com.fibheap.x.config.HeapMetricsConfig;
import com.fibheap.x.models.FibonacciHeap;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Publishes the bookkeeping of one heap to a {@link MeterRegistry}.
 * <p>
 * Gauges read the heap lazily, so registering is free until the registry is scraped. Reading
 * happens on the scraping thread; bind only heaps that are confined to that thread or guarded
 * by the caller.
 * </p>
 */
@Slf4j
public class FibonacciHeapMetrics implements MeterBinder {
    private final FibonacciHeap<?> heap;
    private final HeapMetricsConfig config;

    public FibonacciHeapMetrics(FibonacciHeap<?> heap, HeapMetricsConfig config) {
        this.heap = Objects.requireNonNull(heap, "Heap cannot be null");
        this.config = Objects.requireNonNull(config, "Metrics config cannot be null");
    }

    public FibonacciHeapMetrics(FibonacciHeap<?> heap) {
        this(heap, HeapMetricsConfig.builder().build());
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder(config.name("size"), heap, h -> h.isConsumed() ? 0 : h.size())
                .description("Nodes currently stored in the heap")
                .tags(config.getTags())
                .register(registry);
        Gauge.builder(config.name("trees"), heap, h -> h.isConsumed() ? 0 : h.treeCount())
                .description("Trees in the root list")
                .tags(config.getTags())
                .register(registry);
        Gauge.builder(config.name("marked_nodes"), heap, FibonacciHeap::markedCount)
                .description("Nodes that lost a child since they were linked")
                .tags(config.getTags())
                .register(registry);
        FunctionCounter.builder(config.name("links_total"), heap, FibonacciHeap::linkCount)
                .description("Links performed while consolidating")
                .tags(config.getTags())
                .register(registry);
        FunctionCounter.builder(config.name("cuts_total"), heap, FibonacciHeap::cutCount)
                .description("Cuts performed by decrease-key and delete")
                .tags(config.getTags())
                .register(registry);
        log.debug("Bound heap metrics under prefix {}", config.getPrefix());
    }
}
