package com.fibheap.x.config;

import io.micrometer.core.instrument.Tag;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

@Getter
@Builder
public class HeapMetricsConfig {
    @Builder.Default
    private final String prefix = "fibheap";
    @Singular
    private final List<Tag> tags;

    public String name(String metric) {
        return prefix + "_" + metric;
    }
}
