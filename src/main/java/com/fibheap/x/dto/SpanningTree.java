package com.fibheap.x.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class SpanningTree {
    private final List<WeightedEdge> edges;
    private final double totalWeight;
    private final int componentCount;
}
