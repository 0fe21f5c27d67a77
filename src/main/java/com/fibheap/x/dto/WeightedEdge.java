package com.fibheap.x.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public class WeightedEdge {
    private String from;
    private String to;
    private double weight;
}
