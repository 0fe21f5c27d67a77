package com.fibheap.x.dto;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@Data
@Builder
public class CostEdge {
    private String from;
    private String to;
    private int capacity;
    private int flow;
    private double cost;
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private CostEdge reverse;

    public int residualCapacity() {
        return capacity - flow;
    }
}
