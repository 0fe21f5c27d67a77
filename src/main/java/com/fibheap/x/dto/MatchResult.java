package com.fibheap.x.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

@Getter
@AllArgsConstructor
public class MatchResult {
    private final Map<String, String> assignment;
    private final double totalCost;

    public int size() {
        return assignment.size();
    }
}
