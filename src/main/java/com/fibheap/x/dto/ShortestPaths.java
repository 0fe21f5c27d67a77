package com.fibheap.x.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

@Getter
@AllArgsConstructor
public class ShortestPaths {
    private final String source;
    private final Map<String, Double> distances;
    private final Map<String, String> predecessors;

    public boolean isReachable(String target) {
        return distances.containsKey(target);
    }

    public double distanceTo(String target) {
        return distances.getOrDefault(target, Double.POSITIVE_INFINITY);
    }

    /**
     * Vertices from the source to {@code target}, both included, or an empty list if unreachable.
     */
    public List<String> pathTo(String target) {
        if (!isReachable(target)) return List.of();
        List<String> path = new ArrayList<>();
        for (String v = target; v != null; v = predecessors.get(v)) {
            path.add(v);
        }
        Collections.reverse(path);
        return path;
    }
}
