package com.fibheap.x.dto;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adjacency-list graph keyed by vertex id. Undirected graphs store every edge in both directions.
 */
public class WeightedGraph {
    @Getter
    private final boolean directed;
    private final Map<String, List<WeightedEdge>> adjacencyList = new LinkedHashMap<>();
    private final List<WeightedEdge> edges = new ArrayList<>();

    private WeightedGraph(boolean directed) {
        this.directed = directed;
    }

    public static WeightedGraph directed() {
        return new WeightedGraph(true);
    }

    public static WeightedGraph undirected() {
        return new WeightedGraph(false);
    }

    public WeightedGraph addVertex(String id) {
        if (StringUtils.isBlank(id)) {
            throw new IllegalArgumentException("Vertex id cannot be blank");
        }
        adjacencyList.computeIfAbsent(id, k -> new ArrayList<>());
        return this;
    }

    public WeightedGraph addEdge(String from, String to, double weight) {
        if (!Double.isFinite(weight)) {
            throw new IllegalArgumentException("Edge weight must be finite, got " + weight + " for " + from + "->" + to);
        }
        addVertex(from);
        addVertex(to);

        WeightedEdge edge = new WeightedEdge(from, to, weight);
        edges.add(edge);
        adjacencyList.get(from).add(edge);
        if (!directed) {
            adjacencyList.get(to).add(new WeightedEdge(to, from, weight));
        }
        return this;
    }

    public boolean containsVertex(String id) {
        return adjacencyList.containsKey(id);
    }

    public Set<String> getVertices() {
        return Collections.unmodifiableSet(adjacencyList.keySet());
    }

    public List<WeightedEdge> getNeighbors(String id) {
        return Collections.unmodifiableList(adjacencyList.getOrDefault(id, Collections.emptyList()));
    }

    /**
     * Edges as they were added, one entry per undirected edge.
     */
    public List<WeightedEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }
}
