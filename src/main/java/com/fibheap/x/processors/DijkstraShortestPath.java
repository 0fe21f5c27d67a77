package com.fibheap.x.processors;

import com.fibheap.x.dto.ShortestPaths;
import com.fibheap.x.dto.WeightedEdge;
import com.fibheap.x.dto.WeightedGraph;
import com.fibheap.x.models.FibNode;
import com.fibheap.x.models.FibonacciHeap;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Single-source shortest paths over non-negative edge weights.
 * <p>
 * Tentative distances live in a map that the heap's comparator reads, so relaxing an edge lowers the
 * map entry first and then calls {@link FibonacciHeap#decreaseKey(FibNode)}. Vertices enter the heap
 * when first discovered.
 * </p>
 */
@Slf4j
public class DijkstraShortestPath {
    private final WeightedGraph graph;

    public DijkstraShortestPath(WeightedGraph graph) {
        this.graph = Objects.requireNonNull(graph, "Graph cannot be null");
        for (WeightedEdge edge : graph.getEdges()) {
            if (edge.getWeight() < 0) {
                throw new IllegalArgumentException("Negative edge weight " + edge.getWeight() + " on " + edge.getFrom() + "->" + edge.getTo());
            }
        }
    }

    public ShortestPaths compute(String source) {
        if (!graph.containsVertex(source)) {
            throw new IllegalArgumentException("Unknown source vertex '" + source + "'");
        }

        Map<String, Double> distance = new HashMap<>();
        Map<String, String> predecessor = new HashMap<>();
        Map<String, FibNode<String>> nodeMap = new HashMap<>();
        Map<String, Double> settled = new LinkedHashMap<>();
        FibonacciHeap<String> fibHeap = new FibonacciHeap<>(Comparator.comparingDouble(distance::get));

        distance.put(source, 0.0);
        nodeMap.put(source, fibHeap.insert(source));

        while (!fibHeap.isEmpty()) {
            String current = fibHeap.extractMin().getValue();
            nodeMap.remove(current);
            double currentDist = distance.get(current);
            settled.put(current, currentDist);

            for (WeightedEdge edge : graph.getNeighbors(current)) {
                String to = edge.getTo();
                if (settled.containsKey(to)) continue;

                double newDist = currentDist + edge.getWeight();
                FibNode<String> targetNode = nodeMap.get(to);
                if (targetNode == null) {
                    distance.put(to, newDist);
                    predecessor.put(to, current);
                    nodeMap.put(to, fibHeap.insert(to));
                } else if (newDist < distance.get(to)) {
                    distance.put(to, newDist);
                    predecessor.put(to, current);
                    fibHeap.decreaseKey(targetNode);
                }
            }
        }

        log.debug("Shortest paths from {}: settled {} of {} vertices, links={}, cuts={}",
                source, settled.size(), graph.getVertices().size(), fibHeap.linkCount(), fibHeap.cutCount());
        return new ShortestPaths(source, settled, predecessor);
    }
}
