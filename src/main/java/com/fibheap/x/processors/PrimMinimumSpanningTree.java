package com.fibheap.x.processors;

import com.fibheap.x.dto.SpanningTree;
import com.fibheap.x.dto.WeightedEdge;
import com.fibheap.x.dto.WeightedGraph;
import com.fibheap.x.models.FibNode;
import com.fibheap.x.models.FibonacciHeap;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Minimum spanning forest of an undirected graph, grown one component at a time.
 */
@Slf4j
public class PrimMinimumSpanningTree {
    private final WeightedGraph graph;

    public PrimMinimumSpanningTree(WeightedGraph graph) {
        this.graph = Objects.requireNonNull(graph, "Graph cannot be null");
        if (graph.isDirected()) {
            throw new IllegalArgumentException("Spanning trees need an undirected graph");
        }
    }

    public SpanningTree compute() {
        Map<String, Double> attachCost = new HashMap<>();
        Map<String, WeightedEdge> bestEdge = new HashMap<>();
        Map<String, FibNode<String>> nodeMap = new HashMap<>();
        Set<String> inTree = new HashSet<>();
        FibonacciHeap<String> fibHeap = new FibonacciHeap<>(Comparator.comparingDouble(attachCost::get));

        List<WeightedEdge> treeEdges = new ArrayList<>();
        double totalWeight = 0;
        int components = 0;

        for (String start : graph.getVertices()) {
            if (inTree.contains(start)) continue;
            components++;
            attachCost.put(start, 0.0);
            nodeMap.put(start, fibHeap.insert(start));

            while (!fibHeap.isEmpty()) {
                String current = fibHeap.extractMin().getValue();
                nodeMap.remove(current);
                inTree.add(current);

                WeightedEdge via = bestEdge.get(current);
                if (via != null) {
                    treeEdges.add(via);
                    totalWeight += via.getWeight();
                }

                for (WeightedEdge edge : graph.getNeighbors(current)) {
                    String to = edge.getTo();
                    if (inTree.contains(to)) continue;

                    FibNode<String> targetNode = nodeMap.get(to);
                    if (targetNode == null) {
                        attachCost.put(to, edge.getWeight());
                        bestEdge.put(to, edge);
                        nodeMap.put(to, fibHeap.insert(to));
                    } else if (edge.getWeight() < attachCost.get(to)) {
                        attachCost.put(to, edge.getWeight());
                        bestEdge.put(to, edge);
                        fibHeap.decreaseKey(targetNode);
                    }
                }
            }
        }

        log.debug("Spanning forest: {} edges, {} components, weight={}", treeEdges.size(), components, totalWeight);
        return new SpanningTree(treeEdges, totalWeight, components);
    }
}
