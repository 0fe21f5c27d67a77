package com.fibheap.x.processors;

import com.fibheap.x.dto.CostEdge;
import com.fibheap.x.dto.MatchResult;
import com.fibheap.x.dto.WeightedEdge;
import com.fibheap.x.models.FibNode;
import com.fibheap.x.models.FibonacciHeap;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Minimum-cost maximum bipartite matching by successive shortest augmenting paths.
 * <p>
 * Each round runs Dijkstra on reduced costs {@code cost + p(u) - p(v)} over the residual graph,
 * which stay non-negative as long as the input costs are, then shifts the potentials by the
 * distances found and pushes one unit of flow from source to sink.
 * </p>
 */
@Slf4j
public class SuccessiveShortestPathAlgorithm {
    private static final String SOURCE = "S";
    private static final String SINK = "T";
    private static final String LEFT_PREFIX = "L:";
    private static final String RIGHT_PREFIX = "R:";

    private final Set<String> leftNodes;
    private final Set<String> rightNodes;
    private final List<WeightedEdge> initialEdges;

    public SuccessiveShortestPathAlgorithm(Collection<String> leftNodes, Collection<String> rightNodes, List<WeightedEdge> initialEdges) {
        this.leftNodes = new LinkedHashSet<>(Objects.requireNonNull(leftNodes, "Left nodes cannot be null"));
        this.rightNodes = new LinkedHashSet<>(Objects.requireNonNull(rightNodes, "Right nodes cannot be null"));
        this.initialEdges = Objects.requireNonNull(initialEdges, "Initial edges cannot be null");
    }

    public MatchResult computeMinCostMatching() {
        Map<String, List<CostEdge>> residualGraph = buildResidualGraph();
        Map<String, Double> potential = new HashMap<>();
        int maxRounds = Math.min(leftNodes.size(), rightNodes.size());
        double totalCost = 0;
        int rounds = 0;

        while (rounds < maxRounds) {
            Map<String, Double> distance = new HashMap<>();
            Map<String, CostEdge> parent = new HashMap<>();
            findAugmentingPath(residualGraph, potential, distance, parent);
            if (!distance.containsKey(SINK)) {
                break;
            }

            totalCost += updateFlow(parent);
            updatePotentials(distance, potential);
            rounds++;
            log.debug("Augmentation {} done, running cost={}", rounds, totalCost);
        }

        Map<String, String> assignment = new LinkedHashMap<>();
        for (String left : leftNodes) {
            for (CostEdge edge : residualGraph.getOrDefault(LEFT_PREFIX + left, List.of())) {
                if (edge.getTo().startsWith(RIGHT_PREFIX) && edge.getCapacity() > 0 && edge.getFlow() == 1) {
                    assignment.put(left, edge.getTo().substring(RIGHT_PREFIX.length()));
                }
            }
        }

        log.info("Min-cost matching paired {} of {} left nodes, totalCost={}", assignment.size(), leftNodes.size(), totalCost);
        return new MatchResult(assignment, totalCost);
    }

    private Map<String, List<CostEdge>> buildResidualGraph() {
        Map<String, List<CostEdge>> residualGraph = new HashMap<>();

        for (String left : leftNodes) {
            addEdge(residualGraph, SOURCE, LEFT_PREFIX + left, 0);
        }
        for (String right : rightNodes) {
            addEdge(residualGraph, RIGHT_PREFIX + right, SINK, 0);
        }
        for (WeightedEdge edge : initialEdges) {
            if (!leftNodes.contains(edge.getFrom())) {
                throw new IllegalArgumentException("Left node '" + edge.getFrom() + "' is not in the left set.");
            }
            if (!rightNodes.contains(edge.getTo())) {
                throw new IllegalArgumentException("Right node '" + edge.getTo() + "' is not in the right set.");
            }
            if (!(edge.getWeight() >= 0) || Double.isInfinite(edge.getWeight())) {
                throw new IllegalArgumentException("Edge cost must be finite and non-negative, got " + edge.getWeight());
            }
            addEdge(residualGraph, LEFT_PREFIX + edge.getFrom(), RIGHT_PREFIX + edge.getTo(), edge.getWeight());
        }
        return residualGraph;
    }

    private void addEdge(Map<String, List<CostEdge>> residualGraph, String from, String to, double cost) {
        CostEdge fwd = CostEdge.builder().from(from).to(to).cost(cost).capacity(1).flow(0).build();
        CostEdge rev = CostEdge.builder().from(to).to(from).cost(-cost).capacity(0).flow(0).build();
        fwd.setReverse(rev);
        rev.setReverse(fwd);

        residualGraph.computeIfAbsent(from, k -> new ArrayList<>()).add(fwd);
        residualGraph.computeIfAbsent(to, k -> new ArrayList<>()).add(rev);
    }

    private void findAugmentingPath(Map<String, List<CostEdge>> residualGraph, Map<String, Double> potential,
                                    Map<String, Double> distance, Map<String, CostEdge> parent) {
        Map<String, Double> tentative = new HashMap<>();
        Map<String, FibNode<String>> nodeMap = new HashMap<>();
        FibonacciHeap<String> fibHeap = new FibonacciHeap<>(Comparator.comparingDouble(tentative::get));

        tentative.put(SOURCE, 0.0);
        nodeMap.put(SOURCE, fibHeap.insert(SOURCE));

        while (!fibHeap.isEmpty()) {
            String current = fibHeap.extractMin().getValue();
            nodeMap.remove(current);
            double currentDist = tentative.get(current);
            distance.put(current, currentDist);

            for (CostEdge edge : residualGraph.getOrDefault(current, List.of())) {
                String to = edge.getTo();
                if (edge.residualCapacity() <= 0 || distance.containsKey(to)) continue;

                double reducedCost = edge.getCost()
                        + potential.getOrDefault(current, 0.0)
                        - potential.getOrDefault(to, 0.0);
                double newDist = currentDist + Math.max(0.0, reducedCost);

                FibNode<String> targetNode = nodeMap.get(to);
                if (targetNode == null) {
                    tentative.put(to, newDist);
                    parent.put(to, edge);
                    nodeMap.put(to, fibHeap.insert(to));
                } else if (newDist < tentative.get(to)) {
                    tentative.put(to, newDist);
                    parent.put(to, edge);
                    fibHeap.decreaseKey(targetNode);
                }
            }
        }
    }

    private double updateFlow(Map<String, CostEdge> parent) {
        double pathCost = 0;
        String current = SINK;
        while (!current.equals(SOURCE)) {
            CostEdge edge = parent.get(current);
            edge.setFlow(edge.getFlow() + 1);
            edge.getReverse().setFlow(edge.getReverse().getFlow() - 1);
            pathCost += edge.getCost();
            current = edge.getFrom();
        }
        return pathCost;
    }

    private void updatePotentials(Map<String, Double> dist, Map<String, Double> potential) {
        for (Map.Entry<String, Double> entry : dist.entrySet()) {
            potential.merge(entry.getKey(), entry.getValue(), Double::sum);
        }
    }
}
