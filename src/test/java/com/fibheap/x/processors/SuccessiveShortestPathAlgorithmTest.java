package com.fibheap.x.processors;

import com.fibheap.x.dto.MatchResult;
import com.fibheap.x.dto.WeightedEdge;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class SuccessiveShortestPathAlgorithmTest {

    @Test
    void findsCheapestPerfectAssignment() {
        List<WeightedEdge> edges = List.of(
                new WeightedEdge("w1", "j1", 4), new WeightedEdge("w1", "j2", 1), new WeightedEdge("w1", "j3", 3),
                new WeightedEdge("w2", "j1", 2), new WeightedEdge("w2", "j2", 0), new WeightedEdge("w2", "j3", 5),
                new WeightedEdge("w3", "j1", 3), new WeightedEdge("w3", "j2", 2), new WeightedEdge("w3", "j3", 2));

        MatchResult result = new SuccessiveShortestPathAlgorithm(
                Set.of("w1", "w2", "w3"), Set.of("j1", "j2", "j3"), edges).computeMinCostMatching();

        assertThat(result.getTotalCost()).isEqualTo(5.0);
        assertThat(result.getAssignment()).containsOnly(entry("w1", "j2"), entry("w2", "j1"), entry("w3", "j3"));
    }

    @Test
    void prefersLargerMatchingOverCheaperOne() {
        List<WeightedEdge> edges = List.of(
                new WeightedEdge("a", "x", 1),
                new WeightedEdge("a", "y", 10),
                new WeightedEdge("b", "x", 1));

        MatchResult result = new SuccessiveShortestPathAlgorithm(
                List.of("a", "b"), List.of("x", "y"), edges).computeMinCostMatching();

        assertThat(result.size()).isEqualTo(2);
        assertThat(result.getTotalCost()).isEqualTo(11.0);
        assertThat(result.getAssignment()).containsOnly(entry("a", "y"), entry("b", "x"));
    }

    @Test
    void leavesUnmatchableNodesOut() {
        List<WeightedEdge> edges = List.of(
                new WeightedEdge("a", "x", 5),
                new WeightedEdge("b", "x", 3));

        MatchResult result = new SuccessiveShortestPathAlgorithm(
                List.of("a", "b", "c"), List.of("x"), edges).computeMinCostMatching();

        assertThat(result.getAssignment()).containsOnly(entry("b", "x"));
        assertThat(result.getTotalCost()).isEqualTo(3.0);
    }

    @Test
    void rejectsUnknownEndpointsAndNegativeCosts() {
        assertThatThrownBy(() -> new SuccessiveShortestPathAlgorithm(
                List.of("a"), List.of("x"), List.of(new WeightedEdge("b", "x", 1))).computeMinCostMatching())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SuccessiveShortestPathAlgorithm(
                List.of("a"), List.of("x"), List.of(new WeightedEdge("a", "x", -2))).computeMinCostMatching())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
