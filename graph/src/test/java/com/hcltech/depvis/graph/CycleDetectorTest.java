package com.hcltech.depvis.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.hcltech.depvis.graph.GraphFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class CycleDetectorTest {

    @Test
    void emptyGraphHasNoCycle() {
        assertFalse(CycleDetector.hasCycleAnywhere(DependencyGraph.empty()));
    }

    @Test
    void singleNodeWithoutSelfLoopHasNoCycle() {
        assertFalse(CycleDetector.hasCycleAnywhere(graph("A:")));
    }

    @Test
    void diamondIsNotACycle() {
        assertFalse(CycleDetector.hasCycleAnywhere(graph(DIAMOND)));
        assertFalse(CycleDetector.hasCycleFrom(graph(DIAMOND), "A"));
    }

    @Test
    void selfLoopIsACycle() {
        DependencyGraph g = graph("A: A");
        assertTrue(CycleDetector.hasCycleAnywhere(g));
        assertTrue(CycleDetector.hasCycleFrom(g, "A"));
        assertEquals(Optional.of(List.of("A", "A")), CycleDetector.findCycle(g));
    }

    @Test
    void triangleReportsClosedPath() {
        assertEquals(Optional.of(List.of("A", "B", "C", "A")), CycleDetector.findCycle(graph(TRIANGLE)));
    }

    @Test
    void cyclePathStartsAtTheRevisitedAncestor() {
        DependencyGraph g = graph("root: a", "a: b", "b: c", "c: a");
        assertEquals(Optional.of(List.of("a", "b", "c", "a")), CycleDetector.findCycle(g));
    }

    @Test
    void cycleInDisconnectedComponentIsFoundGloballyButNotFromOtherRoot() {
        DependencyGraph g = graph("A: B", "B:", "X: Y", "Y: X");
        assertTrue(CycleDetector.hasCycleAnywhere(g));
        assertFalse(CycleDetector.hasCycleFrom(g, "A"));
        assertTrue(CycleDetector.hasCycleFrom(g, "Y"));
    }

    @Test
    void exploredSubgraphIsNotMistakenForACycle() {
        // D is fully explored via B before C reaches it again
        DependencyGraph g = graph("A: B C", "B: D", "C: D", "D: E", "E:");
        assertFalse(CycleDetector.hasCycleAnywhere(g));
    }

    @Test
    void undeclaredStartHasNoCycle() {
        assertFalse(CycleDetector.hasCycleFrom(graph(TRIANGLE), "Z"));
    }

    @Test
    void longChainDoesNotOverflowTheStack() {
        DependencyGraph g = chain(200_000);
        assertFalse(CycleDetector.hasCycleAnywhere(g));
        assertFalse(CycleDetector.hasCycleFrom(g, "N0"));
    }

    @Test
    void longChainClosedIntoALoopIsDetected() {
        DependencyGraph.Builder b = DependencyGraph.builder();
        for (int i = 0; i < 100_000; i++) b.addEdge("N" + i, "N" + ((i + 1) % 100_000));
        DependencyGraph g = b.build();
        assertTrue(CycleDetector.hasCycleAnywhere(g));
        assertEquals(100_001, CycleDetector.findCycle(g).orElseThrow().size());
    }
}
