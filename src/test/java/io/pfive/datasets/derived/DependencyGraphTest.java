// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.derived;

import io.pfive.datasets.exception.CyclicDerivationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DependencyGraphTest {

    @Test
    void acyclicGraphsAreAccepted () {
        DependencyGraph graph = new DependencyGraph();
        graph.addDependency("sum", "a");
        graph.addDependency("sum", "b");
        graph.addDependency("mean", "sum");
        graph.addDependency("mean", "a");
        assertEquals(Set.of("a", "b"), graph.dependenciesOf("sum"));
        assertEquals(Set.of(), graph.dependenciesOf("unknown"));
        assertEquals(4, graph.nodes().size());
    }

    @Test
    void cyclesAreReportedWithTheirPath () {
        DependencyGraph graph = new DependencyGraph();
        graph.addDependency("a", "b");
        graph.addDependency("b", "c");
        CyclicDerivationException e = assertThrows(CyclicDerivationException.class, () -> graph.addDependency("c", "a"));
        assertEquals(List.of("c", "a", "b", "c"), e.cycle());
        assertTrue(e.isPermanent());
        // The rejected edge was not added.
        assertEquals(Set.of(), graph.dependenciesOf("c"));
    }

    @Test
    void selfDependencyIsACycle () {
        DependencyGraph graph = new DependencyGraph();
        CyclicDerivationException e = assertThrows(CyclicDerivationException.class, () -> graph.addDependency("x", "x"));
        assertEquals(List.of("x", "x"), e.cycle());
    }
}
