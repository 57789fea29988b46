// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.derived;

import com.google.common.graph.GraphBuilder;
import com.google.common.graph.MutableGraph;
import io.pfive.datasets.exception.CyclicDerivationException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Directed graph of "depends on" edges between derived datasets, keyed by fingerprint or by
/// member identifier. Every edge is checked as it is added, so the graph never contains a cycle
/// and the exception names the exact chain that would have closed one.
/// Not threadsafe, build it in one thread.
public class DependencyGraph {

    private final MutableGraph<String> graph = GraphBuilder.directed().allowsSelfLoops(true).build();

    public void addNode (String node) {
        graph.addNode(node);
    }

    /// Record that dependent is computed from dependency.
    /// @throws CyclicDerivationException if dependency already depends (transitively) on dependent
    public void addDependency (String dependent, String dependency) {
        List<String> path = findPath(dependency, dependent);
        if (path != null) {
            List<String> cycle = new ArrayList<>(path.size() + 1);
            cycle.add(dependent);
            cycle.addAll(path);
            throw new CyclicDerivationException(cycle);
        }
        graph.putEdge(dependent, dependency);
    }

    public Set<String> dependenciesOf (String node) {
        return graph.nodes().contains(node) ? graph.successors(node) : Set.of();
    }

    public Set<String> nodes () {
        return graph.nodes();
    }

    /// Breadth first search along dependency edges, returning the nodes from start to end inclusive.
    private List<String> findPath (String start, String end) {
        if (start.equals(end)) return List.of(start);
        if (!graph.nodes().contains(start) || !graph.nodes().contains(end)) return null;
        Map<String, String> reachedFrom = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        reachedFrom.put(start, start);
        while (!queue.isEmpty()) {
            String node = queue.poll();
            for (String next : graph.successors(node)) {
                if (reachedFrom.containsKey(next)) continue;
                reachedFrom.put(next, node);
                if (next.equals(end)) {
                    List<String> path = new ArrayList<>();
                    for (String n = end; !n.equals(start); n = reachedFrom.get(n)) path.add(n);
                    path.add(start);
                    Collections.reverse(path);
                    return path;
                }
                queue.add(next);
            }
        }
        return null;
    }

}
