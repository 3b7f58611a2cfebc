/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.cppcontext;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import javax.annotation.Nonnull;

/**
 * A directed graph from each defined symbol to the symbols its
 * enclosing conditions reference.
 *
 * Nodes and edges are kept sorted so that traversal, and therefore
 * cycle reporting, is deterministic. Self-edges are never stored: an
 * include guard of the form <code>#ifndef X / #define X</code> is not
 * a cycle.
 *
 * A graph is read-only once built; only this package adds to it.
 */
public final class DependencyGraph {

    private final Map<String, SortedSet<String>> edges = new TreeMap<String, SortedSet<String>>();

    /* pp */ DependencyGraph() {
    }

    /**
     * Builds the graph of the given definitions.
     */
    @Nonnull
    public static DependencyGraph build(@Nonnull Iterable<? extends DefineRecord> defines) {
        DependencyGraph graph = new DependencyGraph();
        for (DefineRecord define : defines) {
            graph.addNode(define.getSymbol());
            for (String dependency : define.getDependencies())
                graph.addEdge(define.getSymbol(), dependency);
        }
        return graph;
    }

    /* pp */ void addNode(@Nonnull String symbol) {
        if (!edges.containsKey(symbol))
            edges.put(symbol, new TreeSet<String>());
    }

    /* pp */ void addEdge(@Nonnull String from, @Nonnull String to) {
        addNode(from);
        if (from.equals(to))
            return;
        addNode(to);
        edges.get(from).add(to);
    }

    /** Returns all symbols, sorted. */
    @Nonnull
    public Set<String> getNodes() {
        return Collections.unmodifiableSet(edges.keySet());
    }

    /** Returns the symbols <code>symbol</code> depends on, sorted. */
    @Nonnull
    public Set<String> getDependencies(@Nonnull String symbol) {
        SortedSet<String> out = edges.get(symbol);
        if (out == null)
            return Collections.emptySet();
        return Collections.unmodifiableSet(out);
    }

    public int getEdgeCount() {
        int count = 0;
        for (SortedSet<String> targets : edges.values())
            count += targets.size();
        return count;
    }

    /**
     * Finds the cycles closed by back-edges of a depth-first search.
     *
     * The search visits each node once, in sorted order, so this is not
     * an enumeration of every elementary cycle: with edges
     * <code>A -&gt; B, A -&gt; C, B -&gt; C, C -&gt; A</code> only
     * <code>[A, B, C]</code> is found, not <code>[A, C]</code>. A graph
     * has a cycle if and only if at least one is reported.
     *
     * Each cycle is listed once, rotated to start at its smallest
     * symbol, without repeating the first symbol at the end.
     */
    @Nonnull
    public List<List<String>> findCycles() {
        Set<List<String>> cycles = new LinkedHashSet<List<String>>();
        Set<String> visited = new HashSet<String>();
        for (String node : edges.keySet())
            if (!visited.contains(node))
                visit(node, visited, new ArrayList<String>(), new HashSet<String>(), cycles);
        return new ArrayList<List<String>>(cycles);
    }

    private void visit(String node, Set<String> visited, List<String> path,
            Set<String> onPath, Set<List<String>> cycles) {
        visited.add(node);
        path.add(node);
        onPath.add(node);
        for (String next : edges.get(node)) {
            if (onPath.contains(next)) {
                List<String> cycle = path.subList(path.indexOf(next), path.size());
                cycles.add(normalize(cycle));
            } else if (!visited.contains(next)) {
                visit(next, visited, path, onPath, cycles);
            }
        }
        onPath.remove(node);
        path.remove(path.size() - 1);
    }

    private static List<String> normalize(List<String> cycle) {
        int start = 0;
        for (int i = 1; i < cycle.size(); i++)
            if (cycle.get(i).compareTo(cycle.get(start)) < 0)
                start = i;
        List<String> out = new ArrayList<String>(cycle.size());
        for (int i = 0; i < cycle.size(); i++)
            out.add(cycle.get((start + i) % cycle.size()));
        return Collections.unmodifiableList(out);
    }

    public boolean hasCycles() {
        return !findCycles().isEmpty();
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject out = new JsonObject();
        for (Map.Entry<String, SortedSet<String>> e : edges.entrySet()) {
            JsonArray targets = new JsonArray();
            for (String target : e.getValue())
                targets.add(target);
            out.add(e.getKey(), targets);
        }
        return out;
    }

    @Override
    public String toString() {
        return "DependencyGraph" + edges;
    }
}
