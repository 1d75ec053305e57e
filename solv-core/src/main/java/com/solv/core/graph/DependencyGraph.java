package com.solv.core.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Directed "depends on" graph over project ids.
 *
 * <p>Ids are mapped to dense indices and edges are kept as adjacency lists of indices.
 * Ids are compared case-insensitively; the spelling first added is kept for display.
 * An edge {@code a -> b} means project {@code a} depends on project {@code b}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DependencyGraph graph = DependencyGraph.builder()
 *     .addNode("{A}")
 *     .addEdge("{A}", "{B}")
 *     .build();
 *
 * boolean cyclic = graph.hasCycle();
 * }</pre>
 */
public final class DependencyGraph {

    private static final DependencyGraph EMPTY = builder().build();

    private final Map<String, Integer> indices;
    private final List<String> ids;
    private final List<List<Integer>> dependencies;

    private DependencyGraph(Map<String, Integer> indices, List<String> ids, List<List<Integer>> dependencies) {
        this.indices = Map.copyOf(indices);
        this.ids = List.copyOf(ids);
        List<List<Integer>> copy = new ArrayList<>(dependencies.size());
        for (List<Integer> targets : dependencies) {
            copy.add(List.copyOf(targets));
        }
        this.dependencies = Collections.unmodifiableList(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static DependencyGraph empty() {
        return EMPTY;
    }

    public int nodeCount() {
        return ids.size();
    }

    public int edgeCount() {
        return dependencies.stream().mapToInt(List::size).sum();
    }

    public boolean containsNode(String id) {
        return indices.containsKey(key(id));
    }

    /**
     * Returns the node ids in insertion order.
     */
    public List<String> nodes() {
        return ids;
    }

    /**
     * Returns the ids a project depends on, or an empty list for unknown ids.
     *
     * @param id project id
     * @return direct dependencies in insertion order
     */
    public List<String> dependenciesOf(String id) {
        Integer index = indices.get(key(id));
        if (index == null) {
            return List.of();
        }
        return dependencies.get(index).stream().map(ids::get).toList();
    }

    /**
     * Returns whether the graph contains a cycle, including a project depending on itself.
     */
    public boolean hasCycle() {
        return buildOrder().isEmpty();
    }

    /**
     * Sorts the graph topologically so that every project follows the projects it depends on.
     *
     * @return build order, or empty when the graph has a cycle
     */
    public Optional<List<String>> buildOrder() {
        int count = ids.size();
        int[] pending = new int[count];
        List<List<Integer>> dependents = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            dependents.add(new ArrayList<>());
        }
        for (int from = 0; from < count; from++) {
            for (int to : dependencies.get(from)) {
                pending[from]++;
                dependents.get(to).add(from);
            }
        }

        Deque<Integer> ready = new ArrayDeque<>();
        for (int i = 0; i < count; i++) {
            if (pending[i] == 0) {
                ready.add(i);
            }
        }

        List<String> order = new ArrayList<>(count);
        while (!ready.isEmpty()) {
            int node = ready.poll();
            order.add(ids.get(node));
            for (int dependent : dependents.get(node)) {
                if (--pending[dependent] == 0) {
                    ready.add(dependent);
                }
            }
        }
        return order.size() == count ? Optional.of(order) : Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DependencyGraph other)) {
            return false;
        }
        return ids.equals(other.ids) && dependencies.equals(other.dependencies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ids, dependencies);
    }

    @Override
    public String toString() {
        return "DependencyGraph[nodes=" + nodeCount() + ", edges=" + edgeCount() + "]";
    }

    private static String key(String id) {
        return id.toUpperCase(Locale.ROOT);
    }

    /**
     * Mutable builder; {@link #build()} produces an immutable graph.
     */
    public static final class Builder {

        private final Map<String, Integer> indices = new HashMap<>();
        private final List<String> ids = new ArrayList<>();
        private final List<List<Integer>> dependencies = new ArrayList<>();

        private Builder() {
        }

        /**
         * Adds a node unless a node with the same id already exists.
         */
        public Builder addNode(String id) {
            indexOf(id);
            return this;
        }

        /**
         * Adds the edge {@code from -> to}, creating missing nodes. Duplicate edges are ignored.
         */
        public Builder addEdge(String from, String to) {
            int source = indexOf(from);
            int target = indexOf(to);
            List<Integer> targets = dependencies.get(source);
            if (!targets.contains(target)) {
                targets.add(target);
            }
            return this;
        }

        public DependencyGraph build() {
            return new DependencyGraph(indices, ids, dependencies);
        }

        private int indexOf(String id) {
            return indices.computeIfAbsent(key(id), k -> {
                ids.add(id);
                dependencies.add(new ArrayList<>());
                return ids.size() - 1;
            });
        }
    }
}
