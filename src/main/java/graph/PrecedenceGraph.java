package graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.google.common.graph.ElementOrder;
import com.google.common.graph.MutableValueGraph;
import com.google.common.graph.ValueGraphBuilder;

/**
 * Directed graph over transaction ids. An edge {@code a -> b} means a conflicting operation of
 * {@code a} precedes one of {@code b}, so {@code a} has to run before {@code b} in any equivalent
 * serial execution. Each edge keeps the conflicts it was derived from.
 *
 * <p>
 * Nodes and successors iterate in insertion order.
 */
public class PrecedenceGraph {
    private final MutableValueGraph<String, List<Conflict>> graph = ValueGraphBuilder.directed()
            .allowsSelfLoops(false)
            .nodeOrder(ElementOrder.<String>insertion())
            .incidentEdgeOrder(ElementOrder.<String>stable())
            .build();

    void addTransaction(String transactionId) {
        graph.addNode(transactionId);
    }

    void addConflict(String from, String to, Conflict conflict) {
        var conflicts = graph.edgeValueOrDefault(from, to, null);
        if (conflicts == null) {
            conflicts = new ArrayList<>();
            graph.putEdgeValue(from, to, conflicts);
        }
        conflicts.add(conflict);
    }

    public Set<String> nodes() {
        return Collections.unmodifiableSet(graph.nodes());
    }

    public Set<String> successors(String transactionId) {
        return Collections.unmodifiableSet(graph.successors(transactionId));
    }

    public boolean hasEdge(String from, String to) {
        return graph.hasEdgeConnecting(from, to);
    }

    public int edgeCount() {
        return graph.edges().size();
    }

    public List<Conflict> conflicts(String from, String to) {
        return graph.edgeValue(from, to).map(Collections::unmodifiableList).orElse(List.of());
    }

    /**
     * Each transaction mapped to its successors, both in insertion order.
     */
    public Map<String, List<String>> toAdjacencyMap() {
        var result = new LinkedHashMap<String, List<String>>();
        for (var node : graph.nodes()) {
            result.put(node, List.copyOf(graph.successors(node)));
        }
        return Collections.unmodifiableMap(result);
    }

    public String toDot() {
        var sb = new StringBuilder("digraph {\n");
        for (var node : graph.nodes()) {
            sb.append(String.format("  \"%s\";\n", node));
        }
        for (var node : graph.nodes()) {
            for (var succ : graph.successors(node)) {
                var label = conflicts(node, succ).stream().map(Conflict::toString).distinct()
                        .collect(Collectors.joining(","));
                sb.append(String.format("  \"%s\" -> \"%s\" [label=\"%s\"];\n", node, succ, label));
            }
        }
        sb.append("}\n");
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PrecedenceGraph)) {
            return false;
        }
        return graph.equals(((PrecedenceGraph) o).graph);
    }

    @Override
    public int hashCode() {
        return graph.hashCode();
    }

    @Override
    public String toString() {
        return toAdjacencyMap().toString();
    }
}
