package graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import org.apache.commons.lang3.tuple.Pair;

/**
 * Depth-first cycle search over a {@link PrecedenceGraph}.
 *
 * <p>
 * The search keeps an explicit stack of (node, remaining successors) instead of recursing, so deep
 * graphs cannot overflow the call stack. A node stays in {@code visited} once reached and is on
 * {@code onStack} while it is part of the current path; reaching a node that is on the path closes
 * a cycle. Every node is used as a root at most once, so a search costs O(V + E).
 */
public class CycleDetector {
    private CycleDetector() {
    }

    public static boolean hasCycle(PrecedenceGraph graph) {
        return findCycle(graph).isPresent();
    }

    /**
     * Returns one cycle as a path whose first and last element are the same node, or empty if the
     * graph is acyclic.
     */
    public static Optional<List<String>> findCycle(PrecedenceGraph graph) {
        return search(graph, node -> {
        });
    }

    /**
     * Returns an order of all nodes in which every edge points forward, or empty if the graph has a
     * cycle. Running the transactions serially in this order is equivalent to the schedule.
     */
    public static Optional<List<String>> topologicalOrder(PrecedenceGraph graph) {
        var finished = new ArrayList<String>();
        if (search(graph, finished::add).isPresent()) {
            return Optional.empty();
        }

        Collections.reverse(finished);
        return Optional.of(finished);
    }

    private static Optional<List<String>> search(PrecedenceGraph graph, Consumer<String> onFinish) {
        var visited = new HashSet<String>();
        var onStack = new HashSet<String>();
        var stack = new ArrayDeque<Pair<String, Iterator<String>>>();

        for (var root : graph.nodes()) {
            if (visited.contains(root)) {
                continue;
            }

            visited.add(root);
            onStack.add(root);
            stack.push(Pair.of(root, graph.successors(root).iterator()));

            while (!stack.isEmpty()) {
                var top = stack.peek();
                var successors = top.getRight();

                if (!successors.hasNext()) {
                    stack.pop();
                    onStack.remove(top.getLeft());
                    onFinish.accept(top.getLeft());
                    continue;
                }

                var next = successors.next();
                if (!visited.contains(next)) {
                    visited.add(next);
                    onStack.add(next);
                    stack.push(Pair.of(next, graph.successors(next).iterator()));
                } else if (onStack.contains(next)) {
                    return Optional.of(cyclePath(stack, next));
                }
            }
        }

        return Optional.empty();
    }

    private static List<String> cyclePath(ArrayDeque<Pair<String, Iterator<String>>> stack, String start) {
        var path = new ArrayList<String>();
        var it = stack.descendingIterator();
        var inCycle = false;
        while (it.hasNext()) {
            var node = it.next().getLeft();
            inCycle |= node.equals(start);
            if (inCycle) {
                path.add(node);
            }
        }
        path.add(start);
        return path;
    }
}
