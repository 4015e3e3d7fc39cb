package graph;

import java.util.ArrayList;

import history.Schedule;

public class PrecedenceGraphBuilder {
    private PrecedenceGraphBuilder() {
    }

    /**
     * Builds the precedence graph of a schedule.
     *
     * <p>
     * Operations of aborted transactions are dropped before conflicts are computed, and an aborted
     * transaction gets no node. Commits and aborts never conflict.
     */
    public static PrecedenceGraph build(Schedule schedule) {
        var aborted = schedule.getAbortedTransactions();
        var graph = new PrecedenceGraph();

        // positions of the valid sub-schedule within the original one
        var valid = new ArrayList<Integer>();
        for (int i = 0; i < schedule.size(); i++) {
            var op = schedule.get(i);
            if (aborted.contains(op.getTransactionId())) {
                continue;
            }
            graph.addTransaction(op.getTransactionId());
            if (!op.getKind().isTermination()) {
                valid.add(i);
            }
        }

        for (int i = 0; i < valid.size(); i++) {
            var earlier = schedule.get(valid.get(i));
            for (int j = i + 1; j < valid.size(); j++) {
                var later = schedule.get(valid.get(j));
                if (!earlier.conflictsWith(later)) {
                    continue;
                }

                graph.addConflict(earlier.getTransactionId(), later.getTransactionId(),
                        new Conflict(EdgeType.of(earlier, later), earlier.getDataItem(), valid.get(i), valid.get(j)));
            }
        }

        return graph;
    }
}
