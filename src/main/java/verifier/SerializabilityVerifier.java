package verifier;

import java.util.List;
import java.util.Optional;

import graph.CycleDetector;
import graph.PrecedenceGraphBuilder;
import history.Schedule;
import history.ScheduleLoader;
import lombok.Getter;
import lombok.Setter;
import util.Profiler;

/**
 * Decides conflict serializability of a schedule: a schedule is conflict-serializable iff its
 * precedence graph is acyclic.
 */
public class SerializabilityVerifier {
    @Getter
    @Setter
    private static boolean dotOutput = false;

    private final ScheduleLoader loader;

    public SerializabilityVerifier(ScheduleLoader loader) {
        this.loader = loader;
    }

    /**
     * Checks a schedule. Ending warnings are reported but never change the verdict.
     */
    public static VerificationResult check(Schedule schedule) {
        var warnings = List.copyOf(EndingValidator.validate(schedule));
        var graph = PrecedenceGraphBuilder.build(schedule);
        var cycle = CycleDetector.findCycle(graph);

        Optional<List<String>> serialOrder = cycle.isPresent() ? Optional.empty()
                : CycleDetector.topologicalOrder(graph);
        return new VerificationResult(cycle.isEmpty(), warnings, graph, cycle, serialOrder);
    }

    public static VerificationResult checkConflictSerializability(Schedule schedule) {
        return check(schedule);
    }

    public boolean audit() {
        var profiler = Profiler.getInstance();

        profiler.startTick("LOAD");
        Schedule schedule;
        try {
            schedule = loader.loadSchedule();
        } finally {
            profiler.endTick("LOAD");
        }
        System.err.printf("Operations: %d, transactions: %d\n", schedule.size(),
                schedule.getTransactionIds().size());

        profiler.startTick("ENDING_VALIDATION");
        var warnings = EndingValidator.validate(schedule);
        profiler.endTick("ENDING_VALIDATION");
        warnings.forEach(w -> System.err.printf("warning: %s\n", w));

        profiler.startTick("BUILD_GRAPH");
        var graph = PrecedenceGraphBuilder.build(schedule);
        profiler.endTick("BUILD_GRAPH");
        System.err.printf("Precedence graph: %d nodes, %d edges\n", graph.nodes().size(), graph.edgeCount());

        profiler.startTick("CYCLE_DETECTION");
        var cycle = CycleDetector.findCycle(graph);
        profiler.endTick("CYCLE_DETECTION");

        if (dotOutput) {
            System.out.print(graph.toDot());
        }

        if (cycle.isPresent()) {
            var path = cycle.get();
            System.err.printf("Cycle: %s\n", String.join(" -> ", path));
            for (int i = 0; i + 1 < path.size(); i++) {
                System.err.printf("  %s -> %s: %s\n", path.get(i), path.get(i + 1),
                        graph.conflicts(path.get(i), path.get(i + 1)));
            }
            return false;
        }

        CycleDetector.topologicalOrder(graph)
                .ifPresent(order -> System.err.printf("Serial order: %s\n", String.join(", ", order)));
        return true;
    }
}
