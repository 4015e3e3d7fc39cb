package verifier;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import graph.PrecedenceGraph;
import lombok.Data;

@Data
public class VerificationResult {
    private final boolean serializable;
    private final List<String> warnings;
    private final PrecedenceGraph graph;

    // set when the schedule is not serializable
    private final Optional<List<String>> cycle;

    // set when the schedule is serializable
    private final Optional<List<String>> serialOrder;

    public Map<String, List<String>> getAdjacency() {
        return graph.toAdjacencyMap();
    }
}
