package graph;

import lombok.Data;

@Data
public class Conflict {
    private final EdgeType type;
    private final String dataItem;

    // positions in the schedule the graph was built from
    private final int earlierPosition;
    private final int laterPosition;

    @Override
    public String toString() {
        return String.format("%s(%s)", type, dataItem);
    }
}
