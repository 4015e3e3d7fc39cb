package graph;

import history.Operation;
import history.Operation.OperationKind;

/**
 * Kind of conflict behind a precedence edge, named after the earlier and the later operation.
 */
public enum EdgeType {
    WR, RW, WW;

    static EdgeType of(Operation earlier, Operation later) {
        if (earlier.getKind() == OperationKind.WRITE) {
            return later.getKind() == OperationKind.WRITE ? WW : WR;
        }
        if (later.getKind() == OperationKind.WRITE) {
            return RW;
        }
        throw new IllegalArgumentException(String.format("%s and %s do not conflict", earlier, later));
    }
}
