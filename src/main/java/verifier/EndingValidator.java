package verifier;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;

import history.Schedule;

/**
 * Reports transactions whose termination does not make sense: both committed and aborted, or
 * issued reads/writes but never terminated. The findings are advisory only.
 */
public class EndingValidator {
    private EndingValidator() {
    }

    public static List<String> validate(Schedule schedule) {
        var warnings = new ArrayList<String>();
        for (var state : endStates(schedule)) {
            if (state.isContradictory()) {
                warnings.add(String.format("transaction %s has both commit and abort", state.getTransactionId()));
            } else if (state.isUnterminated()) {
                warnings.add(String.format("transaction %s has neither commit nor abort", state.getTransactionId()));
            }
        }
        return warnings;
    }

    /**
     * End states of all transactions in order of first appearance.
     */
    public static Collection<TransactionEndState> endStates(Schedule schedule) {
        var states = new LinkedHashMap<String, TransactionEndState>();
        for (var op : schedule.getOperations()) {
            var state = states.computeIfAbsent(op.getTransactionId(), TransactionEndState::new);
            switch (op.getKind()) {
            case COMMIT:
                state.setHasCommit(true);
                break;
            case ABORT:
                state.setHasAbort(true);
                break;
            default:
                state.setHasOtherOps(true);
            }
        }
        return states.values();
    }
}
