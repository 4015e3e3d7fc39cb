package verifier;

import lombok.Data;

@Data
public class TransactionEndState {
    private final String transactionId;
    private boolean hasCommit;
    private boolean hasAbort;

    // reads and writes
    private boolean hasOtherOps;

    public boolean isContradictory() {
        return hasCommit && hasAbort;
    }

    public boolean isUnterminated() {
        return !hasCommit && !hasAbort && hasOtherOps;
    }
}
