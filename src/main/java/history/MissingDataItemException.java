package history;

/**
 * Thrown when a read or write does not name the data item it accesses.
 */
public class MissingDataItemException extends InvalidScheduleException {
	public MissingDataItemException(String transactionId, Operation.OperationKind kind) {
		super(String.format("%s of transaction %s has no data item", kind, transactionId));
	}
}
