package history;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.commons.lang3.tuple.Triple;

import com.google.common.collect.ImmutableList;

import history.Operation.OperationKind;
import lombok.EqualsAndHashCode;

/**
 * An ordered, immutable sequence of operations. The position of an operation is the only ordering
 * information a schedule carries.
 */
@EqualsAndHashCode
public class Schedule {
	private final ImmutableList<Operation> operations;

	public Schedule(Collection<Operation> operations) {
		this.operations = ImmutableList.copyOf(operations);
	}

	public static Schedule of(Operation... operations) {
		return new Schedule(List.of(operations));
	}

	/**
	 * Builds a schedule from (transaction id, operation code, data item) triples, where the code is
	 * one of R, W, C and A.
	 */
	public static Schedule fromTuples(List<Triple<String, String, String>> tuples) {
		return new Schedule(tuples.stream()
			.map(t -> Operation.of(t.getLeft(), t.getMiddle(), t.getRight()))
			.collect(Collectors.toList()));
	}

	public List<Operation> getOperations() {
		return operations;
	}

	public int size() {
		return operations.size();
	}

	public Operation get(int position) {
		return operations.get(position);
	}

	/**
	 * Transaction ids in order of first appearance.
	 */
	public Set<String> getTransactionIds() {
		return operations.stream()
			.map(Operation::getTransactionId)
			.collect(Collectors.toCollection(LinkedHashSet::new));
	}

	public Set<String> getDataItems() {
		return operations.stream()
			.filter(op -> !op.getKind().isTermination())
			.map(Operation::getDataItem)
			.collect(Collectors.toCollection(LinkedHashSet::new));
	}

	public Set<String> getAbortedTransactions() {
		return operations.stream()
			.filter(op -> op.getKind() == OperationKind.ABORT)
			.map(Operation::getTransactionId)
			.collect(Collectors.toCollection(LinkedHashSet::new));
	}

	/**
	 * Drops every operation of an aborted transaction except the abort itself.
	 */
	public Schedule getValidSubSchedule() {
		var aborted = getAbortedTransactions();
		var valid = new ArrayList<Operation>();
		for (var op : operations) {
			if (!aborted.contains(op.getTransactionId()) || op.getKind() == OperationKind.ABORT) {
				valid.add(op);
			}
		}
		return new Schedule(valid);
	}

	public List<Operation> getOperationsOf(String transactionId) {
		return operations.stream()
			.filter(op -> op.getTransactionId().equals(transactionId))
			.collect(Collectors.toList());
	}

	@Override
	public String toString() {
		return operations.stream().map(Operation::toString).collect(Collectors.joining(" "));
	}
}
