package history.loaders;

import java.util.function.IntPredicate;

import history.InvalidScheduleException;
import history.Operation;
import history.Schedule;

class Utils {
	/**
	 * Fails if an id or data item of the schedule contains a character the format cannot write back,
	 * or starts or ends with whitespace. Runs before the output file is opened.
	 */
	static void checkRepresentable(Schedule schedule, String fileName, IntPredicate forbidden) {
		for (var op : schedule.getOperations()) {
			check(op, op.getTransactionId(), fileName, forbidden);
			check(op, op.getDataItem(), fileName, forbidden);
		}
	}

	private static void check(Operation op, String value, String fileName, IntPredicate forbidden) {
		if (!value.equals(value.strip()) || value.chars().anyMatch(forbidden)) {
			throw new InvalidScheduleException(
				String.format("%s: cannot write %s, '%s' contains unsupported characters", fileName, op, value));
		}
	}
}
