import history.Schedule;
import history.ScheduleLoader;
import lombok.AllArgsConstructor;

import org.apache.commons.lang3.tuple.Triple;

import java.util.List;

@AllArgsConstructor
public class TestLoader implements ScheduleLoader {
	final List<Triple<String, String, String>> operations;

	@Override
	public Schedule loadSchedule() {
		return Schedule.fromTuples(operations);
	}

	static Triple<String, String, String> op(String transaction, String code, String dataItem) {
		return Triple.of(transaction, code, dataItem);
	}

	static Schedule schedule(List<Triple<String, String, String>> operations) {
		return new TestLoader(operations).loadSchedule();
	}

	// scenario schedules shared by several tests
	static Schedule readThenWrite() {
		return schedule(List.of(
			op("T1", "R", "x"),
			op("T2", "R", "x"),
			op("T1", "W", "x"),
			op("T2", "C", ""),
			op("T1", "C", "")));
	}

	static Schedule crossedReadWrite() {
		return schedule(List.of(
			op("T1", "R", "x"),
			op("T2", "W", "x"),
			op("T2", "R", "y"),
			op("T1", "W", "y"),
			op("T1", "C", ""),
			op("T2", "C", "")));
	}

	static Schedule abortedReader() {
		return schedule(List.of(
			op("T1", "R", "x"),
			op("T2", "W", "x"),
			op("T1", "A", ""),
			op("T2", "C", "")));
	}
}
