import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import history.Schedule;
import verifier.SerializabilityVerifier;

public class TestSerializabilityVerifier {
	@Test
	void serializableSchedule() {
		var result = SerializabilityVerifier.checkConflictSerializability(TestLoader.readThenWrite());

		assertTrue(result.isSerializable());
		assertEquals(List.of(), result.getWarnings());
		assertEquals(Map.of("T1", List.of(), "T2", List.of("T1")), result.getAdjacency());
		assertEquals(Optional.of(List.of("T2", "T1")), result.getSerialOrder());
		assertEquals(Optional.empty(), result.getCycle());
	}

	@Test
	void nonSerializableSchedule() {
		var result = SerializabilityVerifier.check(TestLoader.crossedReadWrite());

		assertFalse(result.isSerializable());
		assertEquals(List.of(), result.getWarnings());
		assertEquals(Map.of("T1", List.of("T2"), "T2", List.of("T1")), result.getAdjacency());
		assertEquals(Optional.of(List.of("T1", "T2", "T1")), result.getCycle());
		assertEquals(Optional.empty(), result.getSerialOrder());
	}

	@Test
	void abortedTransactionBreaksNoCycle() {
		var result = SerializabilityVerifier.check(TestLoader.abortedReader());

		assertTrue(result.isSerializable());
		assertEquals(List.of(), result.getWarnings());
		assertEquals(Map.of("T2", List.of()), result.getAdjacency());
	}

	@Test
	void warningsDoNotChangeVerdict() {
		var result = SerializabilityVerifier.check(TestLoader.schedule(List.of(
			TestLoader.op("T1", "R", "x"),
			TestLoader.op("T1", "W", "x"))));

		assertTrue(result.isSerializable());
		assertEquals(List.of("transaction T1 has neither commit nor abort"), result.getWarnings());
		assertEquals(0, result.getGraph().edgeCount());

		var cyclic = SerializabilityVerifier.check(TestLoader.schedule(List.of(
			TestLoader.op("T1", "R", "x"),
			TestLoader.op("T2", "W", "x"),
			TestLoader.op("T2", "R", "y"),
			TestLoader.op("T1", "W", "y"))));

		assertFalse(cyclic.isSerializable());
		assertEquals(List.of(
			"transaction T1 has neither commit nor abort",
			"transaction T2 has neither commit nor abort"), cyclic.getWarnings());
	}

	@Test
	void abortRemovesCycle() {
		// the crossed schedule with T2 aborted
		var result = SerializabilityVerifier.check(TestLoader.schedule(List.of(
			TestLoader.op("T1", "R", "x"),
			TestLoader.op("T2", "W", "x"),
			TestLoader.op("T2", "R", "y"),
			TestLoader.op("T1", "W", "y"),
			TestLoader.op("T1", "C", ""),
			TestLoader.op("T2", "A", ""))));

		assertTrue(result.isSerializable());
		assertEquals(Map.of("T1", List.of()), result.getAdjacency());
	}

	@Test
	void checkingTwiceGivesSameResult() {
		Schedule schedule = TestLoader.crossedReadWrite();

		assertEquals(SerializabilityVerifier.check(schedule), SerializabilityVerifier.check(schedule));
		assertEquals(TestLoader.crossedReadWrite(), schedule);
	}

	@Test
	void audit() {
		var accept = new SerializabilityVerifier(() -> TestLoader.readThenWrite());
		var reject = new SerializabilityVerifier(new TestLoader(List.of(
			TestLoader.op("T1", "W", "x"),
			TestLoader.op("T2", "W", "x"),
			TestLoader.op("T2", "W", "y"),
			TestLoader.op("T1", "W", "y"))));

		assertTrue(accept.audit());
		assertFalse(reject.audit());
	}
}
