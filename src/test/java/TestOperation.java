import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import history.InvalidOperationException;
import history.InvalidScheduleException;
import history.MissingDataItemException;
import history.Operation;
import history.Operation.OperationKind;

class TestOperation {
    @Test
    void parsesCodes() {
        assertEquals(OperationKind.READ, OperationKind.fromCode("R"));
        assertEquals(OperationKind.WRITE, OperationKind.fromCode("w"));
        assertEquals(OperationKind.COMMIT, OperationKind.fromCode("C"));
        assertEquals(OperationKind.ABORT, OperationKind.fromCode("a"));
    }

    @ParameterizedTest
    @ValueSource(strings = { "X", "", "RW", "read", "1" })
    void rejectsUnknownCodes(String code) {
        assertThrows(InvalidOperationException.class, () -> Operation.of("T1", code, "x"));
    }

    @Test
    void rejectsNullKindAndEmptyTransaction() {
        assertThrows(InvalidOperationException.class, () -> Operation.of("T1", null, "x"));
        assertThrows(InvalidOperationException.class, () -> new Operation("T1", null, "x"));
        assertThrows(InvalidOperationException.class, () -> Operation.read("", "x"));
        assertThrows(InvalidOperationException.class, () -> Operation.commit(null));
    }

    @Test
    void readsAndWritesNeedDataItem() {
        var e = assertThrows(MissingDataItemException.class, () -> Operation.of("T1", "R", ""));
        assertTrue(e.getMessage().contains("T1"));
        assertThrows(MissingDataItemException.class, () -> Operation.write("T2", null));
        assertThrows(InvalidScheduleException.class, () -> Operation.write("T2", ""));
    }

    @Test
    void terminationsDropDataItem() {
        var commit = Operation.of("T1", "C", "x");
        assertEquals("", commit.getDataItem());
        assertEquals(Operation.commit("T1"), commit);
        assertEquals("C(T1)", commit.toString());
        assertEquals("W(T1,x)", Operation.write("T1", "x").toString());
    }

    @Test
    void conflicts() {
        assertTrue(Operation.write("T1", "x").conflictsWith(Operation.read("T2", "x")));
        assertTrue(Operation.read("T1", "x").conflictsWith(Operation.write("T2", "x")));
        assertTrue(Operation.write("T1", "x").conflictsWith(Operation.write("T2", "x")));

        assertFalse(Operation.read("T1", "x").conflictsWith(Operation.read("T2", "x")));
        assertFalse(Operation.write("T1", "x").conflictsWith(Operation.write("T1", "x")));
        assertFalse(Operation.write("T1", "x").conflictsWith(Operation.write("T2", "y")));
        assertFalse(Operation.commit("T1").conflictsWith(Operation.abort("T2")));
    }
}
