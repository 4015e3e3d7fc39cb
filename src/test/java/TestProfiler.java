import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.Test;

import history.InvalidScheduleException;
import util.Profiler;
import verifier.SerializabilityVerifier;

class TestProfiler {
    private final Profiler profiler = Profiler.getInstance();

    @Test
    void failedLoadClosesItsTick() {
        profiler.reset();
        var verifier = new SerializabilityVerifier(() -> {
            throw new InvalidScheduleException("broken");
        });

        assertThrows(InvalidScheduleException.class, verifier::audit);
        assertThrows(IllegalStateException.class, () -> profiler.endTick("LOAD"));
        assertEquals(List.of("LOAD"), profiler.getDurations().stream().map(Pair::getKey).collect(Collectors.toList()));
    }

    @Test
    void resetDropsDurationsAndRunningTicks() {
        profiler.startTick("A");
        profiler.endTick("A");
        profiler.startTick("B");

        profiler.reset();

        assertEquals(List.of(), List.copyOf(profiler.getDurations()));
        assertThrows(IllegalStateException.class, () -> profiler.endTick("B"));
    }
}
