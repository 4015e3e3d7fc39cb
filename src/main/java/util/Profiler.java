package util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.apache.commons.lang3.tuple.Pair;

import com.google.common.base.Stopwatch;

/**
 * Accumulates wall-clock time per named phase and tracks the peak heap usage seen at phase
 * boundaries.
 */
public class Profiler {
    private static final Profiler instance = new Profiler();

    private final Map<String, Stopwatch> running = new HashMap<>();
    private final Map<String, Long> durations = new LinkedHashMap<>();
    private long maxMemory = 0;

    private Profiler() {
    }

    public static Profiler getInstance() {
        return instance;
    }

    public synchronized void startTick(String tag) {
        updateMemory();
        running.put(tag, Stopwatch.createStarted());
    }

    public synchronized void endTick(String tag) {
        var stopwatch = running.remove(tag);
        if (stopwatch == null) {
            throw new IllegalStateException(String.format("tick %s was not started", tag));
        }
        durations.merge(tag, stopwatch.elapsed(TimeUnit.MILLISECONDS), Long::sum);
        updateMemory();
    }

    public synchronized Collection<Pair<String, Long>> getDurations() {
        var result = new ArrayList<Pair<String, Long>>();
        durations.forEach((k, v) -> result.add(Pair.of(k, v)));
        return result;
    }

    public synchronized long getMaxMemory() {
        return maxMemory;
    }

    public synchronized void reset() {
        running.clear();
        durations.clear();
        maxMemory = 0;
    }

    private void updateMemory() {
        var runtime = Runtime.getRuntime();
        maxMemory = Math.max(maxMemory, runtime.totalMemory() - runtime.freeMemory());
    }
}
