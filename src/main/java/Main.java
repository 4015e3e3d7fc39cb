import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

import history.Operation.OperationKind;
import history.Schedule;
import history.ScheduleParser;
import history.loaders.TextScheduleLoader;
import history.loaders.TupleScheduleLoader;
import lombok.SneakyThrows;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import util.Profiler;
import util.UnimplementedError;
import verifier.EndingValidator;
import verifier.SerializabilityVerifier;

@Command(name = "serchecker", mixinStandardHelpOptions = true, version = "serchecker 0.0.1", subcommands = {
        Audit.class, Convert.class, Stat.class, Dump.class })
public class Main implements Callable<Integer> {
    @SneakyThrows
    public static void main(String[] args) {
        var cmd = new CommandLine(new Main());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        System.exit(cmd.execute(args));
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.err);
        return -1;
    }
}

@Command(name = "audit", mixinStandardHelpOptions = true, description = "Check whether a schedule is conflict-serializable")
class Audit implements Callable<Integer> {
    @Option(names = { "-t", "--type" }, description = "schedule format: ${COMPLETION-CANDIDATES}")
    private final ScheduleType type = ScheduleType.TEXT;

    @Option(names = { "--dot-output" }, description = "print the precedence graph in dot format")
    private final Boolean dotOutput = false;

    @Parameters(description = "schedule path")
    private Path path;

    private final Profiler profiler = Profiler.getInstance();

    @Override
    public Integer call() {
        var loader = Utils.getParser(type, path);

        SerializabilityVerifier.setDotOutput(dotOutput);

        profiler.reset();
        profiler.startTick("ENTIRE_EXPERIMENT");
        var verifier = new SerializabilityVerifier(loader);
        var pass = verifier.audit();
        profiler.endTick("ENTIRE_EXPERIMENT");

        for (var p : profiler.getDurations()) {
            System.err.printf("%s: %dms\n", p.getKey(), p.getValue());
        }
        System.err.printf("Max memory: %s\n", Utils.formatMemory(profiler.getMaxMemory()));

        if (pass) {
            System.err.println("[[[[ ACCEPT ]]]]");
            return 0;
        } else {
            System.err.println("[[[[ REJECT ]]]]");
            return -1;
        }
    }
}

@Command(name = "convert", mixinStandardHelpOptions = true, description = "Convert a schedule between formats")
class Convert implements Callable<Integer> {
    @Option(names = { "-f", "--from" }, description = "input schedule format: ${COMPLETION-CANDIDATES}")
    private final ScheduleType inType = ScheduleType.TEXT;

    @Option(names = { "-o", "--output" }, description = "output schedule format: ${COMPLETION-CANDIDATES}")
    private final ScheduleType outType = ScheduleType.TUPLE;

    @Parameters(description = "input schedule path", index = "0")
    private Path inPath;

    @Parameters(description = "output schedule path", index = "1")
    private Path outPath;

    @Override
    public Integer call() {
        var in = Utils.getParser(inType, inPath);
        var out = Utils.getParser(outType, outPath);

        out.dumpSchedule(in.loadSchedule());
        return 0;
    }
}

@Command(name = "stat", mixinStandardHelpOptions = true, description = "Print some statistics of a schedule")
class Stat implements Callable<Integer> {
    @Option(names = { "-t", "--type" }, description = "schedule format: ${COMPLETION-CANDIDATES}")
    private final ScheduleType type = ScheduleType.TEXT;

    @Parameters(description = "schedule path")
    private Path path;

    @Override
    public Integer call() {
        var schedule = Utils.getParser(type, path).loadSchedule();

        var kinds = schedule.getOperations().stream()
                .collect(Collectors.groupingBy(op -> op.getKind(), Collectors.counting()));
        var states = EndingValidator.endStates(schedule);

        System.out.printf(
                "Transactions: %d, committed: %d, aborted: %d, unterminated: %d\n"
                        + "Operations: total %d, read %d, write %d, commit %d, abort %d\n" + "Data items: %d\n",
                states.size(),
                states.stream().filter(s -> s.isHasCommit()).count(),
                states.stream().filter(s -> s.isHasAbort()).count(),
                states.stream().filter(s -> !s.isHasCommit() && !s.isHasAbort()).count(),
                schedule.size(),
                kinds.getOrDefault(OperationKind.READ, 0L),
                kinds.getOrDefault(OperationKind.WRITE, 0L),
                kinds.getOrDefault(OperationKind.COMMIT, 0L),
                kinds.getOrDefault(OperationKind.ABORT, 0L),
                schedule.getDataItems().size());

        System.out.println("(data item, #writes):");
        var writes = new LinkedHashMap<String, Integer>();
        schedule.getDataItems().forEach(d -> writes.put(d, 0));
        schedule.getOperations().stream().filter(op -> op.getKind() == OperationKind.WRITE)
                .forEach(op -> writes.merge(op.getDataItem(), 1, Integer::sum));
        writes.forEach((d, n) -> System.out.printf("%s: %d\n", d, n));

        return 0;
    }
}

@Command(name = "dump", mixinStandardHelpOptions = true, description = "Print a schedule to stdout")
class Dump implements Callable<Integer> {
    @Option(names = { "-t", "--type" }, description = "schedule format: ${COMPLETION-CANDIDATES}")
    private final ScheduleType type = ScheduleType.TEXT;

    @Parameters(description = "schedule path")
    private Path path;

    @Override
    public Integer call() {
        Schedule schedule = Utils.getParser(type, path).loadSchedule();

        for (var txn : schedule.getTransactionIds()) {
            System.out.printf("Transaction %s\n", txn);
            for (var op : schedule.getOperationsOf(txn)) {
                System.out.printf("%s\n", op);
            }
            System.out.println();
        }

        return 0;
    }
}

class Utils {
    static ScheduleParser getParser(ScheduleType type, Path path) {
        switch (type) {
        case TEXT:
            return new TextScheduleLoader(path);
        case TUPLE:
            return new TupleScheduleLoader(path);
        default:
            throw new UnimplementedError();
        }
    }

    static String formatMemory(Long memoryBytes) {
        double[] scale = { 1, 1024, 1024 * 1024, 1024 * 1024 * 1024 };
        String[] unit = { "B", "KB", "MB", "GB" };

        for (int i = scale.length - 1; i >= 0; i--) {
            if (i == 0 || memoryBytes >= scale[i]) {
                return String.format("%.1f%s", memoryBytes / scale[i], unit[i]);
            }
        }
        throw new Error("should not be here");
    }
}

enum ScheduleType {
    TEXT, TUPLE
}
