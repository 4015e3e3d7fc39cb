package history.loaders;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileReader;
import java.io.FileWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;

import history.InvalidScheduleException;
import history.Operation;
import history.Schedule;
import history.ScheduleParser;
import lombok.Cleanup;
import lombok.SneakyThrows;

/**
 * One operation per line as {@code transaction,code,dataItem}, e.g. {@code T1,R,x} or
 * {@code T1,C,}. The data item of a commit or abort may be left out. Fields are trimmed, so ids and
 * data items may not contain commas or line breaks, nor start or end with whitespace.
 */
public class TupleScheduleLoader implements ScheduleParser {
    private final File tupleFile;

    public TupleScheduleLoader(Path filePath) {
        tupleFile = filePath.toFile();
    }

    @Override
    @SneakyThrows
    public Schedule loadSchedule() {
        @Cleanup
        var in = new BufferedReader(new FileReader(tupleFile, StandardCharsets.UTF_8));
        var operations = new ArrayList<Operation>();

        var lineNumber = 0;
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            var trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            var fields = trimmed.split(",", -1);
            if (fields.length < 2 || fields.length > 3) {
                throw new InvalidScheduleException(
                        String.format("%s:%d: expected 2 or 3 fields, got %d", tupleFile.getName(), lineNumber,
                                fields.length));
            }

            var dataItem = fields.length == 3 ? fields[2].strip() : "";
            try {
                operations.add(Operation.of(fields[0].strip(), fields[1].strip(), dataItem));
            } catch (InvalidScheduleException e) {
                throw new InvalidScheduleException(
                        String.format("%s:%d: %s", tupleFile.getName(), lineNumber, e.getMessage()), e);
            }
        }

        return new Schedule(operations);
    }

    @Override
    @SneakyThrows
    public void dumpSchedule(Schedule schedule) {
        Utils.checkRepresentable(schedule, tupleFile.getName(), c -> c == ',' || c == '\n' || c == '\r');
        for (var op : schedule.getOperations()) {
            // would be read back as a comment line
            if (op.getTransactionId().startsWith("#")) {
                throw new InvalidScheduleException(String.format("%s: cannot write %s, transaction id starts with '#'",
                        tupleFile.getName(), op));
            }
        }

        @Cleanup
        var out = new BufferedWriter(new FileWriter(tupleFile, StandardCharsets.UTF_8));

        for (var op : schedule.getOperations()) {
            out.append(String.format("%s,%s,%s\n", op.getTransactionId(), op.getKind().getCode(), op.getDataItem()));
        }
    }
}
