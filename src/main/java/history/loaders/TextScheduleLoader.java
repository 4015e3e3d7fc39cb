package history.loaders;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileReader;
import java.io.FileWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.regex.Pattern;

import history.InvalidScheduleException;
import history.Operation;
import history.Schedule;
import history.ScheduleParser;
import lombok.Cleanup;
import lombok.SneakyThrows;

/**
 * Reads and writes schedules written as operation tokens, e.g.
 *
 * <pre>
 * R(T1,x) W(T2,x)
 * C(T1) A(T2)
 * </pre>
 *
 * Tokens are separated by whitespace and contain none; lines starting with '#' are ignored. Ids
 * and data items with whitespace, commas or parentheses cannot be written in this format.
 */
public class TextScheduleLoader implements ScheduleParser {
    private static final Pattern TOKEN = Pattern.compile("([RrWwCcAa])\\(([^,()\\s]+)(?:,([^,()\\s]*))?\\)");
    private static final int OPERATIONS_PER_LINE = 8;

    private final File textFile;

    public TextScheduleLoader(Path filePath) {
        textFile = filePath.toFile();
    }

    @Override
    @SneakyThrows
    public Schedule loadSchedule() {
        @Cleanup
        var in = new BufferedReader(new FileReader(textFile, StandardCharsets.UTF_8));
        var operations = new ArrayList<Operation>();

        var lineNumber = 0;
        String line;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            var trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }

            for (var token : trimmed.split("\\s+")) {
                var match = TOKEN.matcher(token);
                if (!match.matches()) {
                    throw new InvalidScheduleException(
                            String.format("%s:%d: invalid operation '%s'", textFile.getName(), lineNumber, token));
                }

                var dataItem = match.group(3) == null ? "" : match.group(3);
                try {
                    operations.add(Operation.of(match.group(2), match.group(1), dataItem));
                } catch (InvalidScheduleException e) {
                    throw new InvalidScheduleException(
                            String.format("%s:%d: %s", textFile.getName(), lineNumber, e.getMessage()), e);
                }
            }
        }

        return new Schedule(operations);
    }

    @Override
    @SneakyThrows
    public void dumpSchedule(Schedule schedule) {
        Utils.checkRepresentable(schedule, textFile.getName(),
                c -> Character.isWhitespace(c) || c == ',' || c == '(' || c == ')');

        @Cleanup
        var out = new BufferedWriter(new FileWriter(textFile, StandardCharsets.UTF_8));

        var ops = schedule.getOperations();
        for (int i = 0; i < ops.size(); i++) {
            out.append(ops.get(i).toString());
            out.append((i + 1) % OPERATIONS_PER_LINE == 0 || i == ops.size() - 1 ? "\n" : " ");
        }
    }
}
