package history;

public interface ScheduleParser extends ScheduleLoader, ScheduleDumper {
}
