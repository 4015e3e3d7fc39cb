package history;

public interface ScheduleDumper {
	void dumpSchedule(Schedule schedule);
}
