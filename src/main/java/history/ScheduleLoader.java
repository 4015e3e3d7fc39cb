package history;

public interface ScheduleLoader {
	Schedule loadSchedule();
}
