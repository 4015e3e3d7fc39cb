package history;

/**
 * Thrown when an operation has an unknown kind or no transaction id.
 */
public class InvalidOperationException extends InvalidScheduleException {
	public InvalidOperationException(String message) {
		super(message);
	}
}
