package works.propkit.exceptions;

/**
 * Indicates that an API was called at the wrong point in its lifecycle,
 * such as declaring a property through a builder that has already been closed.
 */
public class UsageException extends IllegalStateException {
	public UsageException(String s) {
		super(s);
	}

	public UsageException(String message, Throwable cause) {
		super(message, cause);
	}
}
