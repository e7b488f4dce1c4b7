package works.propkit.exceptions;

/**
 * Wraps a checked exception thrown by a reflectively invoked
 * {@link works.propkit.annotations.Prop @Prop} or
 * {@link works.propkit.annotations.OnChange @OnChange} method.
 */
public class ListenerException extends IllegalStateException {
	public ListenerException(String message, Throwable cause) {
		super(message, cause);
	}
}
