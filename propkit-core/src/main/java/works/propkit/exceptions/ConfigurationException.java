package works.propkit.exceptions;

/**
 * Indicates that a managed class was declared incorrectly.
 * These are programming errors: they surface while the class is being defined
 * (or, for {@link AttributeException}s, at the offending assignment), never later.
 */
public class ConfigurationException extends IllegalArgumentException {
	public ConfigurationException(String s) {
		super(s);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
