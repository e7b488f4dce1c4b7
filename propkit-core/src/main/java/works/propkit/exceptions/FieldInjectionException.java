package works.propkit.exceptions;

/**
 * Thrown when something tries to store an attribute that is not part of
 * the storage layout of a managed class.
 */
public class FieldInjectionException extends AttributeException {
	public FieldInjectionException(String className, String attributeName) {
		super(className, attributeName, "not a declared property or storage slot");
	}
}
