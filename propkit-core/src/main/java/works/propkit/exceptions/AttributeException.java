package works.propkit.exceptions;

/**
 * An attempt to access an attribute of a managed object in a way its class does not permit.
 */
public class AttributeException extends ConfigurationException {
	private final String className;
	private final String attributeName;

	public String className() {
		return this.className;
	}

	public String attributeName() {
		return this.attributeName;
	}

	public AttributeException(String className, String attributeName, String message) {
		super(fullMessage(className, attributeName, message));
		this.className = className;
		this.attributeName = attributeName;
	}

	private static String fullMessage(String className, String attributeName, String message) {
		return "Invalid attribute " + className + "." + attributeName + ": " + message;
	}
}
