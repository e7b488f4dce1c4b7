package works.propkit.exceptions;

public class ReadOnlyPropertyException extends AttributeException {
	public ReadOnlyPropertyException(String className, String attributeName) {
		super(className, attributeName, "property is read-only");
	}
}
