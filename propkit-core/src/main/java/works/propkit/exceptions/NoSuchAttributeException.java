package works.propkit.exceptions;

public class NoSuchAttributeException extends AttributeException {
	public NoSuchAttributeException(String className, String attributeName) {
		super(className, attributeName, "no such attribute");
	}
}
