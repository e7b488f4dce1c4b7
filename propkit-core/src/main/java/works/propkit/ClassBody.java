package works.propkit;

/**
 * The declarations making up a {@link ManagedClass}.
 * Anything thrown here aborts {@link ManagedClass#define}.
 */
@FunctionalInterface
public interface ClassBody {
	void evaluate(ClassNamespace namespace) throws Exception;
}
