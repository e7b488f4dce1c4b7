package works.propkit;

import java.util.Map;

/**
 * Runs when {@link ManagedClass#newInstance(Map)} creates an instance.
 *
 * @see FieldCopier#initializer
 */
@FunctionalInterface
public interface Initializer {
	void initialize(ManagedObject self, Map<String, ?> arguments);
}
