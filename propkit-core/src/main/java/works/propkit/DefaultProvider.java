package works.propkit;

/**
 * Computes the value a property reports while its slot is unassigned.
 * <p>
 * Called afresh on every read until the property is first written;
 * the result is never stored. A provider may therefore depend on the
 * instance's other properties and report a different value each time they change.
 */
@FunctionalInterface
public interface DefaultProvider<T> {
	T compute(ManagedObject self);
}
