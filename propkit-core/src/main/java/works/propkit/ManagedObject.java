package works.propkit;

import works.propkit.exceptions.FieldInjectionException;
import works.propkit.exceptions.NoSuchAttributeException;
import works.propkit.exceptions.ReadOnlyPropertyException;

/**
 * An instance of a {@link ManagedClass}.
 * <p>
 * Attributes are either properties, accessed through their generated accessors,
 * or raw storage slots. No other attribute can ever be stored.
 * <p>
 * There is no synchronization: callers that share an instance between threads
 * must serialize access to it themselves.
 */
public final class ManagedObject {
	private final ManagedClass managedClass;
	private final InstanceStorage storage;

	ManagedObject(ManagedClass managedClass, InstanceStorage storage) {
		this.managedClass = managedClass;
		this.storage = storage;
	}

	public ManagedClass managedClass() {
		return managedClass;
	}

	public InstanceStorage storage() {
		return storage;
	}

	/**
	 * @return the property's current value (possibly a freshly computed default),
	 * or the raw contents of the storage slot with that name
	 * @throws NoSuchAttributeException if {@code name} is neither
	 */
	public Object get(String name) {
		ManagedProperty property = managedClass.property(name);
		if (property != null) {
			return property.getter().get(this);
		} else if (storage.layout().contains(name)) {
			return storage.readOrNull(name);
		} else {
			throw new NoSuchAttributeException(managedClass.name(), name);
		}
	}

	public <T> T get(String name, Class<T> type) {
		return type.cast(get(name));
	}

	/**
	 * Assigns through the property's setter, or directly to the storage slot with that name.
	 *
	 * @throws ReadOnlyPropertyException if {@code name} is a property with no setter
	 * @throws FieldInjectionException if {@code name} is neither a property nor a slot
	 */
	public void set(String name, Object value) {
		ManagedProperty property = managedClass.property(name);
		if (property != null) {
			property.setter()
				.orElseThrow(() -> new ReadOnlyPropertyException(managedClass.name(), name))
				.set(this, value);
		} else if (storage.layout().contains(name)) {
			storage.write(name, value);
		} else {
			throw new FieldInjectionException(managedClass.name(), name);
		}
	}

	/**
	 * @return whether any auto-dirty property has changed since construction
	 * or the last {@link #markClean()}; false if the class has no dirty flag
	 */
	public boolean isDirty() {
		String dirtySlot = managedClass.config().dirtySlot();
		return storage.layout().contains(dirtySlot)
			&& Boolean.TRUE.equals(storage.readOrNull(dirtySlot));
	}

	public void markClean() {
		String dirtySlot = managedClass.config().dirtySlot();
		if (storage.layout().contains(dirtySlot)) {
			storage.write(dirtySlot, false);
		}
	}

	@Override
	public String toString() {
		return managedClass.name() + storage;
	}
}
