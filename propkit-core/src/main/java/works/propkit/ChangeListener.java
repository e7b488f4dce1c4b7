package works.propkit;

/**
 * Called after a property's stored value changes.
 * Registered in a {@link ClassNamespace} under a name that properties
 * refer to via {@link FieldOptions#getListener()}.
 */
@FunctionalInterface
public interface ChangeListener {
	/**
	 * @param self the instance whose property changed; reading the property yields {@code newValue}
	 * @param slot the storage slot of the property that changed
	 * @param oldValue the previously stored value, or null if the slot was unassigned
	 * @param newValue the value just stored
	 */
	void changed(ManagedObject self, String slot, Object oldValue, Object newValue);
}
