package works.propkit;

import java.util.Arrays;
import works.propkit.exceptions.FieldInjectionException;

/**
 * The slots of one {@link ManagedObject}: exactly those of its class's {@link StorageLayout},
 * no more and no fewer. A slot is either assigned or not;
 * assigning {@code null} counts as assigned.
 * <p>
 * Not thread-safe.
 */
public final class InstanceStorage {
	private final String className;
	private final StorageLayout layout;
	private final Object[] values;

	InstanceStorage(String className, StorageLayout layout) {
		this.className = className;
		this.layout = layout;
		this.values = new Object[layout.size()];
		Arrays.fill(values, UNASSIGNED);
	}

	public StorageLayout layout() {
		return layout;
	}

	public boolean isAssigned(String slot) {
		return values[index(slot)] != UNASSIGNED;
	}

	/**
	 * @return the slot's value, or null if it has never been assigned
	 */
	public Object readOrNull(String slot) {
		Object value = values[index(slot)];
		return (value == UNASSIGNED) ? null : value;
	}

	/**
	 * @throws FieldInjectionException if {@code slot} is not part of the layout
	 */
	public void write(String slot, Object value) {
		values[index(slot)] = value;
	}

	/**
	 * Returns the slot to the unassigned state.
	 */
	public void clear(String slot) {
		values[index(slot)] = UNASSIGNED;
	}

	private int index(String slot) {
		int index = layout.indexOf(slot);
		if (index < 0) {
			throw new FieldInjectionException(className, slot);
		}
		return index;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("{");
		for (int i = 0; i < values.length; i++) {
			if (i >= 1) {
				sb.append(", ");
			}
			sb.append(layout.slots().get(i)).append('=').append(values[i]);
		}
		return sb.append('}').toString();
	}

	private static final Object UNASSIGNED = new Object() {
		@Override
		public String toString() {
			return "<unassigned>";
		}
	};
}
