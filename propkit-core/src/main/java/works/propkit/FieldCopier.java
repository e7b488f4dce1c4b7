package works.propkit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import works.propkit.exceptions.FieldInjectionException;

import static java.util.Collections.unmodifiableList;

/**
 * Copies constructor arguments straight into storage slots,
 * bypassing setters, so read-only properties can be given their values.
 */
public final class FieldCopier {
	private FieldCopier() { }

	/**
	 * Writes each argument into the slot {@link PropkitConfig#slotFor named after it},
	 * skipping {@link PropkitConfig#selfParameter()} and the names in {@code exclude}.
	 * <p>
	 * If {@code saveArgs} is set, the copied values are also stored, in the order of
	 * {@code arguments}, as an unmodifiable list in the {@link PropkitConfig#argsSlot()} slot.
	 *
	 * @throws FieldInjectionException if a slot to be written is not in the layout
	 */
	public static void copyFields(ManagedObject self, Map<String, ?> arguments, Set<String> exclude, boolean saveArgs) {
		PropkitConfig config = self.managedClass().config();
		InstanceStorage storage = self.storage();
		List<Object> copied = new ArrayList<>(arguments.size());
		arguments.forEach((name, value) -> {
			if (name.equals(config.selfParameter()) || exclude.contains(name)) {
				return;
			}
			storage.write(config.slotFor(name), value);
			copied.add(value);
		});
		if (saveArgs) {
			storage.write(config.argsSlot(), unmodifiableList(copied));
		}
	}

	public static void copyFields(ManagedObject self, Map<String, ?> arguments) {
		copyFields(self, arguments, Set.of(), false);
	}

	/**
	 * @return an {@link Initializer} that calls {@link #copyFields} with the given settings
	 */
	public static Initializer initializer(Set<String> exclude, boolean saveArgs) {
		Set<String> excluded = Set.copyOf(exclude);
		return (self, arguments) -> copyFields(self, arguments, excluded, saveArgs);
	}

	public static Initializer initializer() {
		return initializer(Set.of(), false);
	}
}
