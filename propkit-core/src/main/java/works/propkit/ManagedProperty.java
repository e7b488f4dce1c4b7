package works.propkit;

import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * The accessors generated for one {@link FieldDefinition}.
 * <p>
 * The getter returns the stored value if the slot is assigned,
 * or else whatever the {@link DefaultProvider} computes right now.
 * <p>
 * The setter, absent for read-only properties, does nothing if the new value
 * {@link Objects#equals equals} the stored one (an unassigned slot counts as null).
 * Otherwise it stores the value, then sets the dirty flag if the property is auto-dirty,
 * then calls the listener, if any, so the listener already sees the new value.
 * <p>
 * Holds no state besides the definition; the values live in each instance's {@link InstanceStorage}.
 */
public final class ManagedProperty {
	private final FieldDefinition definition;
	private final Getter getter;
	private final @Nullable Setter setter;

	@FunctionalInterface
	public interface Getter {
		Object get(ManagedObject self);
	}

	@FunctionalInterface
	public interface Setter {
		void set(ManagedObject self, Object newValue);
	}

	private ManagedProperty(FieldDefinition definition, Getter getter, @Nullable Setter setter) {
		this.definition = definition;
		this.getter = getter;
		this.setter = setter;
	}

	static ManagedProperty of(FieldDefinition definition, String dirtySlot) {
		return new ManagedProperty(definition, getterFor(definition), setterFor(definition, dirtySlot));
	}

	private static Getter getterFor(FieldDefinition definition) {
		String slot = definition.slot();
		DefaultProvider<?> defaultProvider = definition.defaultProvider();
		return self -> {
			InstanceStorage storage = self.storage();
			if (storage.isAssigned(slot)) {
				return storage.readOrNull(slot);
			} else {
				return defaultProvider.compute(self);
			}
		};
	}

	private static @Nullable Setter setterFor(FieldDefinition definition, String dirtySlot) {
		if (definition.readOnly()) {
			return null;
		}
		String slot = definition.slot();
		boolean autoDirty = definition.autoDirty();
		String listener = definition.listener();
		return (self, newValue) -> {
			InstanceStorage storage = self.storage();
			Object oldValue = storage.readOrNull(slot);
			if (Objects.equals(oldValue, newValue)) {
				return;
			}
			storage.write(slot, newValue);
			if (autoDirty) {
				storage.write(dirtySlot, true);
			}
			if (listener != null) {
				self.managedClass().listener(listener).changed(self, slot, oldValue, newValue);
			}
		};
	}

	public FieldDefinition definition() {
		return definition;
	}

	public String name() {
		return definition.name();
	}

	public Getter getter() {
		return getter;
	}

	public Optional<Setter> setter() {
		return Optional.ofNullable(setter);
	}

	public boolean isReadOnly() {
		return setter == null;
	}

	public Optional<String> doc() {
		return Optional.ofNullable(definition.doc());
	}

	@Override
	public String toString() {
		return "ManagedProperty(" + definition.name() + (isReadOnly() ? ", read-only" : "") + ")";
	}
}
