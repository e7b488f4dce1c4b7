package works.propkit;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import works.propkit.exceptions.ConfigurationException;

import static java.util.Arrays.asList;
import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;

/**
 * The members of a {@link ManagedClass} that is still being defined.
 * <p>
 * Names map to arbitrary members: {@link ManagedProperty properties},
 * {@link ChangeListener listeners}, the class {@link Initializer},
 * and the storage layout under {@link #STORAGE_LAYOUT}.
 * Insertion order is preserved.
 * <p>
 * Owned by {@link ManagedClass#define}, which hands it to the {@link ClassBody}
 * and consumes it once the body returns.
 */
public final class ClassNamespace {
	/**
	 * The entry holding the ordered list of storage slot names.
	 * It may be absent, a mutable {@link List}, or an immutable one.
	 */
	public static final String STORAGE_LAYOUT = "__slots__";

	/**
	 * The entry holding the class's {@link Initializer}, if any.
	 */
	public static final String INITIALIZER = "__init__";

	@NotNull final String className;
	@NotNull final PropkitConfig config;
	private final Map<String, Object> members = new LinkedHashMap<>();

	ClassNamespace(@NotNull String className, @NotNull PropkitConfig config) {
		this.className = requireNonNull(className);
		this.config = requireNonNull(config);
	}

	public String className() {
		return className;
	}

	public PropkitConfig config() {
		return config;
	}

	public boolean contains(String name) {
		return members.containsKey(name);
	}

	public @Nullable Object get(String name) {
		return members.get(name);
	}

	/**
	 * @throws ConfigurationException if the member exists but is not a {@code type}
	 */
	public <T> @Nullable T get(String name, Class<T> type) {
		Object member = members.get(name);
		if (member == null || type.isInstance(member)) {
			return type.cast(member);
		}
		throw new ConfigurationException("Member \"" + name + "\" of " + className + " is a " + member.getClass().getSimpleName() + ", not a " + type.getSimpleName());
	}

	/**
	 * @return the previous member with that name, or null
	 */
	public @Nullable Object put(String name, Object member) {
		return members.put(requireNonNull(name), requireNonNull(member));
	}

	public @Nullable Object remove(String name) {
		return members.remove(name);
	}

	public Set<String> names() {
		return unmodifiableSet(members.keySet());
	}

	public ClassNamespace listener(String name, ChangeListener listener) {
		put(name, listener);
		return this;
	}

	public ClassNamespace initializer(Initializer initializer) {
		put(INITIALIZER, initializer);
		return this;
	}

	/**
	 * Appends slots that are not backed by any property, such as
	 * {@link PropkitConfig#argsSlot()}, to the storage layout.
	 * Creates a mutable layout if there is none yet.
	 */
	public ClassNamespace declareSlots(String... slots) {
		StorageLayout.merge(this, asList(slots));
		return this;
	}

	Map<String, Object> members() {
		return members;
	}

	@Override
	public String toString() {
		return "ClassNamespace(" + className + ", " + members.keySet() + ")";
	}
}
