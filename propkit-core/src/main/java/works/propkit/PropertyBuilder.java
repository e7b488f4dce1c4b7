package works.propkit;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.propkit.exceptions.ConfigurationException;
import works.propkit.exceptions.UsageException;

import static java.util.Objects.requireNonNull;
import static works.propkit.ClassNamespace.STORAGE_LAYOUT;
import static works.propkit.PropkitConfig.DuplicateSlotPolicy.REJECT;

/**
 * Declares {@link ManagedProperty properties} in a {@link ClassNamespace}.
 * <p>
 * Meant to be used with try-with-resources inside a {@link ClassBody}:
 *
 * <pre>{@code
 * ManagedClass car = ManagedClass.define("Car", ns -> {
 *     try (var props = PropertyBuilder.open(ns, "props")) {
 *         props.prop("speed", self -> 0, FieldOptions.builder().listener("onSpeed").build());
 *     }
 *     ns.listener("onSpeed", (self, slot, oldValue, newValue) -> ...);
 * });
 * }</pre>
 *
 * While open, the builder is bound in the namespace under its alias, and each
 * {@link #prop} call installs a property and records its slot in a manifest.
 * {@link #close()} merges the manifest into the namespace's storage layout
 * (see {@link StorageLayout}), unbinds the alias, and drops the builder's references.
 * A builder can be opened only once; after closing, every method except {@code close} throws
 * {@link UsageException}.
 */
public final class PropertyBuilder implements AutoCloseable {
	private final String alias;
	private final boolean autoDirty;
	private ClassNamespace namespace;
	private List<String> manifest;
	private State state = State.NEW;

	private enum State { NEW, OPEN, CLOSED }

	public PropertyBuilder(ClassNamespace namespace, String alias) {
		this(namespace, alias, false);
	}

	/**
	 * @param autoDirty whether every property declared here is auto-dirty,
	 *                  in addition to those that ask for it individually
	 */
	public PropertyBuilder(ClassNamespace namespace, String alias, boolean autoDirty) {
		this.namespace = requireNonNull(namespace);
		this.alias = requireNonNull(alias);
		this.autoDirty = autoDirty;
	}

	public static PropertyBuilder open(ClassNamespace namespace, String alias) {
		return new PropertyBuilder(namespace, alias).enter();
	}

	public static PropertyBuilder open(ClassNamespace namespace, String alias, boolean autoDirty) {
		return new PropertyBuilder(namespace, alias, autoDirty).enter();
	}

	/**
	 * Starts the declaration scope.
	 *
	 * @return this
	 * @throws UsageException if this builder was already entered,
	 * or if its alias is already bound in the namespace
	 */
	public PropertyBuilder enter() {
		if (state != State.NEW) {
			throw new UsageException("PropertyBuilder \"" + alias + "\" cannot be entered twice");
		}
		if (namespace.contains(alias)) {
			throw new UsageException("Cannot bind PropertyBuilder as \"" + alias + "\" in " + namespace.className() + ": name is already in use");
		}
		namespace.put(alias, this);
		manifest = new ArrayList<>();
		state = State.OPEN;
		return this;
	}

	public ManagedProperty prop(String name, DefaultProvider<?> defaultProvider) {
		return prop(name, defaultProvider, FieldOptions.defaults());
	}

	public ManagedProperty prop(String name, Supplier<?> defaultValue, FieldOptions options) {
		requireNonNull(defaultValue);
		return prop(name, self -> defaultValue.get(), options);
	}

	/**
	 * Declares a property and installs its accessors in the namespace under {@code name},
	 * replacing whatever was there.
	 *
	 * @param defaultProvider computes the value reported while the property is unassigned
	 * @throws ConfigurationException if the options ask for a read-only property with a listener,
	 * if the property's slot was already declared through this builder,
	 * or if the slot is the reserved dirty or arguments slot
	 * @throws UsageException if the builder is not open
	 */
	public ManagedProperty prop(String name, DefaultProvider<?> defaultProvider, FieldOptions options) {
		requireOpen("declare property \"" + name + "\"");
		requireNonNull(defaultProvider);
		PropkitConfig config = namespace.config();
		String listener = options.listenerName(config);
		if (options.isReadOnly() && listener != null) {
			throw new ConfigurationException("Property " + namespace.className() + "." + name + " is read-only, so it cannot have listener \"" + listener + "\"");
		}

		String slot = config.slotFor(name);
		if (slot.equals(config.dirtySlot()) || slot.equals(config.argsSlot())) {
			throw new ConfigurationException("Property " + namespace.className() + "." + name + " would use reserved slot \"" + slot + "\"");
		}
		if (manifest.contains(slot) && config.duplicateSlotPolicy() == REJECT) {
			throw new ConfigurationException("Property " + namespace.className() + "." + name + " is declared more than once");
		}

		boolean effectiveAutoDirty = this.autoDirty || options.isAutoDirty();
		if (effectiveAutoDirty && !manifest.contains(config.dirtySlot()) && !layoutDeclares(config.dirtySlot())) {
			manifest.add(config.dirtySlot());
		}
		manifest.add(slot);

		FieldDefinition definition = new FieldDefinition(
			slot,
			name,
			defaultProvider,
			options.isReadOnly(),
			listener,
			effectiveAutoDirty,
			options.getDoc());
		ManagedProperty property = ManagedProperty.of(definition, config.dirtySlot());
		namespace.put(name, property);
		LOGGER.debug("Declared {} in {} with slot \"{}\"", property, namespace.className(), slot);
		return property;
	}

	/**
	 * @return a copy of the slots declared so far, in declaration order
	 */
	public List<String> manifest() {
		requireOpen("read the manifest");
		return List.copyOf(manifest);
	}

	ClassNamespace namespace() {
		requireOpen("access the namespace");
		return namespace;
	}

	public boolean isOpen() {
		return state == State.OPEN;
	}

	/**
	 * Ends the declaration scope. Runs to completion even when the manifest
	 * cannot be merged: the alias is unbound and the builder is closed
	 * before the {@link ConfigurationException} propagates.
	 * Closing a closed builder does nothing.
	 *
	 * @throws UsageException if the builder was never entered
	 */
	@Override
	public void close() {
		if (state == State.CLOSED) {
			return;
		} else if (state == State.NEW) {
			throw new UsageException("PropertyBuilder \"" + alias + "\" was never entered");
		}
		ClassNamespace ns = this.namespace;
		List<String> declared = this.manifest;
		this.namespace = null;
		this.manifest = null;
		state = State.CLOSED;
		try {
			StorageLayout.merge(ns, declared);
		} finally {
			ns.remove(alias);
		}
		if (declared.isEmpty()) {
			LOGGER.warn("PropertyBuilder \"{}\" declared no properties in {}; may be misconfigured", alias, ns.className());
		} else {
			LOGGER.debug("PropertyBuilder \"{}\" added {} slot{} to {}", alias, declared.size(), (declared.size() >= 2) ? "s" : "", ns.className());
		}
	}

	/**
	 * True if an earlier builder (or {@link ClassNamespace#declareSlots}) already put {@code slot} in the layout.
	 */
	private boolean layoutDeclares(String slot) {
		return namespace.get(STORAGE_LAYOUT) instanceof List<?> layout && layout.contains(slot);
	}

	private void requireOpen(String action) {
		if (state != State.OPEN) {
			throw new UsageException("Cannot " + action + ": PropertyBuilder \"" + alias + "\" is " + state.name().toLowerCase());
		}
	}

	@Override
	public String toString() {
		return "PropertyBuilder(" + alias + ", " + state + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(PropertyBuilder.class);
}
