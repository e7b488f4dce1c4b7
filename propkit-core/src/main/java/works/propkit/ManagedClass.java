package works.propkit;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import works.propkit.exceptions.ConfigurationException;
import works.propkit.exceptions.UsageException;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;
import static works.propkit.ClassNamespace.INITIALIZER;
import static works.propkit.ClassNamespace.STORAGE_LAYOUT;
import static works.propkit.logging.MdcKeys.MANAGED_CLASS;

/**
 * A class whose instances hold exactly the slots of a {@link StorageLayout}
 * and expose {@link ManagedProperty managed properties}.
 * <p>
 * Created by {@link #define}, which evaluates a {@link ClassBody} against a fresh
 * {@link ClassNamespace} and then freezes what the body put there.
 * Instances come from {@link #newInstance}.
 */
public final class ManagedClass {
	private final String name;
	private final PropkitConfig config;
	private final StorageLayout layout;
	private final Map<String, ManagedProperty> properties;
	private final Map<String, ChangeListener> listeners;
	private final Initializer initializer;

	private ManagedClass(String name, PropkitConfig config, StorageLayout layout, Map<String, ManagedProperty> properties, Map<String, ChangeListener> listeners, Initializer initializer) {
		this.name = name;
		this.config = config;
		this.layout = layout;
		this.properties = unmodifiableMap(properties);
		this.listeners = unmodifiableMap(listeners);
		this.initializer = initializer;
	}

	public static ManagedClass define(String name, ClassBody body) {
		return define(name, PropkitConfig.defaults(), body);
	}

	/**
	 * @throws ConfigurationException if the body declares something inconsistent,
	 * or throws a checked exception (which becomes the cause)
	 * @throws UsageException if the body leaves a {@link PropertyBuilder} open
	 */
	public static ManagedClass define(String name, PropkitConfig config, ClassBody body) {
		requireNonNull(body);
		ClassNamespace namespace = new ClassNamespace(name, config);
		String outerClass = MDC.get(MANAGED_CLASS);
		MDC.put(MANAGED_CLASS, name);
		try {
			try {
				body.evaluate(namespace);
			} catch (RuntimeException e) {
				throw e;
			} catch (Exception e) {
				throw new ConfigurationException("Unable to evaluate body of " + name + ": " + e.getMessage(), e);
			}
			ManagedClass result = fromNamespace(namespace);
			LOGGER.debug("Defined {} with {} propert{} and layout {}", name, result.properties.size(), (result.properties.size() == 1) ? "y" : "ies", result.layout.slots());
			return result;
		} finally {
			restoreMDC(outerClass);
		}
	}

	/**
	 * A class defined inside another class's body hands the MDC back to the outer class.
	 */
	private static void restoreMDC(String outerClass) {
		if (outerClass == null) {
			MDC.remove(MANAGED_CLASS);
		} else {
			MDC.put(MANAGED_CLASS, outerClass);
		}
	}

	private static ManagedClass fromNamespace(ClassNamespace namespace) {
		String name = namespace.className();
		StorageLayout layout = StorageLayout.of(name, namespace.get(STORAGE_LAYOUT), namespace.config());
		Map<String, ManagedProperty> properties = new LinkedHashMap<>();
		Map<String, ChangeListener> listeners = new LinkedHashMap<>();
		Initializer initializer = null;
		for (Map.Entry<String, Object> entry : namespace.members().entrySet()) {
			Object member = entry.getValue();
			if (member instanceof PropertyBuilder) {
				throw new UsageException("PropertyBuilder \"" + entry.getKey() + "\" was not closed before " + name + " was defined");
			} else if (member instanceof ManagedProperty p) {
				properties.put(entry.getKey(), p);
			} else if (member instanceof ChangeListener l) {
				listeners.put(entry.getKey(), l);
			} else if (INITIALIZER.equals(entry.getKey())) {
				if (member instanceof Initializer i) {
					initializer = i;
				} else {
					throw new ConfigurationException(INITIALIZER + " member of " + name + " is not an Initializer");
				}
			}
		}

		for (ManagedProperty property : properties.values()) {
			FieldDefinition definition = property.definition();
			if (!layout.contains(definition.slot())) {
				throw new ConfigurationException("Property " + name + "." + property.name() + " has no storage slot \"" + definition.slot() + "\"");
			}
			if (definition.autoDirty() && !layout.contains(namespace.config().dirtySlot())) {
				throw new ConfigurationException("Property " + name + "." + property.name() + " is auto-dirty but there is no \"" + namespace.config().dirtySlot() + "\" slot");
			}
			if (definition.listener() != null && !listeners.containsKey(definition.listener())) {
				throw new ConfigurationException("Property " + name + "." + property.name() + " refers to undefined listener \"" + definition.listener() + "\"");
			}
		}
		return new ManagedClass(name, namespace.config(), layout, properties, listeners, initializer);
	}

	public ManagedObject newInstance() {
		return newInstance(Map.of());
	}

	/**
	 * @param arguments passed to the class's {@link Initializer}
	 * @throws UsageException if there are arguments but the class has no initializer
	 */
	public ManagedObject newInstance(Map<String, ?> arguments) {
		ManagedObject result = new ManagedObject(this, new InstanceStorage(name, layout));
		if (initializer != null) {
			initializer.initialize(result, arguments);
		} else if (!arguments.isEmpty()) {
			throw new UsageException(name + " has no initializer to accept arguments " + arguments.keySet());
		}
		return result;
	}

	public String name() {
		return name;
	}

	public PropkitConfig config() {
		return config;
	}

	public StorageLayout layout() {
		return layout;
	}

	public Map<String, ManagedProperty> properties() {
		return properties;
	}

	/**
	 * @return the property with the given public name, or null
	 */
	public ManagedProperty property(String name) {
		return properties.get(name);
	}

	/**
	 * @return the listener registered under {@code name}; never null for a name
	 * some property refers to
	 * @throws ConfigurationException if there is no such listener
	 */
	public ChangeListener listener(String name) {
		ChangeListener result = listeners.get(name);
		if (result == null) {
			throw new ConfigurationException(this.name + " has no listener \"" + name + "\"");
		}
		return result;
	}

	public boolean hasMember(String name) {
		return properties.containsKey(name) || listeners.containsKey(name);
	}

	@Override
	public String toString() {
		return "ManagedClass(" + name + ")";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ManagedClass.class);
}
