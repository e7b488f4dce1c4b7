package works.propkit;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.propkit.annotations.OnChange;
import works.propkit.annotations.Prop;
import works.propkit.exceptions.ConfigurationException;
import works.propkit.exceptions.ListenerException;

import static java.lang.reflect.Modifier.isPrivate;
import static java.lang.reflect.Modifier.isStatic;
import static works.propkit.util.ReflectionHelpers.getDeclaredMethodsInOrder;

/**
 * Finds methods annotated with {@link Prop} and {@link OnChange} in the given
 * {@code definitions} object, declaring a property through the given {@link PropertyBuilder}
 * for each of the former and registering a {@link ChangeListener} for each of the latter.
 * <p>
 * Superclass methods come first; within a class, methods are processed in declaration order,
 * so the storage layout follows the source.
 */
public final class PropertyScanner {
	private PropertyScanner() { }

	/**
	 * @param lookup must be able to access {@code definitions}' class and its annotated methods
	 * @throws ConfigurationException if an annotated method is static, private, or has an unsupported signature
	 */
	public static void declareAll(Object definitions, PropertyBuilder builder, MethodHandles.Lookup lookup) {
		ClassNamespace namespace = builder.namespace();
		List<Class<?>> classes = new ArrayList<>();
		for (
			Class<?> c = definitions.getClass();
			c != null && c != Object.class;
			c = c.getSuperclass()
		) {
			classes.add(0, c);
		}

		int propertyCounter = 0;
		int listenerCounter = 0;
		for (Class<?> definitionClass : classes) {
			for (Method method : getDeclaredMethodsInOrder(definitionClass, lookup)) {
				Prop prop = method.getAnnotation(Prop.class);
				boolean isListener = method.isAnnotationPresent(OnChange.class);
				if (prop == null && !isListener) {
					continue;
				}
				if (prop != null && isListener) {
					throw new ConfigurationException("Method cannot be both @Prop and @OnChange: " + method);
				} else if (isStatic(method.getModifiers())) {
					throw new ConfigurationException("Annotated method cannot be static: " + method);
				} else if (isPrivate(method.getModifiers())) {
					throw new ConfigurationException("Annotated method cannot be private: " + method);
				}

				MethodHandle handle = unreflect(method, lookup).bindTo(definitions);
				if (prop != null) {
					builder.prop(method.getName(), defaultProviderFor(method, handle), optionsFrom(prop));
					propertyCounter++;
				} else {
					namespace.listener(method.getName(), listenerFor(method, handle));
					listenerCounter++;
				}
			}
		}

		String definitionsName = definitions.getClass().getSimpleName();
		if (propertyCounter == 0) {
			LOGGER.warn("Found no @Prop methods in {}; may be misconfigured", definitionsName);
		} else {
			LOGGER.info("Declared {} propert{} and {} listener{} from {}",
				propertyCounter, (propertyCounter == 1) ? "y" : "ies",
				listenerCounter, (listenerCounter == 1) ? "" : "s",
				definitionsName);
		}
	}

	private static FieldOptions optionsFrom(Prop prop) {
		return FieldOptions.builder()
			.readOnly(prop.readOnly())
			.listener(prop.listener().isEmpty() ? null : prop.listener())
			.observed(prop.observed())
			.autoDirty(prop.autoDirty())
			.doc(prop.doc().isEmpty() ? null : prop.doc())
			.build();
	}

	private static DefaultProvider<?> defaultProviderFor(Method method, MethodHandle handle) {
		Class<?>[] parameterTypes = method.getParameterTypes();
		if (parameterTypes.length == 0) {
			return self -> invoke(method, handle);
		} else if (parameterTypes.length == 1 && parameterTypes[0] == ManagedObject.class) {
			return self -> invoke(method, handle, self);
		} else {
			throw new ConfigurationException("@Prop method must take no parameters or one ManagedObject: " + method);
		}
	}

	private static ChangeListener listenerFor(Method method, MethodHandle handle) {
		Class<?>[] p = method.getParameterTypes();
		boolean changeParameters = p.length >= 3
			&& p[p.length - 3] == String.class
			&& p[p.length - 2] == Object.class
			&& p[p.length - 1] == Object.class;
		if (changeParameters && p.length == 3) {
			return (self, slot, oldValue, newValue) -> invoke(method, handle, slot, oldValue, newValue);
		} else if (changeParameters && p.length == 4 && p[0] == ManagedObject.class) {
			return (self, slot, oldValue, newValue) -> invoke(method, handle, self, slot, oldValue, newValue);
		} else {
			throw new ConfigurationException("@OnChange method must take ([ManagedObject,] String, Object, Object): " + method);
		}
	}

	private static MethodHandle unreflect(Method method, MethodHandles.Lookup lookup) {
		try {
			return lookup.unreflect(method);
		} catch (IllegalAccessException e) {
			throw new IllegalArgumentException(e);
		}
	}

	private static Object invoke(Method method, MethodHandle handle, Object... arguments) {
		try {
			return handle.invokeWithArguments(arguments);
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new ListenerException("Unable to call \"" + method.getName() + "\"", e);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(PropertyScanner.class);
}
