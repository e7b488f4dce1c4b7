package works.propkit.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Registers a method as a {@link works.propkit.ChangeListener ChangeListener}
 * under the method's name.
 * <p>
 * Parameters are {@code (String slot, Object oldValue, Object newValue)},
 * optionally preceded by a {@link works.propkit.ManagedObject ManagedObject} receiving the instance.
 *
 * @see works.propkit.PropertyScanner
 */
@Retention(RUNTIME)
@Target(METHOD)
public @interface OnChange {
}
