package works.propkit.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Marks a method as the default provider of a managed property.
 * The method's name becomes the property's name, and it is called
 * to compute the property's value whenever the property is unassigned.
 * <p>
 * The method may take no parameters, or a single {@link works.propkit.ManagedObject ManagedObject}
 * to receive the instance being read.
 *
 * @see works.propkit.PropertyScanner
 * @see works.propkit.FieldOptions
 */
@Retention(RUNTIME)
@Target(METHOD)
public @interface Prop {
	boolean readOnly() default false;

	/**
	 * Name of the listener to call on change; empty means none.
	 */
	String listener() default "";

	boolean observed() default false;

	boolean autoDirty() default false;

	String doc() default "";
}
