package works.propkit;

import org.jetbrains.annotations.Nullable;

/**
 * Everything declared about one property. Immutable.
 *
 * @param slot the storage slot backing the property
 * @param name the public name under which the accessors are installed
 * @param listener name of the {@link ChangeListener} to call on change, or null
 * @param autoDirty the effective auto-dirty setting, combining the builder's and the property's own
 * @param doc documentation, or null
 */
public record FieldDefinition(
	String slot,
	String name,
	DefaultProvider<?> defaultProvider,
	boolean readOnly,
	@Nullable String listener,
	boolean autoDirty,
	@Nullable String doc
) { }
