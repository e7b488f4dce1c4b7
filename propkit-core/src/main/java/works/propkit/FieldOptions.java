package works.propkit;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

/**
 * Per-property options accepted by {@link PropertyBuilder#prop}.
 */
@Value
@Builder(toBuilder = true)
public class FieldOptions {
	/**
	 * No setter is generated; the slot can still be filled directly,
	 * typically by a {@link FieldCopier} at construction time.
	 */
	@Default boolean readOnly = false;

	/**
	 * Name of a {@link ChangeListener} member of the class to call after the value changes.
	 */
	@Default String listener = null;

	/**
	 * Like {@link #listener}, but uses {@link PropkitConfig#genericListener()}.
	 * Ignored when {@link #listener} is set.
	 */
	@Default boolean observed = false;

	/**
	 * Set the class's dirty flag whenever this property changes.
	 * The builder's own auto-dirty setting applies regardless.
	 */
	@Default boolean autoDirty = false;

	@Default String doc = null;

	public static FieldOptions defaults() {
		return DEFAULTS;
	}

	/**
	 * @return the listener name these options ask for, or null if none
	 */
	String listenerName(PropkitConfig config) {
		if (listener != null) {
			return listener;
		} else if (observed) {
			return config.genericListener();
		} else {
			return null;
		}
	}

	private static final FieldOptions DEFAULTS = FieldOptions.builder().build();
}
