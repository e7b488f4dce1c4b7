package works.propkit;

import static java.util.Objects.requireNonNull;

/**
 * Naming conventions and policies shared by everything that takes part in
 * defining a {@link ManagedClass}: the {@link PropertyBuilder}, the {@link FieldCopier},
 * and the class itself.
 */
public final class PropkitConfig {
	private final String slotPrefix;
	private final String dirtySlot;
	private final String argsSlot;
	private final String selfParameter;
	private final String genericListener;
	private final DuplicateSlotPolicy duplicateSlotPolicy;

	/**
	 * What to do when the same storage slot is declared twice for one class.
	 */
	public enum DuplicateSlotPolicy {
		/**
		 * Throw {@link works.propkit.exceptions.ConfigurationException ConfigurationException}.
		 */
		REJECT,

		/**
		 * Keep concatenating; the slot is allocated once and both declarations share it.
		 */
		ACCEPT,
	}

	private PropkitConfig(Builder b) {
		this.slotPrefix = b.slotPrefix;
		this.dirtySlot = b.dirtySlot;
		this.argsSlot = b.argsSlot;
		this.selfParameter = b.selfParameter;
		this.genericListener = b.genericListener;
		this.duplicateSlotPolicy = b.duplicateSlotPolicy;
	}

	public static PropkitConfig defaults() {
		return DEFAULTS;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @return the storage slot backing the property with the given public name
	 */
	public String slotFor(String propertyName) {
		return slotPrefix + propertyName;
	}

	public String slotPrefix() {
		return slotPrefix;
	}

	/**
	 * @return the reserved slot set to {@code true} when an auto-dirty property changes
	 */
	public String dirtySlot() {
		return dirtySlot;
	}

	/**
	 * @return the reserved slot in which {@link FieldCopier} saves constructor arguments
	 */
	public String argsSlot() {
		return argsSlot;
	}

	/**
	 * @return the argument name {@link FieldCopier} skips because it denotes the instance itself
	 */
	public String selfParameter() {
		return selfParameter;
	}

	/**
	 * @return the listener name used for properties declared with {@link FieldOptions#isObserved() observed} set
	 */
	public String genericListener() {
		return genericListener;
	}

	public DuplicateSlotPolicy duplicateSlotPolicy() {
		return duplicateSlotPolicy;
	}

	@Override
	public String toString() {
		return "PropkitConfig(slotPrefix=" + slotPrefix
			+ ", dirtySlot=" + dirtySlot
			+ ", argsSlot=" + argsSlot
			+ ", selfParameter=" + selfParameter
			+ ", genericListener=" + genericListener
			+ ", duplicateSlotPolicy=" + duplicateSlotPolicy + ")";
	}

	public static class Builder {
		private String slotPrefix = "_";
		private String dirtySlot = "_dirty";
		private String argsSlot = "_args";
		private String selfParameter = "self";
		private String genericListener = "onPropertyChanged";
		private DuplicateSlotPolicy duplicateSlotPolicy = DuplicateSlotPolicy.REJECT;

		Builder() { }

		public Builder slotPrefix(String slotPrefix) {
			this.slotPrefix = requireNonNull(slotPrefix);
			return this;
		}

		public Builder dirtySlot(String dirtySlot) {
			this.dirtySlot = requireNonNull(dirtySlot);
			return this;
		}

		public Builder argsSlot(String argsSlot) {
			this.argsSlot = requireNonNull(argsSlot);
			return this;
		}

		public Builder selfParameter(String selfParameter) {
			this.selfParameter = requireNonNull(selfParameter);
			return this;
		}

		public Builder genericListener(String genericListener) {
			this.genericListener = requireNonNull(genericListener);
			return this;
		}

		public Builder duplicateSlotPolicy(DuplicateSlotPolicy duplicateSlotPolicy) {
			this.duplicateSlotPolicy = requireNonNull(duplicateSlotPolicy);
			return this;
		}

		public PropkitConfig build() {
			return new PropkitConfig(this);
		}

		@Override
		public String toString() {
			return "PropkitConfig.Builder(slotPrefix=" + slotPrefix + ", duplicateSlotPolicy=" + duplicateSlotPolicy + ")";
		}
	}

	private static final PropkitConfig DEFAULTS = new Builder().build();
}
