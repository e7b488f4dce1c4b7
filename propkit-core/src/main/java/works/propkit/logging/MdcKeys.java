package works.propkit.logging;

/**
 * Keys this library sets in the SLF4J {@link org.slf4j.MDC MDC}.
 */
public final class MdcKeys {
	private MdcKeys() { }

	/**
	 * The name of the {@link works.propkit.ManagedClass ManagedClass} being defined.
	 */
	public static final String MANAGED_CLASS = "propkit.class";
}
