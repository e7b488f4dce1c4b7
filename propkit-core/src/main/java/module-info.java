/**
 * Declarative managed properties for classes defined at runtime.
 * <p>
 * Start with {@link works.propkit.ManagedClass} and {@link works.propkit.PropertyBuilder}.
 * Additional packages provide annotations for declaring properties from methods
 * ({@link works.propkit.annotations}), exceptions ({@link works.propkit.exceptions}),
 * and logging support ({@link works.propkit.logging}).
 */
module works.propkit.core {
	requires transitive org.jetbrains.annotations;
	requires org.objectweb.asm;
	requires org.pcollections;
	requires org.slf4j;

	requires static lombok;

	exports works.propkit;
	exports works.propkit.annotations;
	exports works.propkit.exceptions;
	exports works.propkit.logging;
}
