/**
 * The primary propkit APIs.
 * <p>
 * A {@link works.propkit.ManagedClass} is defined by a {@link works.propkit.ClassBody}
 * that fills a {@link works.propkit.ClassNamespace}, usually by declaring properties through a
 * {@link works.propkit.PropertyBuilder}. Each instance is a {@link works.propkit.ManagedObject}
 * whose {@link works.propkit.InstanceStorage storage} holds exactly the slots of the class's
 * {@link works.propkit.StorageLayout}.
 */
package works.propkit;
