/**
 * Exceptions that can reach the user of {@link works.propkit.PropertyBuilder}
 * and {@link works.propkit.ManagedClass}.
 * <p>
 * All of them are unchecked: they report programming errors, not transient failures,
 * so there is nothing for a caller to retry.
 */
package works.propkit.exceptions;
