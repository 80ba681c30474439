/**
 * Exceptions that can reach the user of {@link works.docsync.TypeRegistry}
 * and {@link works.docsync.TypeDefinition}.
 * <p>
 * All of them are unchecked.
 */
package works.docsync.exceptions;
