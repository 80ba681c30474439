/**
 * The storage engine interface and the implementations that need no external store.
 * <p>
 * Implementations backed by a real database live in separate modules (e.g., SQL).
 */
package works.docsync.storage;
