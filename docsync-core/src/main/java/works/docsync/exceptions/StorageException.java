package works.docsync.exceptions;

/**
 * Thrown from {@link works.docsync.storage.StorageEngine} methods
 * when the underlying store fails: lost connectivity, a constraint violation,
 * a value the column can't hold, and so on.
 * <p>
 * Never retried. Writes that completed earlier in the same sync call stay written.
 */
public class StorageException extends RuntimeException {
	public StorageException(String message) {
		super(message);
	}

	public StorageException(String message, Throwable cause) {
		super(message, cause);
	}

	public StorageException(Throwable cause) {
		super(cause);
	}
}
