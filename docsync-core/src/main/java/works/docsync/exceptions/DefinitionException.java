package works.docsync.exceptions;

/**
 * Thrown while types and fields are being defined, when the definition
 * can't be honoured: an unrecognized field type, a duplicate field or type name,
 * or an unknown configuration option.
 * <p>
 * These are configuration mistakes, so they are normally fatal at startup.
 */
public class DefinitionException extends RuntimeException {
	public DefinitionException(String message) {
		super(message);
	}

	public DefinitionException(String message, Throwable cause) {
		super(message, cause);
	}
}
