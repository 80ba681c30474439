package works.docsync.exceptions;

import java.util.NoSuchElementException;

/**
 * Thrown when a type name, either looked up directly or named by a
 * {@code reference} field, is not registered.
 */
public class UnknownTypeException extends NoSuchElementException {
	private final String typeName;

	public String typeName() {
		return typeName;
	}

	public UnknownTypeException(String typeName) {
		super("No type named \"" + typeName + "\"");
		this.typeName = typeName;
	}

	public UnknownTypeException(String typeName, String message) {
		super(message);
		this.typeName = typeName;
	}
}
