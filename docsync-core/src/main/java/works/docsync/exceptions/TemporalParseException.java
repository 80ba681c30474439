package works.docsync.exceptions;

public class TemporalParseException extends RuntimeException {
	private final String typeName;
	private final String fieldname;
	private final Object rawValue;

	public String typeName() {
		return this.typeName;
	}

	public String fieldname() {
		return this.fieldname;
	}

	public Object rawValue() {
		return this.rawValue;
	}

	public TemporalParseException(String typeName, String fieldname, Object rawValue, String message) {
		super(fullMessage(typeName, fieldname, rawValue, message));
		this.typeName = typeName;
		this.fieldname = fieldname;
		this.rawValue = rawValue;
	}

	public TemporalParseException(String typeName, String fieldname, Object rawValue, String message, Throwable cause) {
		super(fullMessage(typeName, fieldname, rawValue, message), cause);
		this.typeName = typeName;
		this.fieldname = fieldname;
		this.rawValue = rawValue;
	}

	private static String fullMessage(String typeName, String fieldname, Object rawValue, String message) {
		return "Unable to parse " + typeName + "." + fieldname + " value \"" + rawValue + "\": " + message;
	}
}
