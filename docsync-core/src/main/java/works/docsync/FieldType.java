package works.docsync;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;
import works.docsync.exceptions.DefinitionException;

import static java.util.Objects.requireNonNull;

/**
 * The storage type of a field, parsed from the type-string vocabulary:
 * {@code string}, {@code integer}, {@code double}, {@code boolean}, {@code json},
 * {@code date}, {@code time}, {@code datetime},
 * {@code reference <Target>} and {@code list:reference <Target>}.
 * <p>
 * For the two reference kinds, {@link #target} names a type when the
 * {@code FieldType} belongs to a {@link FieldDescriptor}, and a table
 * when it belongs to a {@link works.docsync.storage.ColumnDefinition}.
 */
public record FieldType(Kind kind, @Nullable String target) {
	public enum Kind {
		STRING("string"),
		INTEGER("integer"),
		DOUBLE("double"),
		BOOLEAN("boolean"),
		JSON("json"),
		DATE("date"),
		TIME("time"),
		DATETIME("datetime"),
		REFERENCE("reference"),
		LIST_REFERENCE("list:reference");

		private final String keyword;

		Kind(String keyword) {
			this.keyword = keyword;
		}

		public String keyword() {
			return keyword;
		}
	}

	public static final FieldType STRING = new FieldType(Kind.STRING, null);
	public static final FieldType INTEGER = new FieldType(Kind.INTEGER, null);
	public static final FieldType DOUBLE = new FieldType(Kind.DOUBLE, null);
	public static final FieldType BOOLEAN = new FieldType(Kind.BOOLEAN, null);
	public static final FieldType JSON = new FieldType(Kind.JSON, null);
	public static final FieldType DATE = new FieldType(Kind.DATE, null);
	public static final FieldType TIME = new FieldType(Kind.TIME, null);
	public static final FieldType DATETIME = new FieldType(Kind.DATETIME, null);

	public FieldType {
		requireNonNull(kind);
		if (kind == Kind.REFERENCE || kind == Kind.LIST_REFERENCE) {
			if (target == null || !TARGET_NAME.matcher(target).matches()) {
				throw new DefinitionException("Invalid " + kind.keyword() + " target: \"" + target + "\"");
			}
		} else if (target != null) {
			throw new DefinitionException("Type " + kind.keyword() + " can't have a target");
		}
	}

	public static FieldType reference(String target) {
		return new FieldType(Kind.REFERENCE, target);
	}

	public static FieldType listReference(String target) {
		return new FieldType(Kind.LIST_REFERENCE, target);
	}

	/**
	 * @throws DefinitionException if <code>typeString</code> is not in the vocabulary
	 */
	public static FieldType parse(String typeString) {
		if (typeString == null) {
			throw new DefinitionException("Field type can't be null");
		}
		Matcher m = REFERENCE_PATTERN.matcher(typeString);
		if (m.matches()) {
			Kind kind = m.group(1).equals("reference") ? Kind.REFERENCE : Kind.LIST_REFERENCE;
			return new FieldType(kind, m.group(2));
		}
		switch (typeString.toLowerCase(Locale.ROOT)) {
			case "string": return STRING;
			case "integer": return INTEGER;
			case "double": return DOUBLE;
			case "boolean": return BOOLEAN;
			case "json": return JSON;
			case "date": return DATE;
			case "time": return TIME;
			case "datetime": return DATETIME;
			default: throw new DefinitionException("Unrecognized field type \"" + typeString + "\"");
		}
	}

	public boolean isTemporal() {
		return kind == Kind.DATE || kind == Kind.TIME || kind == Kind.DATETIME;
	}

	public boolean isReference() {
		return kind == Kind.REFERENCE;
	}

	public boolean isListReference() {
		return kind == Kind.LIST_REFERENCE;
	}

	/**
	 * @return this type with its reference target swapped for <code>newTarget</code>;
	 * non-reference types are returned unchanged.
	 */
	public FieldType withTarget(String newTarget) {
		if (target == null) {
			return this;
		}
		return new FieldType(kind, newTarget);
	}

	@Override
	public String toString() {
		if (target == null) {
			return kind.keyword();
		} else {
			return kind.keyword() + " " + target;
		}
	}

	private static final Pattern REFERENCE_PATTERN = Pattern.compile("^(reference|list:reference) (\\w+)$");
	private static final Pattern TARGET_NAME = Pattern.compile("\\S+");
}
