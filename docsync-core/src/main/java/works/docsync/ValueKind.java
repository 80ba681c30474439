package works.docsync;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;

/**
 * The concrete kinds of value a JSON document can hold, as far as
 * {@link FieldTypeInference} is concerned.
 */
public enum ValueKind {
	INTEGER,
	FLOATING,
	BOOLEAN,

	/**
	 * Mappings and sequences alike.
	 */
	STRUCTURED,

	STRING,

	/**
	 * Anything else an in-memory document might contain, like a {@code LocalDate}
	 * placed there by the caller.
	 */
	OTHER;

	/**
	 * @param value must not be null; null carries no kind
	 */
	public static ValueKind of(Object value) {
		if (value instanceof Boolean) {
			return BOOLEAN;
		} else if (isIntegral(value)) {
			return INTEGER;
		} else if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
			return FLOATING;
		} else if (value instanceof Map || value instanceof Collection || value instanceof Object[]) {
			return STRUCTURED;
		} else if (value instanceof CharSequence) {
			return STRING;
		} else {
			return OTHER;
		}
	}

	/**
	 * True for integral values that fit in a signed 64-bit column.
	 * A wider {@link BigInteger} is {@link #OTHER}.
	 */
	public static boolean isIntegral(Object value) {
		return value instanceof Long
			|| value instanceof Integer
			|| value instanceof Short
			|| value instanceof Byte
			|| (value instanceof BigInteger && ((BigInteger) value).bitLength() < 64);
	}
}
