package works.docsync.sql;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import works.docsync.ValueKind;
import works.docsync.exceptions.StorageException;
import works.docsync.jackson.StructuredValueCodec;
import works.docsync.storage.ColumnDefinition;

/**
 * Converts column values between the Java types the sync engine works with
 * and the types bound to JDBC.
 */
class SqlValueConverter {
	private final StructuredValueCodec codec;

	SqlValueConverter(StructuredValueCodec codec) {
		this.codec = codec;
	}

	Object toDatabase(String table, ColumnDefinition column, Object value) {
		if (value == null) {
			return null;
		}
		switch (column.type().kind()) {
			case STRING:
				if (value instanceof CharSequence) {
					return value.toString();
				} else if (ValueKind.of(value) == ValueKind.STRUCTURED) {
					return codec.encode(value);
				} else {
					return String.valueOf(value);
				}
			case INTEGER:
			case REFERENCE:
				return toLong(table, column, value);
			case DOUBLE:
				if (value instanceof Number) {
					return ((Number) value).doubleValue();
				}
				break;
			case BOOLEAN:
				if (value instanceof Boolean) {
					return value;
				}
				break;
			case JSON:
				return codec.encode(value);
			case LIST_REFERENCE:
				if (value instanceof Collection) {
					List<Long> ids = new ArrayList<>();
					for (Object element: (Collection<?>) value) {
						ids.add(element == null ? null : toLong(table, column, element));
					}
					return codec.encode(ids);
				}
				break;
			case DATE:
			case TIME:
			case DATETIME:
				if (value instanceof TemporalAccessor) {
					return toTemporal(table, column, (TemporalAccessor) value);
				}
				break;
		}
		throw cantHold(table, column, value);
	}

	Object fromDatabase(ColumnDefinition column, Object raw) {
		if (raw == null) {
			return null;
		}
		switch (column.type().kind()) {
			case INTEGER:
			case REFERENCE:
				return ((Number) raw).longValue();
			case DOUBLE:
				return ((Number) raw).doubleValue();
			case JSON:
				return codec.decode(raw.toString());
			case LIST_REFERENCE:
				return codec.decodeIdentifiers(raw.toString());
			default:
				return raw;
		}
	}

	Long toLong(String table, ColumnDefinition column, Object value) {
		if (value == null) {
			return null;
		} else if (ValueKind.isIntegral(value)) {
			if (value instanceof BigInteger) {
				try {
					return ((BigInteger) value).longValueExact();
				} catch (ArithmeticException e) {
					throw cantHold(table, column, value);
				}
			}
			return ((Number) value).longValue();
		} else if (value instanceof BigDecimal || value instanceof Double || value instanceof Float) {
			double d = ((Number) value).doubleValue();
			if (d == Math.rint(d)) {
				return (long) d;
			}
		} else if (value instanceof String) {
			try {
				return Long.parseLong(((String) value).trim());
			} catch (NumberFormatException e) {
				throw new StorageException("Column " + table + "." + column.name() + " can't hold \"" + value + "\"", e);
			}
		}
		throw cantHold(table, column, value);
	}

	private static Object toTemporal(String table, ColumnDefinition column, TemporalAccessor value) {
		try {
			switch (column.type().kind()) {
				case DATE: return LocalDate.from(value);
				case TIME: return LocalTime.from(value);
				default: return LocalDateTime.from(value);
			}
		} catch (DateTimeException e) {
			throw new StorageException("Column " + table + "." + column.name() + " can't hold " + value, e);
		}
	}

	private static StorageException cantHold(String table, ColumnDefinition column, Object value) {
		return new StorageException("Column " + table + "." + column.name()
			+ " of type " + column.type() + " can't hold " + value.getClass().getSimpleName() + " " + value);
	}
}
