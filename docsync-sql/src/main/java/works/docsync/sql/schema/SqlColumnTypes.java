package works.docsync.sql.schema;

import org.jooq.DataType;
import org.jooq.Field;
import works.docsync.FieldType;
import works.docsync.storage.ColumnDefinition;

import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.name;
import static org.jooq.impl.SQLDataType.BIGINT;
import static org.jooq.impl.SQLDataType.BOOLEAN;
import static org.jooq.impl.SQLDataType.CLOB;
import static org.jooq.impl.SQLDataType.DOUBLE;
import static org.jooq.impl.SQLDataType.LOCALDATE;
import static org.jooq.impl.SQLDataType.LOCALDATETIME;
import static org.jooq.impl.SQLDataType.LOCALTIME;
import static org.jooq.impl.SQLDataType.VARCHAR;

/**
 * Maps {@link FieldType}s onto SQL column types.
 * <p>
 * {@code json} and {@code list:reference} values are stored as JSON text;
 * references are plain {@code BIGINT}s without a foreign-key constraint,
 * since a document may refer to a row that is synced later, or never.
 */
public final class SqlColumnTypes {
	private SqlColumnTypes() {}

	public static DataType<?> dataType(FieldType type, int varcharLength) {
		switch (type.kind()) {
			case STRING: return VARCHAR(varcharLength);
			case INTEGER:
			case REFERENCE:
				return BIGINT;
			case DOUBLE: return DOUBLE;
			case BOOLEAN: return BOOLEAN;
			case DATE: return LOCALDATE;
			case TIME: return LOCALTIME;
			case DATETIME: return LOCALDATETIME;
			case JSON:
			case LIST_REFERENCE:
				return CLOB;
			default: throw new AssertionError("Unexpected field type: " + type);
		}
	}

	public static Field<?> columnField(ColumnDefinition column, int varcharLength) {
		DataType<?> dataType = dataType(column.type(), varcharLength);
		return field(name(column.name()), dataType.nullable(!column.notNull()));
	}
}
