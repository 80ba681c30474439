package works.docsync.sql.schema;

import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import works.docsync.sql.SqlStorageSettings;

import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.name;
import static org.jooq.impl.DSL.table;
import static org.jooq.impl.SQLDataType.BIGINT;
import static org.jooq.impl.SQLDataType.BOOLEAN;
import static org.jooq.impl.SQLDataType.INTEGER;
import static org.jooq.impl.SQLDataType.VARCHAR;
import static works.docsync.storage.StorageEngine.ID_COLUMN;

/**
 * jOOQ references for the columns metadata table,
 * and for the primary key that every data table shares.
 */
public class Schema {
	public final Table<Record> COLUMNS;
	public final Field<String> TABLE_NAME;
	public final Field<String> COLUMN_NAME;
	public final Field<Integer> POSITION;
	public final Field<String> COLUMN_TYPE;
	public final Field<Boolean> NOT_NULL;

	public final Field<Long> ID = field(name(ID_COLUMN), BIGINT.nullable(false));

	public Schema(SqlStorageSettings settings) {
		COLUMNS = table(name(settings.metadataTable()));
		TABLE_NAME = field(name("table_name"), VARCHAR(settings.varcharLength()).nullable(false));
		COLUMN_NAME = field(name("column_name"), VARCHAR(settings.varcharLength()).nullable(false));
		POSITION = field(name("position"), INTEGER.nullable(false));
		COLUMN_TYPE = field(name("column_type"), VARCHAR(settings.varcharLength()).nullable(false));
		NOT_NULL = field(name("not_null"), BOOLEAN.nullable(false));
	}

	public Table<Record> dataTable(String tableName) {
		return table(name(tableName));
	}
}
