package works.docsync.sql;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.docsync.FieldType;
import works.docsync.Row;
import works.docsync.exceptions.StorageException;
import works.docsync.jackson.StructuredValueCodec;
import works.docsync.sql.schema.Schema;
import works.docsync.sql.schema.SqlColumnTypes;
import works.docsync.storage.ColumnDefinition;

import static java.util.Objects.requireNonNull;
import static org.jooq.impl.DSL.max;
import static org.jooq.impl.DSL.noCondition;
import static org.jooq.impl.DSL.primaryKey;
import static org.jooq.impl.DSL.selectOne;
import static org.jooq.impl.DSL.using;

class SqlStorageImpl implements SqlStorage {
	private final SqlStorageSettings settings;
	private final ConnectionSource connectionSource;
	private final SqlValueConverter converter;
	private final Schema schema;
	private volatile boolean metadataTableExists = false;

	// jOOQ references
	private final Table<Record> COLUMNS;
	private final Field<String> TABLE_NAME;
	private final Field<String> COLUMN_NAME;
	private final Field<Integer> POSITION;
	private final Field<String> COLUMN_TYPE;
	private final Field<Boolean> NOT_NULL;
	private final Field<Long> ID;

	SqlStorageImpl(SqlStorageSettings settings, ConnectionSource cs, StructuredValueCodec codec) {
		this.settings = requireNonNull(settings);
		this.converter = new SqlValueConverter(requireNonNull(codec));
		this.connectionSource = () -> {
			Connection result = cs.get();
			// Every operation commits explicitly
			result.setAutoCommit(false);
			return result;
		};

		// Set up jOOQ references
		schema = new Schema(settings);
		COLUMNS = schema.COLUMNS;
		TABLE_NAME = schema.TABLE_NAME;
		COLUMN_NAME = schema.COLUMN_NAME;
		POSITION = schema.POSITION;
		COLUMN_TYPE = schema.COLUMN_TYPE;
		NOT_NULL = schema.NOT_NULL;
		ID = schema.ID;
	}

	@FunctionalInterface
	private interface Work<T> {
		T performWith(DSLContext dsl) throws SQLException;
	}

	/**
	 * Runs <code>work</code> on a new connection, and commits.
	 * If anything goes wrong, rolls back instead.
	 */
	private <T> T inTransaction(Work<T> work) {
		ensureMetadataTableExists();
		try (Connection connection = connectionSource.get()) {
			try {
				T result = work.performWith(using(connection, settings.dialect()));
				connection.commit();
				return result;
			} catch (RuntimeException | SQLException e) {
				connection.rollback();
				throw e;
			}
		} catch (SQLException | DataAccessException e) {
			throw new StorageException(e.getMessage(), e);
		}
	}

	private void ensureMetadataTableExists() {
		if (metadataTableExists) {
			return;
		}
		try (Connection connection = connectionSource.get()) {
			LOGGER.debug("Ensuring table {} exists", COLUMNS);
			using(connection, settings.dialect())
				.createTableIfNotExists(COLUMNS)
				.columns(TABLE_NAME, COLUMN_NAME, POSITION, COLUMN_TYPE, NOT_NULL)
				.constraints(primaryKey(TABLE_NAME, COLUMN_NAME))
				.execute();
			connection.commit();
			metadataTableExists = true;
		} catch (SQLException | DataAccessException e) {
			throw new StorageException("Unable to create table " + settings.metadataTable(), e);
		}
	}

	@Override
	public boolean hasTable(String table) {
		return inTransaction(dsl -> !loadColumns(dsl, table).isEmpty());
	}

	@Override
	public void defineTable(String table, List<ColumnDefinition> columns) {
		inTransaction(dsl -> {
			Map<String, ColumnDefinition> existing = loadColumns(dsl, table);
			if (existing.isEmpty()) {
				createTable(dsl, table, columns);
			} else {
				addMissingColumns(dsl, table, existing, columns);
			}
			return null;
		});
	}

	@Override
	public void redefineTable(String table, List<ColumnDefinition> columns) {
		inTransaction(dsl -> {
			addMissingColumns(dsl, table, requireColumns(dsl, table), columns);
			return null;
		});
	}

	private void createTable(DSLContext dsl, String table, List<ColumnDefinition> columns) {
		LOGGER.debug("Creating table {} with {}", table, columns);
		Map<String, ColumnDefinition> all = new LinkedHashMap<>();
		all.put(ID_COLUMN, new ColumnDefinition(ID_COLUMN, FieldType.INTEGER, true));
		columns.forEach(c -> all.putIfAbsent(c.name(), c));
		List<Field<?>> fields = new ArrayList<>();
		all.values().forEach(c -> fields.add(SqlColumnTypes.columnField(c, settings.varcharLength())));
		dsl.createTableIfNotExists(schema.dataTable(table))
			.columns(fields)
			.constraints(primaryKey(ID))
			.execute();
		recordColumns(dsl, table, 0, all.values());
	}

	private void addMissingColumns(DSLContext dsl, String table, Map<String, ColumnDefinition> existing, List<ColumnDefinition> columns) {
		List<ColumnDefinition> added = new ArrayList<>();
		for (ColumnDefinition column: columns) {
			if (existing.containsKey(column.name()) || added.stream().anyMatch(a -> a.name().equals(column.name()))) {
				continue;
			}
			// Existing rows have no value for the new column, so it can't be not-null
			ColumnDefinition nullable = new ColumnDefinition(column.name(), column.type(), false);
			LOGGER.debug("Adding column {}.{} {}", table, column.name(), column.type());
			dsl.alterTable(schema.dataTable(table))
				.add(SqlColumnTypes.columnField(nullable, settings.varcharLength()))
				.execute();
			added.add(nullable);
		}
		recordColumns(dsl, table, existing.size(), added);
	}

	private void recordColumns(DSLContext dsl, String table, int firstPosition, Iterable<ColumnDefinition> columns) {
		int position = firstPosition;
		for (ColumnDefinition column: columns) {
			dsl.insertInto(COLUMNS)
				.columns(TABLE_NAME, COLUMN_NAME, POSITION, COLUMN_TYPE, NOT_NULL)
				.values(table, column.name(), position++, column.type().toString(), column.notNull())
				.execute();
		}
	}

	/**
	 * @return the columns of <code>table</code> in the order they were added; empty if there's no such table
	 */
	private Map<String, ColumnDefinition> loadColumns(DSLContext dsl, String table) {
		Map<String, ColumnDefinition> result = new LinkedHashMap<>();
		var records = dsl
			.select(COLUMN_NAME, COLUMN_TYPE, NOT_NULL)
			.from(COLUMNS)
			.where(TABLE_NAME.eq(table))
			.orderBy(POSITION)
			.fetch();
		for (var r: records) {
			String name = r.get(COLUMN_NAME);
			result.put(name, new ColumnDefinition(name, FieldType.parse(r.get(COLUMN_TYPE)), r.get(NOT_NULL)));
		}
		return result;
	}

	private Map<String, ColumnDefinition> requireColumns(DSLContext dsl, String table) {
		Map<String, ColumnDefinition> result = loadColumns(dsl, table);
		if (result.isEmpty()) {
			throw new StorageException("No such table: " + table);
		}
		return result;
	}

	private static ColumnDefinition column(Map<String, ColumnDefinition> columns, String table, String name) {
		ColumnDefinition result = columns.get(name);
		if (result == null) {
			throw new StorageException("No such column: " + table + "." + name);
		}
		return result;
	}

	@Override
	public Set<String> columns(String table) {
		return inTransaction(dsl -> Collections.unmodifiableSet(new LinkedHashSet<>(loadColumns(dsl, table).keySet())));
	}

	@Override
	public Optional<Row> lookupRow(String table, long id) {
		return inTransaction(dsl -> {
			List<Row> rows = select(dsl, table, requireColumns(dsl, table), ID.eq(id));
			return rows.stream().findFirst();
		});
	}

	@Override
	public boolean updateRow(String table, long id, Map<String, Object> columnValues) {
		return inTransaction(dsl -> {
			LOGGER.debug("updateRow({}, {})", table, id);
			Map<String, ColumnDefinition> columns = requireColumns(dsl, table);
			Map<Field<?>, Object> values = new LinkedHashMap<>();
			columnValues.forEach((name, value) -> {
				ColumnDefinition column = column(columns, table, name);
				if (ID_COLUMN.equals(name)) {
					Long newID = converter.toLong(table, column, value);
					if (newID == null || newID != id) {
						throw new StorageException("Can't change the id of " + table + " row " + id);
					}
				} else {
					values.put(field(column), converter.toDatabase(table, column, value));
				}
			});
			Table<Record> t = schema.dataTable(table);
			if (values.isEmpty()) {
				return dsl.fetchExists(selectOne().from(t).where(ID.eq(id)));
			}
			int count = dsl.update(t).set(values).where(ID.eq(id)).execute();
			return count > 0;
		});
	}

	@Override
	public long insertRow(String table, Map<String, Object> columnValues) {
		return inTransaction(dsl -> {
			Map<String, ColumnDefinition> columns = requireColumns(dsl, table);
			return insert(dsl, table, columns, columnValues, nextID(dsl, table));
		});
	}

	@Override
	public List<Long> bulkInsertRows(String table, List<Map<String, Object>> rows) {
		return inTransaction(dsl -> {
			LOGGER.debug("bulkInsertRows({}, {} rows)", table, rows.size());
			Map<String, ColumnDefinition> columns = requireColumns(dsl, table);
			List<Long> result = new ArrayList<>(rows.size());
			long nextID = nextID(dsl, table);
			for (Map<String, Object> row: rows) {
				long id = insert(dsl, table, columns, row, nextID);
				nextID = Math.max(nextID, id + 1);
				result.add(id);
			}
			return result;
		});
	}

	/**
	 * @param generatedID the id to use if <code>columnValues</code> doesn't supply one
	 * @return the id of the new row
	 */
	private long insert(DSLContext dsl, String table, Map<String, ColumnDefinition> columns, Map<String, Object> columnValues, long generatedID) {
		Map<Field<?>, Object> values = new LinkedHashMap<>();
		Long id = null;
		for (Map.Entry<String, Object> entry: columnValues.entrySet()) {
			ColumnDefinition column = column(columns, table, entry.getKey());
			if (ID_COLUMN.equals(entry.getKey())) {
				id = converter.toLong(table, column, entry.getValue());
			} else {
				values.put(field(column), converter.toDatabase(table, column, entry.getValue()));
			}
		}
		if (id == null) {
			id = generatedID;
		}
		values.put(ID, id);
		LOGGER.trace("Inserting {} row {}", table, id);
		dsl.insertInto(schema.dataTable(table)).set(values).execute();
		return id;
	}

	private long nextID(DSLContext dsl, String table) {
		Long max = dsl.select(max(ID)).from(schema.dataTable(table)).fetchOne(0, Long.class);
		return max == null ? 1 : max + 1;
	}

	@Override
	public List<Row> query(String table, Map<String, Object> equalTo) {
		return inTransaction(dsl -> {
			Map<String, ColumnDefinition> columns = requireColumns(dsl, table);
			Condition condition = noCondition();
			for (Map.Entry<String, Object> entry: equalTo.entrySet()) {
				ColumnDefinition column = column(columns, table, entry.getKey());
				Object value = converter.toDatabase(table, column, entry.getValue());
				condition = condition.and(equal(field(column), value));
			}
			return select(dsl, table, columns, condition);
		});
	}

	private List<Row> select(DSLContext dsl, String table, Map<String, ColumnDefinition> columns, Condition condition) {
		List<ColumnDefinition> columnList = new ArrayList<>(columns.values());
		List<Field<?>> fields = new ArrayList<>();
		columnList.forEach(c -> fields.add(field(c)));
		List<Row> result = new ArrayList<>();
		for (Record record: dsl.select(fields).from(schema.dataTable(table)).where(condition).orderBy(ID).fetch()) {
			Row row = new Row();
			for (int i = 0; i < columnList.size(); i++) {
				ColumnDefinition column = columnList.get(i);
				row.put(column.name(), converter.fromDatabase(column, record.get(fields.get(i))));
			}
			result.add(row);
		}
		return result;
	}

	private Field<?> field(ColumnDefinition column) {
		if (ID_COLUMN.equals(column.name())) {
			return ID;
		}
		return SqlColumnTypes.columnField(column, settings.varcharLength());
	}

	private static <T> Condition equal(Field<T> field, Object value) {
		if (value == null) {
			return field.isNull();
		} else {
			return field.eq(field.getDataType().convert(value));
		}
	}

	@Override
	public String toString() {
		return "SqlStorage{" +
			"dialect=" + settings.dialect() +
			'}';
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SqlStorageImpl.class);
}
