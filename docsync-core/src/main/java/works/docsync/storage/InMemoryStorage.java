package works.docsync.storage;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.docsync.FieldType;
import works.docsync.Row;
import works.docsync.ValueKind;
import works.docsync.exceptions.StorageException;

import static java.util.Collections.unmodifiableSet;
import static works.docsync.FieldType.Kind.DOUBLE;
import static works.docsync.FieldType.Kind.INTEGER;
import static works.docsync.FieldType.Kind.LIST_REFERENCE;
import static works.docsync.FieldType.Kind.REFERENCE;

/**
 * Keeps tables in memory, with the same observable behaviour as a relational store:
 * unknown columns and not-null violations are rejected, ids are generated
 * in increasing order, and integer-like columns hold {@link Long}s.
 * <p>
 * All methods are synchronized.
 */
public class InMemoryStorage implements StorageEngine {
	private final Map<String, Table> tables = new LinkedHashMap<>();

	private static final class Table {
		final String name;
		final Map<String, ColumnDefinition> columns = new LinkedHashMap<>();
		final TreeMap<Long, Map<String, Object>> rows = new TreeMap<>();
		long lastId = 0;

		Table(String name) {
			this.name = name;
			columns.put(ID_COLUMN, ColumnDefinition.of(ID_COLUMN, FieldType.INTEGER));
		}
	}

	@Override
	public synchronized boolean hasTable(String table) {
		return tables.containsKey(table);
	}

	@Override
	public synchronized void defineTable(String table, List<ColumnDefinition> columns) {
		Table t = tables.computeIfAbsent(table, Table::new);
		addMissingColumns(t, columns);
	}

	@Override
	public synchronized void redefineTable(String table, List<ColumnDefinition> columns) {
		addMissingColumns(table(table), columns);
	}

	private void addMissingColumns(Table t, List<ColumnDefinition> columns) {
		for (ColumnDefinition column: columns) {
			if (!t.columns.containsKey(column.name())) {
				LOGGER.debug("Adding column {}.{} {}", t.name, column.name(), column.type());
				// Existing rows have no value for the new column, so it can't be not-null
				ColumnDefinition added = t.rows.isEmpty() ? column : new ColumnDefinition(column.name(), column.type(), false);
				t.columns.put(column.name(), added);
				t.rows.values().forEach(r -> r.put(column.name(), null));
			}
		}
	}

	@Override
	public synchronized Set<String> columns(String table) {
		Table t = tables.get(table);
		if (t == null) {
			return Set.of();
		}
		return unmodifiableSet(new LinkedHashSet<>(t.columns.keySet()));
	}

	@Override
	public synchronized Optional<Row> lookupRow(String table, long id) {
		Map<String, Object> values = table(table).rows.get(id);
		if (values == null) {
			return Optional.empty();
		}
		return Optional.of(new Row(values));
	}

	@Override
	public synchronized boolean updateRow(String table, long id, Map<String, Object> columnValues) {
		Table t = table(table);
		Map<String, Object> existing = t.rows.get(id);
		if (existing == null) {
			return false;
		}
		Map<String, Object> updated = new LinkedHashMap<>(existing);
		columnValues.forEach((column, value) -> {
			if (ID_COLUMN.equals(column) && !Objects.equals(normalize(t, column, value), id)) {
				throw new StorageException("Can't change the id of " + table + " row " + id);
			}
			updated.put(column, normalize(t, column, value));
		});
		checkNotNull(t, updated);
		t.rows.put(id, updated);
		return true;
	}

	@Override
	public synchronized long insertRow(String table, Map<String, Object> columnValues) {
		return insert(table(table), columnValues);
	}

	@Override
	public synchronized List<Long> bulkInsertRows(String table, List<Map<String, Object>> rows) {
		Table t = table(table);
		List<Long> result = new ArrayList<>(rows.size());
		for (Map<String, Object> row: rows) {
			result.add(insert(t, row));
		}
		return result;
	}

	private long insert(Table t, Map<String, Object> columnValues) {
		Map<String, Object> stored = new LinkedHashMap<>();
		t.columns.keySet().forEach(c -> stored.put(c, null));
		columnValues.forEach((column, value) -> stored.put(column, normalize(t, column, value)));

		long id;
		Object suppliedId = stored.get(ID_COLUMN);
		if (suppliedId == null) {
			id = t.lastId + 1;
		} else {
			id = (Long) suppliedId;
			if (t.rows.containsKey(id)) {
				throw new StorageException("Duplicate id " + id + " in table " + t.name);
			}
		}
		stored.put(ID_COLUMN, id);
		checkNotNull(t, stored);
		t.lastId = Math.max(t.lastId, id);
		t.rows.put(id, stored);
		return id;
	}

	@Override
	public synchronized List<Row> query(String table, Map<String, Object> equalTo) {
		Table t = table(table);
		Map<String, Object> conditions = new LinkedHashMap<>();
		equalTo.forEach((column, value) -> conditions.put(column, normalize(t, column, value)));
		List<Row> result = new ArrayList<>();
		for (Map<String, Object> row: t.rows.values()) {
			boolean matches = conditions.entrySet().stream()
				.allMatch(e -> Objects.equals(row.get(e.getKey()), e.getValue()));
			if (matches) {
				result.add(new Row(row));
			}
		}
		return result;
	}

	private Table table(String table) {
		Table result = tables.get(table);
		if (result == null) {
			throw new StorageException("No such table: " + table);
		}
		return result;
	}

	private static void checkNotNull(Table t, Map<String, Object> row) {
		for (ColumnDefinition column: t.columns.values()) {
			if (column.notNull() && row.get(column.name()) == null) {
				throw new StorageException("Column " + t.name + "." + column.name() + " can't be null");
			}
		}
	}

	private static Object normalize(Table t, String column, Object value) {
		ColumnDefinition definition = t.columns.get(column);
		if (definition == null) {
			throw new StorageException("No such column: " + t.name + "." + column);
		}
		if (value == null) {
			return null;
		}
		FieldType.Kind kind = definition.type().kind();
		if (kind == INTEGER || kind == REFERENCE) {
			return toLong(t, column, value);
		} else if (kind == DOUBLE && value instanceof Number) {
			return ((Number) value).doubleValue();
		} else if (kind == LIST_REFERENCE && value instanceof Collection) {
			List<Long> ids = new ArrayList<>();
			for (Object element: (Collection<?>) value) {
				ids.add(element == null ? null : toLong(t, column, element));
			}
			return ids;
		} else {
			return value;
		}
	}

	private static Long toLong(Table t, String column, Object value) {
		if (value instanceof BigInteger) {
			try {
				return ((BigInteger) value).longValueExact();
			} catch (ArithmeticException e) {
				throw new StorageException("Column " + t.name + "." + column + " can't hold " + value, e);
			}
		} else if (ValueKind.isIntegral(value)) {
			return ((Number) value).longValue();
		} else if (value instanceof BigDecimal || value instanceof Double || value instanceof Float) {
			double d = ((Number) value).doubleValue();
			if (d == Math.rint(d)) {
				return (long) d;
			}
		} else if (value instanceof String) {
			try {
				return new BigInteger(((String) value).trim()).longValueExact();
			} catch (NumberFormatException | ArithmeticException e) {
				throw new StorageException("Column " + t.name + "." + column + " can't hold \"" + value + "\"", e);
			}
		}
		throw new StorageException("Column " + t.name + "." + column + " can't hold " + value);
	}

	@Override
	public synchronized String toString() {
		return "InMemoryStorage" + tables.keySet();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryStorage.class);
}
