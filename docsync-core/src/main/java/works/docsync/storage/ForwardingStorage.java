package works.docsync.storage;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import works.docsync.Row;

/**
 * Implements all {@link StorageEngine} methods by simply calling the corresponding
 * methods on another engine. Useful for overriding one or two methods while leaving
 * the rest unchanged.
 */
public class ForwardingStorage implements StorageEngine {
	protected final StorageEngine downstream;

	public ForwardingStorage(StorageEngine downstream) {
		this.downstream = downstream;
	}

	@Override
	public boolean hasTable(String table) {
		return downstream.hasTable(table);
	}

	@Override
	public void defineTable(String table, List<ColumnDefinition> columns) {
		downstream.defineTable(table, columns);
	}

	@Override
	public void redefineTable(String table, List<ColumnDefinition> columns) {
		downstream.redefineTable(table, columns);
	}

	@Override
	public Set<String> columns(String table) {
		return downstream.columns(table);
	}

	@Override
	public Optional<Row> lookupRow(String table, long id) {
		return downstream.lookupRow(table, id);
	}

	@Override
	public boolean updateRow(String table, long id, Map<String, Object> columnValues) {
		return downstream.updateRow(table, id, columnValues);
	}

	@Override
	public long insertRow(String table, Map<String, Object> columnValues) {
		return downstream.insertRow(table, columnValues);
	}

	@Override
	public List<Long> bulkInsertRows(String table, List<Map<String, Object>> rows) {
		return downstream.bulkInsertRows(table, rows);
	}

	@Override
	public List<Row> query(String table, Map<String, Object> equalTo) {
		return downstream.query(table, equalTo);
	}

	@Override
	public String toString() {
		return "ForwardingStorage{" +
			"downstream=" + downstream +
			'}';
	}
}
