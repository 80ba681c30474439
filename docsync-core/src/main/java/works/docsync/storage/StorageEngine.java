package works.docsync.storage;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import works.docsync.Row;
import works.docsync.exceptions.StorageException;

/**
 * The relational store that documents are synchronized into.
 * <p>
 * Every table has an integer primary-key column named {@link #ID_COLUMN},
 * created implicitly by {@link #defineTable}. An insert that doesn't supply an id
 * gets a generated one.
 * <p>
 * Schema changes are additive only: columns are added, never altered or dropped,
 * and existing data is preserved.
 * <p>
 * Each method is an independent operation: when it returns, its effect is durable,
 * regardless of what happens in later calls. Any failure of the underlying store
 * is reported as a {@link StorageException}.
 */
public interface StorageEngine {
	String ID_COLUMN = "id";

	boolean hasTable(String table);

	/**
	 * Creates <code>table</code> with the given columns plus {@link #ID_COLUMN}.
	 * If the table already exists, behaves like {@link #redefineTable}.
	 */
	void defineTable(String table, List<ColumnDefinition> columns);

	/**
	 * Adds any of the given <code>columns</code> that <code>table</code> doesn't have yet,
	 * as nullable columns. Columns not mentioned are left as they are.
	 *
	 * @throws StorageException if the table doesn't exist
	 */
	void redefineTable(String table, List<ColumnDefinition> columns);

	/**
	 * @return the names of all columns of <code>table</code>, including {@link #ID_COLUMN};
	 * empty if the table doesn't exist
	 */
	Set<String> columns(String table);

	/**
	 * @return every column of the row, including {@link #ID_COLUMN} and null-valued columns
	 */
	Optional<Row> lookupRow(String table, long id);

	/**
	 * Sets the given columns of an existing row. Columns not mentioned are unchanged.
	 *
	 * @return false if there is no row with the given id
	 */
	boolean updateRow(String table, long id, Map<String, Object> columnValues);

	/**
	 * @return the id of the new row: the supplied {@link #ID_COLUMN} value if any, otherwise a generated one
	 */
	long insertRow(String table, Map<String, Object> columnValues);

	/**
	 * Inserts all the given rows in one call.
	 *
	 * @return the ids of the new rows, in the same order as <code>rows</code>
	 */
	List<Long> bulkInsertRows(String table, List<Map<String, Object>> rows);

	/**
	 * @param equalTo column values that a row must match, all of them, to be returned;
	 *                an empty map matches every row
	 * @return matching rows in id order
	 */
	List<Row> query(String table, Map<String, Object> equalTo);
}
