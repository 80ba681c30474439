package works.docsync.testing;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.docsync.storage.ColumnDefinition;
import works.docsync.storage.ForwardingStorage;
import works.docsync.storage.StorageEngine;
import works.docsync.testing.operations.BulkInsertOperation;
import works.docsync.testing.operations.DefineTableOperation;
import works.docsync.testing.operations.InsertOperation;
import works.docsync.testing.operations.RedefineTableOperation;
import works.docsync.testing.operations.StorageOperation;
import works.docsync.testing.operations.UpdateOperation;

/**
 * Keeps a log of every write that the downstream storage completed successfully.
 * Reads are not recorded.
 * <p>
 * Replaying {@link #operations()} in order onto an empty storage
 * reproduces the downstream storage's contents.
 */
public class RecordingStorage extends ForwardingStorage {
	private final List<StorageOperation> operations = new ArrayList<>();

	public RecordingStorage(StorageEngine downstream) {
		super(downstream);
	}

	public StorageEngine downstream() {
		return downstream;
	}

	@Override
	public void defineTable(String table, List<ColumnDefinition> columns) {
		super.defineTable(table, columns);
		record(new DefineTableOperation(table, columns));
	}

	@Override
	public void redefineTable(String table, List<ColumnDefinition> columns) {
		super.redefineTable(table, columns);
		record(new RedefineTableOperation(table, columns));
	}

	@Override
	public boolean updateRow(String table, long id, Map<String, Object> columnValues) {
		boolean result = super.updateRow(table, id, columnValues);
		record(new UpdateOperation(table, id, columnValues, result));
		return result;
	}

	@Override
	public long insertRow(String table, Map<String, Object> columnValues) {
		long result = super.insertRow(table, columnValues);
		record(new InsertOperation(table, columnValues));
		return result;
	}

	@Override
	public List<Long> bulkInsertRows(String table, List<Map<String, Object>> rows) {
		List<Long> result = super.bulkInsertRows(table, rows);
		record(new BulkInsertOperation(table, rows));
		return result;
	}

	private synchronized void record(StorageOperation operation) {
		LOGGER.trace("Recorded {}", operation);
		operations.add(operation);
	}

	public synchronized List<StorageOperation> operations() {
		return List.copyOf(operations);
	}

	/**
	 * @return the recorded operations on <code>table</code>, in order
	 */
	public synchronized List<StorageOperation> operationsOn(String table) {
		return operations.stream()
			.filter(op -> op.table().equals(table))
			.toList();
	}

	public synchronized <T extends StorageOperation> List<T> operationsOfType(Class<T> operationType, String table) {
		return operations.stream()
			.filter(operationType::isInstance)
			.map(operationType::cast)
			.filter(op -> op.table().equals(table))
			.toList();
	}

	/**
	 * Submits every recorded operation, in order, to <code>target</code>.
	 */
	public synchronized void replayOnto(StorageEngine target) {
		LOGGER.debug("Replaying {} operations onto {}", operations.size(), target);
		operations.forEach(op -> op.submitTo(target));
	}

	public synchronized void clear() {
		operations.clear();
	}

	@Override
	public String toString() {
		return "RecordingStorage{" +
			"downstream=" + downstream +
			'}';
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(RecordingStorage.class);
}
