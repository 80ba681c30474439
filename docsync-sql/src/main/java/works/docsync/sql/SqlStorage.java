package works.docsync.sql;

import java.sql.Connection;
import java.sql.SQLException;
import works.docsync.jackson.StructuredValueCodec;
import works.docsync.storage.StorageEngine;

/**
 * A {@link StorageEngine} over a relational database, accessed through JDBC.
 * <p>
 * Alongside the tables it creates, it keeps a metadata table
 * ({@link SqlStorageSettings#metadataTable()}) recording the columns of each one
 * and their {@link works.docsync.FieldType FieldType}, so that values read back
 * have the same Java types that an in-memory storage would hold.
 * Tables not created through this engine are invisible to it.
 */
public interface SqlStorage extends StorageEngine {
	static SqlStorage create(SqlStorageSettings settings, ConnectionSource connectionSource) {
		return create(settings, connectionSource, new StructuredValueCodec());
	}

	/**
	 * @param codec encodes the values of {@code json} and {@code list:reference} columns,
	 *              which are stored as text
	 */
	static SqlStorage create(SqlStorageSettings settings, ConnectionSource connectionSource, StructuredValueCodec codec) {
		return new SqlStorageImpl(settings, connectionSource, codec);
	}

	/**
	 * Supplies a new connection for each storage operation.
	 * The connection is closed when the operation is done.
	 * Use a pool.
	 */
	interface ConnectionSource {
		Connection get() throws SQLException;
	}
}
