package works.docsync.sql;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import org.jooq.SQLDialect;

@Value
@Builder(toBuilder = true)
public class SqlStorageSettings {
	@Default SQLDialect dialect = SQLDialect.SQLITE;

	/**
	 * The declared length of {@code string} columns.
	 * Longer values are rejected by databases that enforce the length.
	 */
	@Default int varcharLength = 255;

	@Default String metadataTable = "docsync_columns";

	public static SqlStorageSettings defaults() {
		return builder().build();
	}
}
