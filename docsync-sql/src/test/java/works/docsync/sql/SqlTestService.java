package works.docsync.sql;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Creates SQLite databases in temporary files, each behind its own connection pool.
 */
final class SqlTestService {
	private SqlTestService() {}

	static HikariDataSource dataSourceFor(String databaseName) {
		Path file;
		try {
			file = Files.createTempFile(databaseName, ".db");
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
		File asFile = file.toFile();
		asFile.deleteOnExit();

		HikariConfig config = new HikariConfig();
		config.setPoolName(databaseName);
		config.setJdbcUrl("jdbc:sqlite:" + asFile.getAbsolutePath());
		// SQLite allows one writer at a time anyway
		config.setMaximumPoolSize(1);
		return new HikariDataSource(config);
	}

	static SqlStorage sqlStorage(SqlStorageSettings settings, HikariDataSource dataSource) {
		return SqlStorage.create(settings, dataSource::getConnection);
	}
}
