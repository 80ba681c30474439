package works.docsync.sql;

import com.zaxxer.hikari.HikariDataSource;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import works.docsync.testing.StorageConformanceTest;

import static works.docsync.sql.SqlTestService.dataSourceFor;
import static works.docsync.sql.SqlTestService.sqlStorage;

class SqlStorageConformanceTest extends StorageConformanceTest {
	private final Deque<HikariDataSource> dataSources = new ArrayDeque<>();
	private final AtomicInteger dbCounter = new AtomicInteger(0);

	@BeforeEach
	void setupStorageFactory() {
		SqlStorageSettings settings = SqlStorageSettings.defaults();
		storageFactory = () -> {
			HikariDataSource dataSource = dataSourceFor(SqlStorageConformanceTest.class.getSimpleName() + dbCounter.incrementAndGet());
			dataSources.addFirst(dataSource);
			return sqlStorage(settings, dataSource);
		};
	}

	@AfterEach
	void closeDataSources() {
		dataSources.forEach(HikariDataSource::close);
		dataSources.clear();
	}
}
