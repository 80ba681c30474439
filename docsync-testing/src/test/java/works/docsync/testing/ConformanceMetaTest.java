package works.docsync.testing;

import org.junit.jupiter.api.BeforeEach;
import works.docsync.storage.InMemoryStorage;

/**
 * Makes sure {@link StorageConformanceTest} works properly by running it
 * against {@link InMemoryStorage}.
 */
public class ConformanceMetaTest extends StorageConformanceTest {

	@BeforeEach
	void setupStorageFactory() {
		storageFactory = InMemoryStorage::new;
	}

}
