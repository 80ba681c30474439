package works.docsync.logging;

import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.MDC;

import static works.docsync.logging.MdcKeys.REGISTRY_INSTANCE_ID;
import static works.docsync.logging.MdcKeys.REGISTRY_NAME;
import static works.docsync.logging.MdcKeys.TYPE_NAME;

/**
 * Populates the SLF4J {@link MDC} with the identity of the registry and type
 * being synchronized, so every log line emitted during a sync can be attributed.
 */
public final class MappedDiagnosticContext {
	private MappedDiagnosticContext() {}

	/**
	 * Sets the MDC keys from {@link MdcKeys} until the returned scope is closed,
	 * at which point the previous values (possibly from an enclosing sync) are restored.
	 */
	public static MDCScope setupMDC(String registryName, String instanceID, String typeName) {
		MDCScope result = new MDCScope();
		result.set(REGISTRY_NAME, registryName);
		result.set(REGISTRY_INSTANCE_ID, instanceID);
		result.set(TYPE_NAME, typeName);
		return result;
	}

	public static final class MDCScope implements AutoCloseable {
		private final Map<String, String> oldValues = new LinkedHashMap<>();

		MDCScope() {}

		private void set(String key, String value) {
			oldValues.put(key, MDC.get(key));
			if (value == null) {
				MDC.remove(key);
			} else {
				MDC.put(key, value);
			}
		}

		@Override
		public void close() {
			oldValues.forEach((key, old) -> {
				if (old == null) {
					MDC.remove(key);
				} else {
					MDC.put(key, old);
				}
			});
		}
	}
}
