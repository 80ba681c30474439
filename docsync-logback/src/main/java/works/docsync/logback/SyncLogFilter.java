package works.docsync.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Stream;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.Marker;
import works.docsync.TypeRegistry;
import works.docsync.logging.MdcKeys;

import static ch.qos.logback.core.spi.FilterReply.ACCEPT;
import static ch.qos.logback.core.spi.FilterReply.DENY;
import static ch.qos.logback.core.spi.FilterReply.NEUTRAL;
import static java.util.stream.Collectors.toMap;
import static works.docsync.logging.MdcKeys.REGISTRY_INSTANCE_ID;

/**
 * A Logback {@link TurboFilter} that provides per-registry logging control.
 * Intended to suppress expected warnings and errors during testing,
 * such as the error logged before a {@link works.docsync.exceptions.TemporalParseException}.
 * <p>
 * A {@link TypeRegistry} registered with {@link #withController} will have
 * the log levels of its syncs set by {@link LogController#setLogging}
 * without affecting other logs.
 * <p>
 * A log message is associated with a registry by the MDC key
 * {@link MdcKeys#REGISTRY_INSTANCE_ID}, which every sync sets for its duration.
 * <p>
 * Log levels are determined using the following precedence:
 * <ol>
 *     <li>
 *         If the specific logger is configured with some level,
 *         that level is used;
 *     </li>
 *     <li>
 *         otherwise, if the message comes from a sync of a registry
 *         registered with {@link #withController} and that controller
 *         has an override for that specific logger, that override is used;
 *     </li>
 *     <li>
 *         otherwise, the usual Logback rules apply.
 *     </li>
 * </ol>
 * To take effect, the filter must be installed in the Logback configuration with
 * {@code <turboFilter class="works.docsync.logback.SyncLogFilter"/>}.
 */
public class SyncLogFilter extends TurboFilter {
	private static final ConcurrentHashMap<String, LogController> controllersByInstanceID = new ConcurrentHashMap<>();

	public static final class LogController {
		final Map<String, Level> overrides = new ConcurrentHashMap<>();

		/**
		 * Messages from the given loggers at <code>level</code> or above are logged,
		 * and the rest dropped, whatever the loggers' configured levels.
		 * Use {@link Level#OFF} to drop them all.
		 */
		public void setLogging(Level level, Class<?>... loggers) {
			overrides.putAll(Stream.of(loggers).collect(toMap(Class::getName, c -> level)));
		}

		public void setLogging(Level level, String... loggers) {
			overrides.putAll(Stream.of(loggers).collect(toMap(Function.identity(), n -> level)));
		}

		public void clear() {
			overrides.clear();
		}
	}

	/**
	 * Causes <code>controller</code> to control the logs emitted while
	 * <code>registry</code> syncs documents.
	 *
	 * @return <code>registry</code>
	 */
	public static TypeRegistry withController(TypeRegistry registry, LogController controller) {
		LOGGER.debug("Registering controller {} for registry {} \"{}\"", System.identityHashCode(controller), registry.instanceID(), registry.name());
		LogController old = controllersByInstanceID.putIfAbsent(registry.instanceID(), controller);
		if (old != null && old != controller) {
			throw new IllegalStateException("Registry \"" + registry.name() + "\" already has a log controller");
		}
		return registry;
	}

	public static void removeController(TypeRegistry registry) {
		controllersByInstanceID.remove(registry.instanceID());
	}

	@Override
	public FilterReply decide(Marker marker, Logger logger, Level messageLevel, String format, Object[] params, Throwable t) {
		if (logger.getLevel() != null) {
			// Respect user-supplied log levels
			return NEUTRAL;
		}
		String instanceID = MDC.get(REGISTRY_INSTANCE_ID);
		if (instanceID == null) {
			return NEUTRAL;
		}
		LogController controller = controllersByInstanceID.get(instanceID);
		if (controller == null) {
			return NEUTRAL;
		}
		Level overrideLevel = controller.overrides.get(logger.getName());
		if (overrideLevel == null || messageLevel == null) {
			return NEUTRAL;
		}
		if (messageLevel.isGreaterOrEqual(overrideLevel)) {
			return ACCEPT;
		} else {
			return DENY;
		}
	}

	private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(SyncLogFilter.class);
}
