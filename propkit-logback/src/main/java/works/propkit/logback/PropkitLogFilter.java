package works.propkit.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.spi.FilterReply;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.Marker;
import works.propkit.logging.MdcKeys;

import static ch.qos.logback.core.spi.FilterReply.DENY;
import static ch.qos.logback.core.spi.FilterReply.NEUTRAL;
import static works.propkit.logging.MdcKeys.MANAGED_CLASS;

/**
 * A Logback {@link TurboFilter} that provides per-class logging control.
 * Intended to suppress expected warnings while defining deliberately odd classes in tests.
 * <p>
 * A log message is associated with a managed class when the MDC key {@link MdcKeys#MANAGED_CLASS}
 * is set, which {@link works.propkit.ManagedClass#define ManagedClass.define} does
 * for the duration of the class body.
 * <p>
 * Log levels are determined using the following precedence:
 * <ol>
 *     <li>
 *         If the specific logger is configured with some level,
 *         that level is used;
 *     </li>
 *     <li>
 *         otherwise, if a controller was registered with {@link #withController}
 *         for the class being defined and it has an override for that logger,
 *         that override is used;
 *     </li>
 *     <li>
 *         otherwise, the usual Logback rules apply.
 *     </li>
 * </ol>
 */
public class PropkitLogFilter extends TurboFilter {
	private static final ConcurrentHashMap<String, LogController> controllersByClassName = new ConcurrentHashMap<>();

	/**
	 * Per-logger levels for one managed class.
	 * Messages below a logger's level are dropped while that class is being defined.
	 */
	public static final class LogController {
		private final Map<String, Level> levelsByLoggerName = new ConcurrentHashMap<>();

		// We'd like to use SLF4J's "Level" but that doesn't support OFF
		public void setLogging(Level level, Class<?>... loggers) {
			setLogging(level, Stream.of(loggers).map(Class::getName).toArray(String[]::new));
		}

		public void setLogging(Level level, String... loggerNames) {
			for (String loggerName : loggerNames) {
				levelsByLoggerName.put(loggerName, level);
			}
		}

		Level levelFor(String loggerName) {
			return levelsByLoggerName.get(loggerName);
		}
	}

	/**
	 * Causes {@code controller} to control logs emitted while the managed class
	 * named {@code className} is being defined.
	 *
	 * @throws IllegalStateException if that class already has a controller
	 */
	public static void withController(String className, LogController controller) {
		LOGGER.debug("Registering controller {} for class \"{}\"", System.identityHashCode(controller), className);
		LogController old = controllersByClassName.putIfAbsent(className, controller);
		if (old != null && old != controller) {
			throw new IllegalStateException("Class \"" + className + "\" already has a log controller");
		}
	}

	public static void removeController(String className) {
		controllersByClassName.remove(className);
	}

	@Override
	public FilterReply decide(Marker marker, Logger logger, Level messageLevel, String format, Object[] params, Throwable t) {
		if (logger.getLevel() != null) {
			// Explicitly configured loggers are left alone
			return NEUTRAL;
		}
		Level classLevel = levelWhileDefining(MDC.get(MANAGED_CLASS), logger.getName());
		if (classLevel != null && classLevel.isGreaterOrEqual(messageLevel)) {
			return DENY;
		} else {
			return NEUTRAL;
		}
	}

	/**
	 * @return the level that the controller registered for {@code className} assigns to
	 * {@code loggerName}, or null if no class is being defined, it has no controller,
	 * or the controller doesn't mention that logger
	 */
	private static Level levelWhileDefining(String className, String loggerName) {
		if (className == null) {
			return null;
		}
		LogController controller = controllersByClassName.get(className);
		return (controller == null) ? null : controller.levelFor(loggerName);
	}

	private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(PropkitLogFilter.class);
}
