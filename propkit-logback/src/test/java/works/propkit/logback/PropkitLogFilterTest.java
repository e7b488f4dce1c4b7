package works.propkit.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import works.propkit.ManagedClass;
import works.propkit.PropertyBuilder;

import static ch.qos.logback.classic.Level.ERROR;
import static ch.qos.logback.classic.Level.WARN;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PropkitLogFilterTest {
	Logger builderLogger;
	ListAppender<ILoggingEvent> appender;

	@BeforeEach
	void attachAppender() {
		LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
		assertTrue(context.getTurboFilterList().stream().anyMatch(f -> f instanceof PropkitLogFilter),
			"logback-test.xml should install the filter");
		builderLogger = context.getLogger(PropertyBuilder.class);
		appender = new ListAppender<>();
		appender.setContext(context);
		appender.start();
		builderLogger.addAppender(appender);
	}

	@AfterEach
	void detachAppender() {
		builderLogger.detachAppender(appender);
		builderLogger.setLevel(null);
		appender.stop();
		PropkitLogFilter.removeController("Quiet");
		PropkitLogFilter.removeController("Other");
	}

	@Test
	void noController_logsNormally() {
		defineEmpty("Noisy");
		assertEquals(List.of(WARN), levels());
	}

	@Test
	void controller_suppressesOverriddenLogger() {
		PropkitLogFilter.LogController controller = new PropkitLogFilter.LogController();
		controller.setLogging(ERROR, PropertyBuilder.class);
		PropkitLogFilter.withController("Quiet", controller);

		defineEmpty("Quiet");
		assertEquals(List.of(), levels());

		defineEmpty("Loud");
		assertEquals(List.of(WARN), levels());
	}

	@Test
	void controller_letsHigherLevelsThrough() {
		PropkitLogFilter.LogController controller = new PropkitLogFilter.LogController();
		controller.setLogging(Level.INFO, PropertyBuilder.class.getName());
		PropkitLogFilter.withController("Quiet", controller);

		defineEmpty("Quiet");
		assertEquals(List.of(WARN), levels());
	}

	@Test
	void outerController_appliesAfterNestedDefine() {
		PropkitLogFilter.LogController controller = new PropkitLogFilter.LogController();
		controller.setLogging(ERROR, PropertyBuilder.class);
		PropkitLogFilter.withController("Quiet", controller);

		ManagedClass.define("Quiet", ns -> {
			defineEmpty("Loud");
			try (var props = PropertyBuilder.open(ns, "props")) {
				// Nothing declared: the builder warns on close
			}
		});
		assertEquals(List.of(WARN), levels());
	}

	@Test
	void configuredLoggerLevel_winsOverController() {
		PropkitLogFilter.LogController controller = new PropkitLogFilter.LogController();
		controller.setLogging(ERROR, PropertyBuilder.class);
		PropkitLogFilter.withController("Quiet", controller);
		builderLogger.setLevel(Level.DEBUG);

		defineEmpty("Quiet");
		assertTrue(levels().contains(WARN));
	}

	@Test
	void secondController_throws() {
		PropkitLogFilter.withController("Other", new PropkitLogFilter.LogController());
		assertThrows(IllegalStateException.class, () -> PropkitLogFilter.withController("Other", new PropkitLogFilter.LogController()));
	}

	private static void defineEmpty(String className) {
		ManagedClass.define(className, ns -> {
			try (var props = PropertyBuilder.open(ns, "props")) {
				// Nothing declared: the builder warns on close
			}
		});
	}

	private List<Level> levels() {
		return appender.list.stream()
			.map(ILoggingEvent::getLevel)
			.toList();
	}
}
