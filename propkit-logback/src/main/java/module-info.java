/**
 * Logback-specific logging utilities.
 */
module works.propkit.logback {
	requires transitive ch.qos.logback.classic;
	requires transitive ch.qos.logback.core;
	requires transitive org.slf4j;
	requires transitive works.propkit.core;

	exports works.propkit.logback;
}
