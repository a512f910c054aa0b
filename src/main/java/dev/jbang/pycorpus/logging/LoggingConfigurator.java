package dev.jbang.pycorpus.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/** Adjusts logging verbosity from command line flags. */
public final class LoggingConfigurator {
	private static final org.slf4j.Logger logger = LoggerFactory.getLogger(LoggingConfigurator.class);

	private LoggingConfigurator() {
		// Utility
	}

	/** Raise the root logger to DEBUG. Backends other than Logback keep their configuration. */
	public static void enableVerboseLogging() {
		ILoggerFactory factory = LoggerFactory.getILoggerFactory();
		if (factory instanceof LoggerContext) {
			Logger root = ((LoggerContext) factory).getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
			if (!Level.DEBUG.equals(root.getLevel())) {
				root.setLevel(Level.DEBUG);
			}
			return;
		}
		logger.warn(
				"Verbose logging requested but backend {} does not support dynamic level updates",
				factory.getClass().getName());
	}
}
