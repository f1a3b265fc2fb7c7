/*-
 * #%L
 * This file is part of FilterLab.
 * %%
 * Copyright (C) 2024 - 2026 FilterLab developers
 * %%
 * FilterLab is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * FilterLab is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with FilterLab.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package filterlab.logging;

import java.io.File;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;

/**
 * Manage logging levels and destinations for the command line.
 * <p>
 * This requires logback as the slf4j binding; if another binding is used, requests are logged and ignored.
 */
public class LogManager {

	private static final Logger logger = LoggerFactory.getLogger(LogManager.class);

	private static final String FILE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level [%thread] %logger{36} - %msg%n";

	/**
	 * Log levels that can be selected from the command line.
	 */
	public static enum LogLevel {
		/**
		 * Everything, including per-task details
		 */
		TRACE,
		/**
		 * Filter timings and configuration
		 */
		DEBUG,
		/**
		 * Progress and results (the default)
		 */
		INFO,
		/**
		 * Warnings and errors only
		 */
		WARN,
		/**
		 * Errors only
		 */
		ERROR,
		/**
		 * No filtering of messages
		 */
		ALL,
		/**
		 * No messages at all
		 */
		OFF;
	}

	// Suppressed default constructor for non-instantiability
	private LogManager() {
		throw new AssertionError();
	}

	static Level getLevel(LogLevel logLevel) {
		switch (logLevel) {
		case TRACE:
			return Level.TRACE;
		case DEBUG:
			return Level.DEBUG;
		case WARN:
			return Level.WARN;
		case ERROR:
			return Level.ERROR;
		case ALL:
			return Level.ALL;
		case OFF:
			return Level.OFF;
		case INFO:
		default:
			return Level.INFO;
		}
	}

	/**
	 * Set the level of the root logger.
	 * @param logLevel
	 * @return true if the level was set, false if logback is not available
	 */
	public static boolean setRootLogLevel(LogLevel logLevel) {
		var root = getRootLogger();
		if (root == null) {
			logger.warn("Cannot set log level to {} without logback", logLevel);
			return false;
		}
		root.setLevel(getLevel(logLevel));
		return true;
	}

	/**
	 * Get the current level of the root logger.
	 * @return the level, or null if logback is not available
	 */
	public static LogLevel getRootLogLevel() {
		var root = getRootLogger();
		if (root == null || root.getLevel() == null)
			return null;
		return LogLevel.valueOf(root.getLevel().toString());
	}

	/**
	 * Send logging messages to a file, in addition to the existing destinations.
	 * @param file
	 * @return true if the file appender was added, false if logback is not available
	 */
	public static boolean logToFile(File file) {
		var context = getLoggerContext();
		if (context == null) {
			logger.warn("Cannot log to {} without logback", file);
			return false;
		}
		var encoder = new PatternLayoutEncoder();
		encoder.setContext(context);
		encoder.setPattern(FILE_PATTERN);
		encoder.start();

		var appender = new FileAppender<ILoggingEvent>();
		appender.setContext(context);
		appender.setName("file-" + file.getName());
		appender.setFile(file.getAbsolutePath());
		appender.setAppend(true);
		appender.setEncoder(encoder);
		appender.start();
		getRootLogger().addAppender(appender);
		logger.debug("Logging to {}", file.getAbsolutePath());
		return true;
	}

	static LoggerContext getLoggerContext() {
		if (LoggerFactory.getILoggerFactory() instanceof LoggerContext)
			return (LoggerContext)LoggerFactory.getILoggerFactory();
		return null;
	}

	static ch.qos.logback.classic.Logger getRootLogger() {
		var context = getLoggerContext();
		return context == null ? null : context.getLogger(Logger.ROOT_LOGGER_NAME);
	}

}
