/*-
 * #%L
 * This file is part of StainNorm.
 * %%
 * Copyright (C) 2024 StainNorm developers
 * %%
 * StainNorm is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * StainNorm is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with StainNorm.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package stainnorm.app.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;

/**
 * Manage logging levels.
 */
public class LogManager {

	private static final Logger logger = LoggerFactory.getLogger(LogManager.class);

	/**
	 * Available log levels.
	 */
	public static enum LogLevel {
		/**
		 * Trace logging (an awful lot of messages)
		 */
		TRACE,
		/**
		 * Debug logging (a lot of messages)
		 */
		DEBUG,
		/**
		 * Info logging (default)
		 */
		INFO,
		/**
		 * Warn logging (only if something is moderately important)
		 */
		WARN,
		/**
		 * Error logging (only if something goes recognizably wrong)
		 */
		ERROR,
		/**
		 * All log messages
		 */
		ALL,
		/**
		 * Turn off logging
		 */
		OFF;
	}

	// Suppressed default constructor for non-instantiability
	private LogManager() {
		throw new AssertionError();
	}

	/**
	 * Set the log level for the root logger.
	 * @param level
	 */
	public static void setRootLogLevel(LogLevel level) {
		var root = getRootLogger();
		if (root != null)
			root.setLevel(getLevel(level));
		else
			logger.warn("Cannot get root logger!");
	}

	/**
	 * Get the log level of the root logger.
	 * @return the level, or null if it cannot be determined
	 */
	public static LogLevel getRootLogLevel() {
		var root = getRootLogger();
		if (root == null || root.getLevel() == null)
			return null;
		var level = root.getLevel();
		if (level == Level.ALL)
			return LogLevel.ALL;
		if (level == Level.OFF)
			return LogLevel.OFF;
		return LogLevel.valueOf(level.toString());
	}

	static Level getLevel(LogLevel logLevel) {
		switch (logLevel) {
		case ALL:
			return Level.ALL;
		case DEBUG:
			return Level.DEBUG;
		case ERROR:
			return Level.ERROR;
		case OFF:
			return Level.OFF;
		case TRACE:
			return Level.TRACE;
		case WARN:
			return Level.WARN;
		case INFO:
		default:
			return Level.INFO;
		}
	}

	static LoggerContext getLoggerContext() {
		if (LoggerFactory.getILoggerFactory() instanceof LoggerContext) {
			return (LoggerContext)LoggerFactory.getILoggerFactory();
		} else
			return null;
	}

	static ch.qos.logback.classic.Logger getRootLogger() {
		var context = getLoggerContext();
		return context == null ? null : context.getLogger(Logger.ROOT_LOGGER_NAME);
	}

}
