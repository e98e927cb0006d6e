/*-
 * #%L
 * This file is part of AstroView.
 * %%
 * Copyright (C) 2025 AstroView developers
 * %%
 * AstroView is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * AstroView is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with AstroView.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package astroview.app.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;

/**
 * Manage logging levels for the command line launcher.
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

	private LogManager() {
		throw new AssertionError("This class is not instantiable.");
	}

	/**
	 * Set the level of the root logger.
	 * @param logLevel
	 * @return true if the level was set, false if Logback is not the active SLF4J backend
	 */
	public static boolean setRootLogLevel(LogLevel logLevel) {
		var root = getRootLogger();
		if (root == null) {
			logger.warn("Cannot get root logger!");
			return false;
		}
		root.setLevel(getLevel(logLevel));
		return true;
	}

	/**
	 * Get the level of the root logger.
	 * @return the current level, or null if Logback is not the active SLF4J backend
	 */
	public static LogLevel getRootLogLevel() {
		var root = getRootLogger();
		if (root == null || root.getLevel() == null)
			return null;
		return LogLevel.valueOf(root.getLevel().toString());
	}

	static Level getLevel(LogLevel logLevel) {
		if (logLevel == null)
			return Level.INFO;
		switch (logLevel) {
		case DEBUG:
			return Level.DEBUG;
		case ERROR:
			return Level.ERROR;
		case ALL:
			return Level.ALL;
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

	private static ch.qos.logback.classic.Logger getRootLogger() {
		if (LoggerFactory.getILoggerFactory() instanceof LoggerContext)
			return ((LoggerContext)LoggerFactory.getILoggerFactory()).getLogger(Logger.ROOT_LOGGER_NAME);
		return null;
	}

}
