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

package filterlab.lib.common;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.event.Level;
import org.slf4j.helpers.MessageFormatter;

/**
 * Helper class for logging.
 * <p>
 * Filters are often created many times (e.g. once per image), so the methods here make it possible to
 * log a message the first time it occurs and stay silent afterwards.
 */
public class LogTools {

	private record LoggedMessage(String loggerName, Level level, String message) {}

	private static final Set<LoggedMessage> alreadyLogged = ConcurrentHashMap.newKeySet();

	/**
	 * Log a message once at the specified level.
	 * The message may contain {@code {}} placeholders, as used by slf4j; two messages are considered
	 * the same if they are the same after the arguments have been substituted.
	 *
	 * @param logger
	 * @param level
	 * @param message
	 * @param arguments
	 * @return true if the message was logged, false otherwise (i.e. it has already been logged)
	 */
	public static boolean logOnce(Logger logger, Level level, String message, Object... arguments) {
		String formatted = MessageFormatter.arrayFormat(message, arguments).getMessage();
		if (alreadyLogged.add(new LoggedMessage(logger.getName(), level, formatted))) {
			logger.atLevel(level).log(message, arguments);
			return true;
		}
		return false;
	}

	/**
	 * Log a message once at the INFO level.
	 *
	 * @param logger
	 * @param message
	 * @param arguments
	 * @return true if the message was logged, false otherwise
	 */
	public static boolean logOnce(Logger logger, String message, Object... arguments) {
		return logOnce(logger, Level.INFO, message, arguments);
	}

	/**
	 * Log a message once at the WARN level.
	 *
	 * @param logger
	 * @param message
	 * @param arguments
	 * @return true if the message was logged, false otherwise
	 */
	public static boolean warnOnce(Logger logger, String message, Object... arguments) {
		return logOnce(logger, Level.WARN, message, arguments);
	}

}
