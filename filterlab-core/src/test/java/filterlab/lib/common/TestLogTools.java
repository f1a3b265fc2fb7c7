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

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

@SuppressWarnings("javadoc")
public class TestLogTools {

	private static final Logger logger = LoggerFactory.getLogger(TestLogTools.class);

	@Test
	public void test_logOnce() {
		assertTrue(LogTools.warnOnce(logger, "Logged once as a warning"));
		assertFalse(LogTools.warnOnce(logger, "Logged once as a warning"));

		// Same message at a different level is logged again
		assertTrue(LogTools.logOnce(logger, "Logged once as a warning"));
		assertFalse(LogTools.logOnce(logger, Level.INFO, "Logged once as a warning"));

		assertTrue(LogTools.logOnce(logger, Level.DEBUG, "Another message"));

		// Messages are compared after formatting
		assertTrue(LogTools.warnOnce(logger, "Kernel size {}", 3));
		assertFalse(LogTools.warnOnce(logger, "Kernel size 3"));
		assertTrue(LogTools.warnOnce(logger, "Kernel size {}", 5));

		// Messages are tracked per logger
		var other = LoggerFactory.getLogger(TestLogTools.class.getName() + ".other");
		assertTrue(LogTools.warnOnce(other, "Logged once as a warning"));
	}

}
