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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import filterlab.logging.LogManager.LogLevel;

@SuppressWarnings("javadoc")
public class TestLogManager {

	@AfterEach
	public void resetLevel() {
		LogManager.setRootLogLevel(LogLevel.INFO);
	}

	@ParameterizedTest
	@EnumSource(LogLevel.class)
	public void test_setRootLogLevel(LogLevel level) {
		assertTrue(LogManager.setRootLogLevel(level));
		assertEquals(level, LogManager.getRootLogLevel());
	}

	@Test
	public void test_levelMapping() {
		for (var level : LogLevel.values())
			assertEquals(level.name(), LogManager.getLevel(level).toString());
	}

}
