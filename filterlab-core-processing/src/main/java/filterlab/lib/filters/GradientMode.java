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

package filterlab.lib.filters;

/**
 * Defines how a gradient magnitude is computed from an RGB neighborhood.
 */
public enum GradientMode {

	/**
	 * Convert each neighbor to luminosity, compute a single magnitude and output it as a gray value.
	 */
	LUMINOSITY,

	/**
	 * Compute the magnitude independently for the red, green and blue channels.
	 */
	PER_CHANNEL;

}
