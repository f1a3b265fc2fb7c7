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
 * Defines which source rows are read when applying a single kernel.
 */
public enum KernelSampling {

	/**
	 * Sample the full neighborhood, i.e. the pixel at {@code (x+k, y+l)} is multiplied by the weight at
	 * {@code (k+r, l+r)}.
	 */
	NEIGHBORHOOD,

	/**
	 * Sample only the row below the output pixel, i.e. the pixel at {@code (x+k, y+1)} is multiplied by the
	 * weight at {@code (k+r, l+r)} for every {@code l}.
	 * <p>
	 * This reproduces the output of earlier versions of the matrix filter, which did not use the vertical
	 * kernel offset when sampling. It should only be used where identical output to those versions is required.
	 */
	FIXED_ROW_OFFSET;

}
