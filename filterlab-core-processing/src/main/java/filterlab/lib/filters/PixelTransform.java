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

import filterlab.lib.images.PixelGrid;
import filterlab.lib.processing.PixelProcessor;

/**
 * A transform that computes the color of a single output pixel.
 * <p>
 * Implementations only answer the question "what color goes at this point?";
 * iterating over the image, progress and cancellation are handled by {@link PixelProcessor}.
 * <p>
 * Implementations must not modify the source grid, and must only read pixels inside it
 * (typically by clipping coordinates with {@link PixelGrid#clipX(int)} and {@link PixelGrid#clipY(int)}).
 *
 * @see PixelFilters
 */
@FunctionalInterface
public interface PixelTransform {

	/**
	 * Calculate the output color at the specified location.
	 *
	 * @param source the source image; this must not be modified
	 * @param x the column of the output pixel, in the range {@code [0, source.getWidth())}
	 * @param y the row of the output pixel, in the range {@code [0, source.getHeight())}
	 * @return packed RGB value for the output pixel
	 */
	public int calculatePixel(PixelGrid source, int x, int y);

}
