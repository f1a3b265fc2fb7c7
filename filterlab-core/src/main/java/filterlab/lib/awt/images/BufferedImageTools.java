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

package filterlab.lib.awt.images;

import java.awt.image.BufferedImage;
import java.util.Objects;

import filterlab.lib.images.PixelGrid;

/**
 * Static methods to convert between {@link BufferedImage} and {@link PixelGrid}.
 * <p>
 * Conversion goes through {@link BufferedImage#getRGB(int, int, int, int, int[], int, int)},
 * so any color model supported by Java2D can be read. Alpha is discarded.
 */
public final class BufferedImageTools {

	// Suppressed default constructor for non-instantiability
	private BufferedImageTools() {
		throw new AssertionError();
	}

	/**
	 * Convert an image to a grid of RGB values.
	 * @param img
	 * @return a new grid, sharing no data with the image
	 */
	public static PixelGrid toPixelGrid(BufferedImage img) {
		Objects.requireNonNull(img, "Image must not be null");
		int w = img.getWidth();
		int h = img.getHeight();
		int[] rgb = img.getRGB(0, 0, w, h, null, 0, w);
		return PixelGrid.fromRGB(w, h, rgb);
	}

	/**
	 * Convert a grid to an image of type {@link BufferedImage#TYPE_INT_RGB}.
	 * @param grid
	 * @return a new image
	 * @throws IllegalArgumentException if the grid is empty, since Java2D does not support empty images
	 */
	public static BufferedImage toBufferedImage(PixelGrid grid) {
		Objects.requireNonNull(grid, "Grid must not be null");
		if (grid.isEmpty())
			throw new IllegalArgumentException("Cannot create a BufferedImage from an empty grid");
		int w = grid.getWidth();
		int h = grid.getHeight();
		var img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
		img.setRGB(0, 0, w, h, grid.getRGB(), 0, w);
		return img;
	}

}
