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

package filterlab.lib.images;

import java.util.Arrays;

import filterlab.lib.common.ColorTools;
import filterlab.lib.common.GeneralTools;

/**
 * A simple 2D grid of 8-bit RGB pixels, stored as packed ints.
 * <p>
 * Pixels are accessed by {@code (x, y)} coordinates, where x is the column and y the row.
 * Every stored value is opaque; any alpha supplied when setting a pixel is replaced by 255.
 * <p>
 * A grid may have zero width or height, in which case it contains no pixels.
 * <p>
 * PixelGrid is not thread-safe for writing. When used as the source of a filtering operation
 * it must not be modified until the operation has finished.
 */
public final class PixelGrid {

	private final int width;
	private final int height;
	private final int[] rgb;

	private PixelGrid(int width, int height, int[] rgb) {
		this.width = width;
		this.height = height;
		this.rgb = rgb;
	}

	/**
	 * Create a new grid with all pixels set to black.
	 * @param width
	 * @param height
	 * @return
	 * @throws IllegalArgumentException if the width or height is negative
	 */
	public static PixelGrid create(int width, int height) {
		checkDimensions(width, height);
		int[] rgb = new int[Math.multiplyExact(width, height)];
		Arrays.fill(rgb, ColorTools.BLACK);
		return new PixelGrid(width, height, rgb);
	}

	/**
	 * Create a new grid with all pixels set to the same color.
	 * @param width
	 * @param height
	 * @param rgb packed RGB value
	 * @return
	 */
	public static PixelGrid createFilled(int width, int height, int rgb) {
		var grid = create(width, height);
		Arrays.fill(grid.rgb, opaque(rgb));
		return grid;
	}

	/**
	 * Create a new grid from an array of packed RGB values, stored row by row.
	 * The array is copied.
	 * @param width
	 * @param height
	 * @param rgb
	 * @return
	 * @throws IllegalArgumentException if the array length does not match the dimensions
	 */
	public static PixelGrid fromRGB(int width, int height, int[] rgb) {
		checkDimensions(width, height);
		if (rgb.length != width * height)
			throw new IllegalArgumentException("Expected " + (width * height) + " pixels for a " + width + "x" + height + " grid, but array length is " + rgb.length);
		int[] values = new int[rgb.length];
		for (int i = 0; i < rgb.length; i++)
			values[i] = opaque(rgb[i]);
		return new PixelGrid(width, height, values);
	}

	private static void checkDimensions(int width, int height) {
		if (width < 0 || height < 0)
			throw new IllegalArgumentException("Grid dimensions must be >= 0, but requested " + width + "x" + height);
	}

	private static int opaque(int rgb) {
		return rgb | 0xff000000;
	}

	/**
	 * Get the grid width, i.e. the number of columns.
	 * @return
	 */
	public int getWidth() {
		return width;
	}

	/**
	 * Get the grid height, i.e. the number of rows.
	 * @return
	 */
	public int getHeight() {
		return height;
	}

	/**
	 * Returns true if the grid contains no pixels.
	 * @return
	 */
	public boolean isEmpty() {
		return width == 0 || height == 0;
	}

	/**
	 * Returns true if the coordinate lies inside the grid.
	 * @param x
	 * @param y
	 * @return
	 */
	public boolean contains(int x, int y) {
		return x >= 0 && y >= 0 && x < width && y < height;
	}

	/**
	 * Get the packed RGB value at the specified location.
	 * @param x
	 * @param y
	 * @return
	 * @throws IndexOutOfBoundsException if the coordinate is outside the grid
	 */
	public int getRGB(int x, int y) {
		return rgb[index(x, y)];
	}

	/**
	 * Get the packed RGB value at the nearest location inside the grid.
	 * Coordinates beyond the border are clipped, so that border pixels are replicated.
	 * @param x
	 * @param y
	 * @return
	 * @throws IndexOutOfBoundsException if the grid is empty
	 */
	public int getClippedRGB(int x, int y) {
		return getRGB(clipX(x), clipY(y));
	}

	/**
	 * Clip an x coordinate to the range {@code [0, width-1]}.
	 * @param x
	 * @return
	 */
	public int clipX(int x) {
		return GeneralTools.clipValue(x, 0, width - 1);
	}

	/**
	 * Clip a y coordinate to the range {@code [0, height-1]}.
	 * @param y
	 * @return
	 */
	public int clipY(int y) {
		return GeneralTools.clipValue(y, 0, height - 1);
	}

	/**
	 * Set the packed RGB value at the specified location.
	 * @param x
	 * @param y
	 * @param rgb
	 * @throws IndexOutOfBoundsException if the coordinate is outside the grid
	 */
	public void setRGB(int x, int y, int rgb) {
		this.rgb[index(x, y)] = opaque(rgb);
	}

	public int getRed(int x, int y) {
		return ColorTools.red(getRGB(x, y));
	}

	public int getGreen(int x, int y) {
		return ColorTools.green(getRGB(x, y));
	}

	public int getBlue(int x, int y) {
		return ColorTools.blue(getRGB(x, y));
	}

	/**
	 * Get a copy of all packed RGB values, stored row by row.
	 * @return
	 */
	public int[] getRGB() {
		return rgb.clone();
	}

	/**
	 * Create a deep copy of this grid.
	 * @return
	 */
	public PixelGrid duplicate() {
		return new PixelGrid(width, height, rgb.clone());
	}

	private int index(int x, int y) {
		if (!contains(x, y))
			throw new IndexOutOfBoundsException("Pixel (" + x + ", " + y + ") is outside a " + width + "x" + height + " grid");
		return y * width + x;
	}

	@Override
	public int hashCode() {
		return 31 * (31 * width + height) + Arrays.hashCode(rgb);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof PixelGrid))
			return false;
		PixelGrid other = (PixelGrid)obj;
		return width == other.width && height == other.height && Arrays.equals(rgb, other.rgb);
	}

	@Override
	public String toString() {
		return "PixelGrid [" + width + "x" + height + "]";
	}

}
