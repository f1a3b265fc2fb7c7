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

import java.awt.Color;

/**
 * Static functions to help work with RGB colors using packed ints.
 * <p>
 * Packed values follow {@link Color#getRGB()}, i.e. {@code 0xAARRGGBB}.
 * FilterLab only ever stores opaque colors, so the alpha component is always 255.
 */
public final class ColorTools {

	// Suppressed default constructor for non-instantiability
	private ColorTools() {
		throw new AssertionError();
	}

	/**
	 * Opaque white, as a packed ARGB value.
	 */
	public static final int WHITE = packRGB(255, 255, 255);

	/**
	 * Opaque black, as a packed ARGB value. This is also used as the fill value for pixels
	 * that have no source location.
	 */
	public static final int BLACK = packRGB(0, 0, 0);

	/**
	 * Pack red, green and blue values into a single opaque ARGB int, as used by {@link Color#getRGB()}.
	 * <p>
	 * Only the lower 8 bits of each channel are kept; use {@link #packClippedRGB(int, int, int)}
	 * if the values may be out of range.
	 *
	 * @param r
	 * @param g
	 * @param b
	 * @return packed ARGB value
	 * @see #packClippedRGB(int, int, int)
	 */
	public static int packRGB(int r, int g, int b) {
		return 0xff000000 | ((r & 0xff) << 16) | ((g & 0xff) << 8) | (b & 0xff);
	}

	/**
	 * Pack red, green and blue values into an opaque ARGB int, after clipping each to 0-255.
	 *
	 * @param r
	 * @param g
	 * @param b
	 * @return packed ARGB value
	 */
	public static int packClippedRGB(int r, int g, int b) {
		return packRGB(do8BitRangeCheck(r), do8BitRangeCheck(g), do8BitRangeCheck(b));
	}

	/**
	 * Make a packed gray value, clipping to the range 0-255.
	 * @param v
	 * @return packed ARGB value with identical red, green and blue
	 */
	public static int packClippedGray(int v) {
		int c = do8BitRangeCheck(v);
		return packRGB(c, c, c);
	}

	/**
	 * Saturate a value to the 8-bit range 0-255.
	 *
	 * @param v
	 * @return
	 */
	public static int do8BitRangeCheck(int v) {
		return GeneralTools.clipValue(v, 0, 255);
	}

	/**
	 * Saturate a value to the 8-bit range 0-255, truncating any fractional part.
	 *
	 * @param v
	 * @return
	 */
	public static int do8BitRangeCheck(double v) {
		return (int)GeneralTools.clipValue(v, 0, 255);
	}

	/**
	 * Get the red channel (0-255) of a packed value.
	 *
	 * @param rgb
	 * @return
	 */
	public static int red(int rgb) {
		return rgb >>> 16 & 0xff;
	}

	/**
	 * Get the green channel (0-255) of a packed value.
	 *
	 * @param rgb
	 * @return
	 */
	public static int green(int rgb) {
		return rgb >>> 8 & 0xff;
	}

	/**
	 * Get the blue channel (0-255) of a packed value.
	 *
	 * @param rgb
	 * @return
	 */
	public static int blue(int rgb) {
		return rgb & 0xff;
	}

	/**
	 * Compute the luminosity of a packed RGB value, using the weights 0.299, 0.587 and 0.114.
	 *
	 * @param rgb
	 * @return
	 */
	public static double luminosity(int rgb) {
		return 0.299 * red(rgb) + 0.587 * green(rgb) + 0.114 * blue(rgb);
	}

	/**
	 * Compute the unweighted mean of the red, green and blue values of a packed RGB value.
	 *
	 * @param rgb
	 * @return
	 */
	public static double meanRGB(int rgb) {
		return (red(rgb) + green(rgb) + blue(rgb)) / 3.0;
	}

	/**
	 * Returns true if the red, green and blue components are all the same.
	 * @param rgb
	 * @return
	 */
	public static boolean isGray(int rgb) {
		int r = red(rgb);
		return r == green(rgb) && r == blue(rgb);
	}

}
