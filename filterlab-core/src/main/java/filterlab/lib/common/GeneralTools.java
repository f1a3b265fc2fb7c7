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

import java.io.File;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import org.apache.commons.math3.util.Precision;

/**
 * Collection of generally useful static methods.
 */
public final class GeneralTools {

	// Suppressed default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}

	/**
	 * Get the extension of a file, including the dot, converted to lower case.
	 * @param file
	 * @return
	 * @see #getExtension(String)
	 */
	public static Optional<String> getExtension(File file) {
		Objects.requireNonNull(file, "File must not be null");
		return getExtension(file.getName());
	}

	/**
	 * Get the extension from a filename, i.e. the final dot followed by one or more word characters.
	 * The extension is returned in lower case, with the dot as its first character.
	 * <p>
	 * Names without a dot, ending with a dot, or where the text after the final dot contains
	 * anything other than word characters (e.g. spaces) are considered to have no extension.
	 *
	 * @param name
	 * @return
	 * @see #getNameWithoutExtension(String)
	 */
	public static Optional<String> getExtension(String name) {
		Objects.requireNonNull(name, "Name must not be null");
		int ind = name.lastIndexOf('.');
		if (ind < 0)
			return Optional.empty();
		String ext = name.substring(ind);
		if (!EXTENSION_PATTERN.matcher(ext).matches())
			return Optional.empty();
		return Optional.of(ext.toLowerCase(Locale.ROOT));
	}

	private static final Pattern EXTENSION_PATTERN = Pattern.compile("\\.\\w+");

	/**
	 * Strip the extension (if any) from a filename.
	 * @param name
	 * @return
	 * @see #getExtension(String)
	 */
	public static String getNameWithoutExtension(String name) {
		return getExtension(name)
				.map(ext -> name.substring(0, name.length() - ext.length()))
				.orElse(name);
	}

	/**
	 * Clip a value to be within a specific range.
	 * <p>
	 * This is the boundary policy used for neighborhood sampling:
	 * coordinates beyond the image border are pulled back to the nearest border pixel.
	 *
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static int clipValue(final int value, final int min, final int max) {
		return Math.max(min, Math.min(max, value));
	}

	/**
	 * Clip a value to be within a specific range.
	 *
	 * @param value
	 * @param min
	 * @param max
	 * @return
	 */
	public static double clipValue(final double value, final double min, final double max) {
		return value < min ? min : (value > max ? max : value);
	}

	/**
	 * Test if two doubles are approximately equal, within a specified relative tolerance.
	 *
	 * @param n1
	 * @param n2
	 * @param tolerance
	 * @return
	 */
	public static boolean almostTheSame(double n1, double n2, double tolerance) {
		return Precision.equalsWithRelativeTolerance(n1, n2, tolerance);
	}

}
