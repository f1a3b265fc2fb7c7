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
 * Create commonly-used {@link Kernel}s.
 * <p>
 * Matrices are written with the first index as the horizontal offset,
 * so each inner array literal below is a column of the kernel.
 */
public final class Kernels {

	// Suppressed default constructor for non-instantiability
	private Kernels() {
		throw new AssertionError();
	}

	/**
	 * Default Gaussian radius.
	 */
	public static final int DEFAULT_GAUSSIAN_RADIUS = 3;

	/**
	 * Default Gaussian sigma.
	 */
	public static final double DEFAULT_GAUSSIAN_SIGMA = 2.0;

	/**
	 * Create a box (mean) kernel in which all weights are {@code 1/(size*size)}.
	 * @param size
	 * @return
	 */
	public static Kernel box(int size) {
		if (size <= 0 || size % 2 == 0)
			throw new IllegalArgumentException("Box kernel size must be odd and > 0, but was " + size);
		return Kernel.createConstant(size, 1.0 / (size * size));
	}

	/**
	 * Create a normalized 2D Gaussian kernel.
	 * The weight at offset {@code (i, j)} is proportional to {@code exp(-(i*i + j*j) / (2*sigma*sigma))},
	 * and all weights are divided by their sum.
	 * @param radius kernel radius (size is {@code 2*radius+1}); must be &gt;= 0
	 * @param sigma Gaussian sigma; must be &gt; 0
	 * @return
	 */
	public static Kernel gaussian(int radius, double sigma) {
		if (radius < 0)
			throw new IllegalArgumentException("Gaussian radius must be >= 0, but was " + radius);
		if (!(sigma > 0) || Double.isInfinite(sigma))
			throw new IllegalArgumentException("Gaussian sigma must be finite and > 0, but was " + sigma);
		int size = 2 * radius + 1;
		double[][] weights = new double[size][size];
		double twoSigmaSq = 2 * sigma * sigma;
		double norm = 0;
		for (int i = -radius; i <= radius; i++) {
			for (int j = -radius; j <= radius; j++) {
				double w = Math.exp(-(i * i + j * j) / twoSigmaSq);
				weights[i + radius][j + radius] = w;
				norm += w;
			}
		}
		for (int i = 0; i < size; i++) {
			for (int j = 0; j < size; j++)
				weights[i][j] /= norm;
		}
		return Kernel.create(weights);
	}

	public static Kernel sharpen() {
		return Kernel.create(new double[][] {
			{ 0, -1, 0 },
			{ -1, 5, -1 },
			{ 0, -1, 0 }
		});
	}

	public static Kernel emboss() {
		return Kernel.create(new double[][] {
			{ 0, 1, 0 },
			{ 1, 0, -1 },
			{ 0, -1, 0 }
		});
	}

	public static Kernel sobelX() {
		return Kernel.create(new double[][] {
			{ -1, 0, 1 },
			{ -2, 0, 2 },
			{ -1, 0, 1 }
		});
	}

	public static Kernel sobelY() {
		return Kernel.create(new double[][] {
			{ -1, -2, -1 },
			{ 0, 0, 0 },
			{ 1, 2, 1 }
		});
	}

	public static Kernel scharrX() {
		return Kernel.create(new double[][] {
			{ 3, 0, -3 },
			{ 10, 0, -10 },
			{ 3, 0, -3 }
		});
	}

	public static Kernel scharrY() {
		return Kernel.create(new double[][] {
			{ 3, 10, 3 },
			{ 0, 0, 0 },
			{ -3, -10, -3 }
		});
	}

	public static Kernel prewittX() {
		return Kernel.create(new double[][] {
			{ -1, 0, 1 },
			{ -1, 0, 1 },
			{ -1, 0, 1 }
		});
	}

	public static Kernel prewittY() {
		return Kernel.create(new double[][] {
			{ -1, -1, -1 },
			{ 0, 0, 0 },
			{ 1, 1, 1 }
		});
	}

}
