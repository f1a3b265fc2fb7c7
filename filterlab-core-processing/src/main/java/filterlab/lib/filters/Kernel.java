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

import java.io.IOException;
import java.util.Arrays;
import java.util.Objects;

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.annotations.JsonAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import filterlab.lib.common.GeneralTools;

/**
 * A square matrix of weights, with an odd side length.
 * <p>
 * Weights are accessed with {@link #get(int, int)}, where the first index is the horizontal (x) position
 * and the second index the vertical (y) position.
 * The kernel origin is at {@code (radius, radius)}.
 * <p>
 * Kernels are immutable.
 * Normalization is not enforced: smoothing kernels created by {@link Kernels} sum to 1,
 * while kernels such as sharpening or gradient kernels do not.
 */
@JsonAdapter(Kernel.KernelTypeAdapter.class)
public final class Kernel {

	private final double[][] weights;
	private final int radius;

	private Kernel(double[][] weights) {
		this.weights = weights;
		this.radius = weights.length / 2;
	}

	/**
	 * Create a kernel from a matrix of weights, where {@code weights[i][j]} is the weight at horizontal index i
	 * and vertical index j.
	 * The array is copied.
	 * @param weights
	 * @return
	 * @throws IllegalArgumentException if the matrix is empty, not square, or does not have an odd side length
	 */
	public static Kernel create(double[][] weights) {
		Objects.requireNonNull(weights, "Kernel weights must not be null");
		int size = weights.length;
		if (size == 0)
			throw new IllegalArgumentException("Kernel must not be empty");
		if (size % 2 == 0)
			throw new IllegalArgumentException("Kernel size must be odd, but was " + size);
		double[][] copy = new double[size][];
		for (int i = 0; i < size; i++) {
			if (weights[i] == null || weights[i].length != size)
				throw new IllegalArgumentException("Kernel must be square, but row " + i + " has length " +
						(weights[i] == null ? 0 : weights[i].length) + " (expected " + size + ")");
			copy[i] = weights[i].clone();
		}
		return new Kernel(copy);
	}

	/**
	 * Create a kernel in which every weight has the same value.
	 * @param size side length; must be odd and &gt; 0
	 * @param value
	 * @return
	 */
	public static Kernel createConstant(int size, double value) {
		if (size <= 0 || size % 2 == 0)
			throw new IllegalArgumentException("Kernel size must be odd and > 0, but was " + size);
		double[][] weights = new double[size][size];
		for (double[] row : weights)
			Arrays.fill(row, value);
		return new Kernel(weights);
	}

	/**
	 * Get the side length of the kernel, i.e. {@code 2 * radius + 1}.
	 * @return
	 */
	public int getSize() {
		return weights.length;
	}

	/**
	 * Get the kernel radius, i.e. {@code size / 2}.
	 * @return
	 */
	public int getRadius() {
		return radius;
	}

	/**
	 * Get the weight at the specified indices.
	 * @param i horizontal index, in the range {@code [0, size)}
	 * @param j vertical index, in the range {@code [0, size)}
	 * @return
	 */
	public double get(int i, int j) {
		return weights[i][j];
	}

	/**
	 * Get the sum of all weights.
	 * @return
	 */
	public double sum() {
		double sum = 0;
		for (double[] row : weights) {
			for (double w : row)
				sum += w;
		}
		return sum;
	}

	/**
	 * Returns true if the weights sum to 1, within a small tolerance.
	 * @return
	 */
	public boolean isNormalized() {
		return GeneralTools.almostTheSame(sum(), 1.0, 1e-6);
	}

	/**
	 * Returns true if this kernel has the same size as another kernel.
	 * @param other
	 * @return
	 */
	public boolean sameSize(Kernel other) {
		return other != null && other.getSize() == getSize();
	}

	/**
	 * Get a copy of the weights.
	 * @return
	 */
	public double[][] toArray() {
		double[][] copy = new double[weights.length][];
		for (int i = 0; i < weights.length; i++)
			copy[i] = weights[i].clone();
		return copy;
	}

	@Override
	public int hashCode() {
		return Arrays.deepHashCode(weights);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Kernel))
			return false;
		return Arrays.deepEquals(weights, ((Kernel)obj).weights);
	}

	@Override
	public String toString() {
		return "Kernel " + getSize() + "x" + getSize() + " " + Arrays.deepToString(weights);
	}


	/**
	 * Write kernels as their weights, and validate the weights when reading.
	 */
	static class KernelTypeAdapter extends TypeAdapter<Kernel> {

		private static final Gson gson = new Gson();

		@Override
		public void write(JsonWriter out, Kernel kernel) throws IOException {
			if (kernel == null) {
				out.nullValue();
				return;
			}
			var obj = new JsonObject();
			obj.add("weights", gson.toJsonTree(kernel.weights));
			gson.toJson(obj, out);
		}

		@Override
		public Kernel read(JsonReader in) throws IOException {
			JsonObject obj = gson.fromJson(in, JsonObject.class);
			if (obj == null)
				return null;
			if (!obj.has("weights"))
				throw new JsonParseException("Kernel JSON has no weights: " + obj);
			try {
				return create(gson.fromJson(obj.get("weights"), double[][].class));
			} catch (IllegalArgumentException e) {
				throw new JsonParseException("Invalid kernel: " + e.getMessage(), e);
			}
		}

	}

}
