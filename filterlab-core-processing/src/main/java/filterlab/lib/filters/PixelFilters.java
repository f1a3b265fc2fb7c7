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

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.SplittableRandom;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonParseException;

import filterlab.lib.common.ColorTools;
import filterlab.lib.common.LogTools;
import filterlab.lib.images.PixelGrid;
import filterlab.lib.io.GsonTools;
import filterlab.lib.io.GsonTools.SubTypeAdapterFactory;

/**
 * Create and use {@link PixelTransform} filters.
 * <p>
 * Filters are grouped into three categories:
 * <ul>
 *   <li>{@link Point} filters use only the color of the pixel itself</li>
 *   <li>{@link Convolution} filters combine a neighborhood using one or two {@link Kernel}s</li>
 *   <li>{@link Geometric} filters copy the color from a different (remapped) location</li>
 * </ul>
 * Filters created here can be serialized to JSON with {@link #toJson(PixelTransform)}, and
 * default filters can be created by name with {@link #create(String)}.
 */
public class PixelFilters {

	private static final Logger logger = LoggerFactory.getLogger(PixelFilters.class);

	@Target(ElementType.TYPE)
	@Retention(RetentionPolicy.RUNTIME)
	private @interface FilterType {
		String value();
	}

	/**
	 * A filter with parameters that must be checked, both on construction and after reading from JSON.
	 */
	private interface ValidatedFilter extends PixelTransform {

		/**
		 * Check the parameters of the filter.
		 * @throws IllegalArgumentException if a parameter is invalid
		 * @throws NullPointerException if a required parameter is missing
		 */
		void validate();

	}

	private static final SubTypeAdapterFactory<PixelTransform> factory = GsonTools.createSubTypeAdapterFactory(PixelTransform.class, "type");

	private static final Map<String, Supplier<PixelTransform>> namedFilters = new LinkedHashMap<>();
	private static final Map<String, String> aliases = new LinkedHashMap<>();

	@SuppressWarnings("unchecked")
	private static void registerTypes(Class<?> cls, String base) {
		var annotation = cls.getAnnotation(FilterType.class);
		if (annotation != null) {
			base = base + "." + annotation.value();
			if (PixelTransform.class.isAssignableFrom(cls)) {
				factory.registerSubtype((Class<? extends PixelTransform>)cls, base);
			}
		}
		for (var c : cls.getDeclaredClasses()) {
			registerTypes(c, base);
		}
	}

	static {
		registerTypes(PixelFilters.class, "filter");
		factory.setValidator(PixelFilters::validate);
		GsonTools.getDefaultBuilder().registerTypeAdapterFactory(factory);

		namedFilters.put("invert", Point::invert);
		namedFilters.put("grayscale", Point::grayScale);
		namedFilters.put("sepia", Point::sepia);
		namedFilters.put("brightness", Point::brightness);
		namedFilters.put("blur", Convolution::blur);
		namedFilters.put("gaussian", Convolution::gaussian);
		namedFilters.put("sharpen", Convolution::sharpen);
		namedFilters.put("emboss", Convolution::emboss);
		namedFilters.put("sobel", Convolution::sobel);
		namedFilters.put("scharr", Convolution::scharr);
		namedFilters.put("prewitt", Convolution::prewitt);
		namedFilters.put("vertical-wave", Geometric::verticalWave);
		namedFilters.put("horizontal-wave", Geometric::horizontalWave);
		namedFilters.put("glass", Geometric::glass);
		namedFilters.put("rotation", Geometric::rotation);
		namedFilters.put("transfer", Geometric::transfer);

		aliases.put("gray", "grayscale");
		aliases.put("sharra", "scharr");
		aliases.put("pruitt", "prewitt");
		aliases.put("gauss", "gaussian");
	}

	private static void validate(PixelTransform transform) {
		if (transform instanceof ValidatedFilter)
			((ValidatedFilter)transform).validate();
	}

	/**
	 * Create a filter with default parameters from its name.
	 * Names are case-insensitive.
	 * @param name the filter name, as returned by {@link #getNames()}, or a recognized alias
	 * @return a new filter
	 * @throws IllegalArgumentException if the name is not recognized
	 */
	public static PixelTransform create(String name) {
		Objects.requireNonNull(name, "Filter name must not be null");
		String key = name.trim().toLowerCase(Locale.ROOT);
		key = aliases.getOrDefault(key, key);
		var supplier = namedFilters.get(key);
		if (supplier == null)
			throw new IllegalArgumentException("Unknown filter '" + name + "' - choose from " + String.join(", ", namedFilters.keySet()));
		return supplier.get();
	}

	/**
	 * Get the names of all filters that can be created with {@link #create(String)}.
	 * @return
	 */
	public static List<String> getNames() {
		return Collections.unmodifiableList(new ArrayList<>(namedFilters.keySet()));
	}

	/**
	 * Get the JSON type label of a filter.
	 * @param transform
	 * @return the label, or null if the transform is not a registered filter
	 */
	public static String getTypeLabel(PixelTransform transform) {
		return transform == null ? null : factory.getLabel(transform.getClass());
	}

	/**
	 * Serialize a filter to JSON.
	 * @param transform
	 * @param pretty if true, use pretty-printing
	 * @return
	 * @throws JsonParseException if the transform is not a registered filter type
	 */
	public static String toJson(PixelTransform transform, boolean pretty) {
		Objects.requireNonNull(transform, "Filter must not be null");
		return GsonTools.getInstance(pretty).toJson(transform, PixelTransform.class);
	}

	/**
	 * Serialize a filter to compact JSON.
	 * @param transform
	 * @return
	 */
	public static String toJson(PixelTransform transform) {
		return toJson(transform, false);
	}

	/**
	 * Create a filter from its JSON representation.
	 * @param json
	 * @return
	 * @throws JsonParseException if the JSON does not describe a valid filter
	 */
	public static PixelTransform fromJson(String json) {
		Objects.requireNonNull(json, "JSON must not be null");
		var transform = GsonTools.getInstance().fromJson(json, PixelTransform.class);
		if (transform == null)
			throw new JsonParseException("No filter found in JSON: " + json);
		logger.debug("Read filter {} from JSON", getTypeLabel(transform));
		return transform;
	}


	/**
	 * Filters that use only the color of the output pixel itself.
	 */
	@FilterType("point")
	public static class Point {

		/**
		 * Default brightness offset added by {@link #brightness()}.
		 */
		public static final int DEFAULT_BRIGHTNESS = 30;

		/**
		 * Default tint used by {@link #sepia()}.
		 */
		public static final double DEFAULT_SEPIA_TINT = 10;

		/**
		 * Replace each channel value v by 255-v.
		 * @return
		 */
		public static PixelTransform invert() {
			return new InvertFilter();
		}

		/**
		 * Replace each pixel by its luminosity {@code 0.299R + 0.587G + 0.114B}.
		 * @return
		 */
		public static PixelTransform grayScale() {
			return new GrayScaleFilter();
		}

		/**
		 * Apply a sepia tint with the default strength.
		 * @return
		 */
		public static PixelTransform sepia() {
			return sepia(DEFAULT_SEPIA_TINT);
		}

		/**
		 * Apply a sepia tint: starting from the luminosity I, output {@code (I+2k, I+0.5k, I-k)}.
		 * @param k tint strength
		 * @return
		 */
		public static PixelTransform sepia(double k) {
			return new SepiaFilter(k);
		}

		/**
		 * Increase the brightness by the default offset.
		 * @return
		 */
		public static PixelTransform brightness() {
			return brightness(DEFAULT_BRIGHTNESS);
		}

		/**
		 * Add a fixed offset to each channel.
		 * @param offset the offset; may be negative to darken the image
		 * @return
		 */
		public static PixelTransform brightness(int offset) {
			return new BrightnessFilter(offset);
		}

		@FilterType("invert")
		static class InvertFilter implements PixelTransform {

			@Override
			public int calculatePixel(PixelGrid source, int x, int y) {
				int rgb = source.getRGB(x, y);
				return ColorTools.packRGB(
						255 - ColorTools.red(rgb),
						255 - ColorTools.green(rgb),
						255 - ColorTools.blue(rgb));
			}

		}

		@FilterType("grayscale")
		static class GrayScaleFilter implements PixelTransform {

			@Override
			public int calculatePixel(PixelGrid source, int x, int y) {
				int gray = ColorTools.do8BitRangeCheck(ColorTools.luminosity(source.getRGB(x, y)));
				return ColorTools.packRGB(gray, gray, gray);
			}

		}

		@FilterType("sepia")
		static class SepiaFilter implements PixelTransform {

			private final double k;

			SepiaFilter(double k) {
				this.k = k;
			}

			@Override
			public int calculatePixel(PixelGrid source, int x, int y) {
				double intensity = ColorTools.luminosity(source.getRGB(x, y));
				return ColorTools.packRGB(
						ColorTools.do8BitRangeCheck(intensity + 2 * k),
						ColorTools.do8BitRangeCheck(intensity + 0.5 * k),
						ColorTools.do8BitRangeCheck(intensity - k));
			}

		}

		@FilterType("brightness")
		static class BrightnessFilter implements PixelTransform {

			private final int offset;

			BrightnessFilter(int offset) {
				this.offset = offset;
			}

			@Override
			public int calculatePixel(PixelGrid source, int x, int y) {
				int rgb = source.getRGB(x, y);
				return ColorTools.packClippedRGB(
						ColorTools.red(rgb) + offset,
						ColorTools.green(rgb) + offset,
						ColorTools.blue(rgb) + offset);
			}

		}

	}


	/**
	 * Filters that combine a neighborhood of pixels using one or two {@link Kernel}s.
	 * <p>
	 * Neighbors outside the image are replaced by the nearest border pixel.
	 */
	@FilterType("convolution")
	public static class Convolution {

		/**
		 * Default offset added by {@link #emboss()}, so that flat regions appear mid-gray.
		 */
		public static final double DEFAULT_EMBOSS_OFFSET = 128;

		/**
		 * Apply a kernel to each channel independently, sampling the full neighborhood.
		 * @param kernel
		 * @return
		 */
		public static PixelTransform filter2D(Kernel kernel) {
			return filter2D(kernel, KernelSampling.NEIGHBORHOOD);
		}

		/**
		 * Apply a kernel to each channel independently.
		 * @param kernel
		 * @param sampling determines which source rows are read
		 * @return
		 */
		public static PixelTransform filter2D(Kernel kernel, KernelSampling sampling) {
			return new MatrixFilter(kernel, sampling);
		}

		/**
		 * 3x3 box blur.
		 * @return
		 */
		public static PixelTransform blur() {
			return filter2D(Kernels.box(3));
		}

		/**
		 * Gaussian blur with radius 3 and sigma 2.
		 * @return
		 */
		public static PixelTransform gaussian() {
			return gaussian(Kernels.DEFAULT_GAUSSIAN_RADIUS, Kernels.DEFAULT_GAUSSIAN_SIGMA);
		}

		/**
		 * Gaussian blur.
		 * @param radius kernel radius; must be &gt;= 0
		 * @param sigma Gaussian sigma; must be &gt; 0
		 * @return
		 * @see Kernels#gaussian(int, double)
		 */
		public static PixelTransform gaussian(int radius, double sigma) {
			return filter2D(Kernels.gaussian(radius, sigma));
		}

		public static PixelTransform sharpen() {
			return filter2D(Kernels.sharpen());
		}

		/**
		 * Emboss filter, applied to the mean of the red, green and blue values and output as gray.
		 * @return
		 */
		public static PixelTransform emboss() {
			return new EmbossFilter(Kernels.emboss(), DEFAULT_EMBOSS_OFFSET);
		}

		/**
		 * Sobel edge detection, computed from the luminosity and output as gray.
		 * @return
		 */
		public static PixelTransform sobel() {
			return gradient(Kernels.sobelX(), Kernels.sobelY(), GradientMode.LUMINOSITY);
		}

		/**
		 * Scharr edge detection, computed for each channel independently.
		 * @return
		 */
		public static PixelTransform scharr() {
			return gradient(Kernels.scharrX(), Kernels.scharrY(), GradientMode.PER_CHANNEL);
		}

		/**
		 * Prewitt edge detection, computed for each channel independently.
		 * @return
		 */
		public static PixelTransform prewitt() {
			return gradient(Kernels.prewittX(), Kernels.prewittY(), GradientMode.PER_CHANNEL);
		}

		/**
		 * Gradient magnitude {@code sqrt(gx*gx + gy*gy)} from two directional kernels.
		 * @param kernelX
		 * @param kernelY
		 * @param mode
		 * @return
		 * @throws IllegalArgumentException if the kernels have different sizes
		 */
		public static PixelTransform gradient(Kernel kernelX, Kernel kernelY, GradientMode mode) {
			return new GradientFilter(kernelX, kernelY, mode);
		}

		private static int round8Bit(double value) {
			return ColorTools.do8BitRangeCheck((double)Math.round(value));
		}

		@FilterType("matrix")
		static class MatrixFilter implements ValidatedFilter {

			private static final Logger logger = LoggerFactory.getLogger(MatrixFilter.class);

			private final Kernel kernel;
			private final KernelSampling sampling;

			MatrixFilter(Kernel kernel, KernelSampling sampling) {
				this.kernel = kernel;
				this.sampling = sampling == null ? KernelSampling.NEIGHBORHOOD : sampling;
				validate();
			}

			@Override
			public void validate() {
				Objects.requireNonNull(kernel, "Kernel must not be null");
				if (getSampling() == KernelSampling.FIXED_ROW_OFFSET)
					LogTools.warnOnce(logger, "Matrix filter uses fixed row sampling - output will not be a true 2D convolution");
			}

			Kernel getKernel() {
				return kernel;
			}

			KernelSampling getSampling() {
				// May be null if read from JSON without a sampling field
				return sampling == null ? KernelSampling.NEIGHBORHOOD : sampling;
			}

			@Override
			public int calculatePixel(PixelGrid source, int x, int y) {
				int r = kernel.getRadius();
				boolean fixedRow = getSampling() == KernelSampling.FIXED_ROW_OFFSET;
				double red = 0, green = 0, blue = 0;
				for (int l = -r; l <= r; l++) {
					int yy = source.clipY(fixedRow ? y + 1 : y + l);
					for (int k = -r; k <= r; k++) {
						int rgb = source.getRGB(source.clipX(x + k), yy);
						double w = kernel.get(k + r, l + r);
						red += ColorTools.red(rgb) * w;
						green += ColorTools.green(rgb) * w;
						blue += ColorTools.blue(rgb) * w;
					}
				}
				return ColorTools.packRGB(round8Bit(red), round8Bit(green), round8Bit(blue));
			}

		}

		@FilterType("emboss")
		static class EmbossFilter implements ValidatedFilter {

			private final Kernel kernel;
			private final double offset;

			EmbossFilter(Kernel kernel, double offset) {
				this.kernel = kernel;
				this.offset = offset;
				validate();
			}

			@Override
			public void validate() {
				Objects.requireNonNull(kernel, "Kernel must not be null");
				if (!Double.isFinite(offset))
					throw new IllegalArgumentException("Emboss offset must be finite, but was " + offset);
			}

			@Override
			public int calculatePixel(PixelGrid source, int x, int y) {
				int r = kernel.getRadius();
				double brightness = 0;
				for (int l = -r; l <= r; l++) {
					int yy = source.clipY(y + l);
					for (int k = -r; k <= r; k++) {
						int rgb = source.getRGB(source.clipX(x + k), yy);
						brightness += ColorTools.meanRGB(rgb) * kernel.get(k + r, l + r);
					}
				}
				int gray = ColorTools.do8BitRangeCheck(brightness + offset);
				return ColorTools.packRGB(gray, gray, gray);
			}

		}

		@FilterType("gradient")
		static class GradientFilter implements ValidatedFilter {

			private final Kernel kernelX;
			private final Kernel kernelY;
			private final GradientMode mode;

			GradientFilter(Kernel kernelX, Kernel kernelY, GradientMode mode) {
				this.kernelX = kernelX;
				this.kernelY = kernelY;
				this.mode = mode;
				validate();
			}

			@Override
			public void validate() {
				Objects.requireNonNull(kernelX, "Horizontal kernel must not be null");
				Objects.requireNonNull(kernelY, "Vertical kernel must not be null");
				Objects.requireNonNull(mode, "Gradient mode must not be null");
				if (!kernelX.sameSize(kernelY))
					throw new IllegalArgumentException("Gradient kernels must have the same size, but sizes are " +
							kernelX.getSize() + " and " + kernelY.getSize());
			}

			@Override
			public int calculatePixel(PixelGrid source, int x, int y) {
				if (mode == GradientMode.LUMINOSITY)
					return calculateLuminosity(source, x, y);
				return calculatePerChannel(source, x, y);
			}

			private int calculateLuminosity(PixelGrid source, int x, int y) {
				int r = kernelX.getRadius();
				double gx = 0, gy = 0;
				for (int l = -r; l <= r; l++) {
					int yy = source.clipY(y + l);
					for (int k = -r; k <= r; k++) {
						double gray = ColorTools.luminosity(source.getRGB(source.clipX(x + k), yy));
						gx += gray * kernelX.get(k + r, l + r);
						gy += gray * kernelY.get(k + r, l + r);
					}
				}
				int magnitude = ColorTools.do8BitRangeCheck(Math.sqrt(gx * gx + gy * gy));
				return ColorTools.packRGB(magnitude, magnitude, magnitude);
			}

			private int calculatePerChannel(PixelGrid source, int x, int y) {
				int r = kernelX.getRadius();
				double redX = 0, greenX = 0, blueX = 0;
				double redY = 0, greenY = 0, blueY = 0;
				for (int l = -r; l <= r; l++) {
					int yy = source.clipY(y + l);
					for (int k = -r; k <= r; k++) {
						int rgb = source.getRGB(source.clipX(x + k), yy);
						int red = ColorTools.red(rgb);
						int green = ColorTools.green(rgb);
						int blue = ColorTools.blue(rgb);
						double wx = kernelX.get(k + r, l + r);
						double wy = kernelY.get(k + r, l + r);
						redX += red * wx;
						greenX += green * wx;
						blueX += blue * wx;
						redY += red * wy;
						greenY += green * wy;
						blueY += blue * wy;
					}
				}
				return ColorTools.packRGB(
						ColorTools.do8BitRangeCheck(Math.sqrt(redX * redX + redY * redY)),
						ColorTools.do8BitRangeCheck(Math.sqrt(greenX * greenX + greenY * greenY)),
						ColorTools.do8BitRangeCheck(Math.sqrt(blueX * blueX + blueY * blueY)));
			}

		}

	}


	/**
	 * Filters that copy the color of a remapped source location, without blending.
	 * <p>
	 * Remapped coordinates outside the image are replaced by the nearest border coordinate.
	 */
	@FilterType("geometric")
	public static class Geometric {

		/**
		 * Default wave amplitude, in pixels.
		 */
		public static final double DEFAULT_WAVE_AMPLITUDE = 20;

		/**
		 * Default wave period, in pixels.
		 */
		public static final double DEFAULT_WAVE_PERIOD = 60;

		/**
		 * Default maximum displacement of the glass filter, in pixels.
		 */
		public static final double DEFAULT_GLASS_SPREAD = 10;

		/**
		 * Default rotation angle, in radians.
		 */
		public static final double DEFAULT_ROTATION = 1.0;

		/**
		 * Default vertical shift, in pixels.
		 */
		public static final int DEFAULT_TRANSFER = 50;

		/**
		 * Shift columns horizontally, by an amount that varies sinusoidally with the row.
		 * @return
		 */
		public static PixelTransform verticalWave() {
			return new WaveFilter(WaveFilter.Direction.VERTICAL, DEFAULT_WAVE_AMPLITUDE, DEFAULT_WAVE_PERIOD);
		}

		/**
		 * Shift rows vertically, by an amount that varies sinusoidally with the column.
		 * @return
		 */
		public static PixelTransform horizontalWave() {
			return new WaveFilter(WaveFilter.Direction.HORIZONTAL, DEFAULT_WAVE_AMPLITUDE, DEFAULT_WAVE_PERIOD);
		}

		/**
		 * 'Frosted glass' effect, which copies each pixel from a random nearby location.
		 * The output is different each time the filter is applied.
		 * @return
		 */
		public static PixelTransform glass() {
			return new GlassFilter(null, null, DEFAULT_GLASS_SPREAD);
		}

		/**
		 * 'Frosted glass' effect with displacements determined by a seed.
		 * The displacement of each pixel depends only upon the seed and the pixel location,
		 * so the filter produces the same output each time it is applied to the same image
		 * (including when applied concurrently).
		 * @param seed
		 * @return
		 */
		public static PixelTransform glass(long seed) {
			return new GlassFilter(null, seed, DEFAULT_GLASS_SPREAD);
		}

		/**
		 * 'Frosted glass' effect using the specified random number generator.
		 * <p>
		 * The generator advances with every pixel, so this is intended as a one-shot filter:
		 * applying it again gives a different result. The generator is not retained if the filter is serialized.
		 * Use {@link #glass(long)} for reproducible output.
		 * @param random
		 * @return
		 */
		public static PixelTransform glass(Random random) {
			Objects.requireNonNull(random, "Random number generator must not be null");
			return new GlassFilter(random, null, DEFAULT_GLASS_SPREAD);
		}

		/**
		 * Rotate the image by 1 radian around its center.
		 * @return
		 */
		public static PixelTransform rotation() {
			return rotation(DEFAULT_ROTATION);
		}

		/**
		 * Rotate the image around its center.
		 * Output pixels that map onto the last row of the source image are set to black.
		 * @param angle rotation angle, in radians
		 * @return
		 */
		public static PixelTransform rotation(double angle) {
			return new RotationFilter(angle);
		}

		/**
		 * Shift the image up by 50 rows.
		 * @return
		 */
		public static PixelTransform transfer() {
			return transfer(DEFAULT_TRANSFER);
		}

		/**
		 * Shift the image vertically, so that output row y is read from source row y + shift.
		 * Output pixels that map onto the last row of the source image are set to black.
		 * @param shift
		 * @return
		 */
		public static PixelTransform transfer(int shift) {
			return new TransferFilter(shift);
		}

		@FilterType("wave")
		static class WaveFilter implements ValidatedFilter {

			enum Direction { VERTICAL, HORIZONTAL }

			private final Direction direction;
			private final double amplitude;
			private final double period;

			WaveFilter(Direction direction, double amplitude, double period) {
				this.direction = direction;
				this.amplitude = amplitude;
				this.period = period;
				validate();
			}

			@Override
			public void validate() {
				Objects.requireNonNull(direction, "Wave direction must not be null");
				if (!(period > 0) || Double.isInfinite(period))
					throw new IllegalArgumentException("Wave period must be finite and > 0, but was " + period);
				if (!Double.isFinite(amplitude))
					throw new IllegalArgumentException("Wave amplitude must be finite, but was " + amplitude);
			}

			private int displacement(int position) {
				return (int)(Math.sin(2 * Math.PI * position / period) * amplitude);
			}

			@Override
			public int calculatePixel(PixelGrid source, int x, int y) {
				if (direction == Direction.HORIZONTAL)
					return source.getRGB(x, source.clipY(y + displacement(x)));
				return source.getRGB(source.clipX(x + displacement(y)), y);
			}

		}

		@FilterType("glass")
		static class GlassFilter implements ValidatedFilter {

			private final Long seed;
			private final double spread;
			private final transient Random random;

			GlassFilter(Random random, Long seed, double spread) {
				this.seed = seed;
				this.spread = spread;
				this.random = random;
				validate();
			}

			@Override
			public void validate() {
				if (!(spread >= 0) || Double.isInfinite(spread))
					throw new IllegalArgumentException("Glass spread must be finite and >= 0, but was " + spread);
			}

			private int offset(double value) {
				return (int)(value * 2 * spread - spread);
			}

			@Override
			public int calculatePixel(PixelGrid source, int x, int y) {
				int dx, dy;
				if (seed != null) {
					var rand = new SplittableRandom(pixelSeed(seed, x, y));
					dx = offset(rand.nextDouble());
					dy = offset(rand.nextDouble());
				} else {
					Random rand = random == null ? ThreadLocalRandom.current() : random;
					dx = offset(rand.nextDouble());
					dy = offset(rand.nextDouble());
				}
				return source.getRGB(source.clipX(x + dx), source.clipY(y + dy));
			}

			private static long pixelSeed(long seed, int x, int y) {
				long location = ((long)x << 32) | (y & 0xffffffffL);
				return seed + 0x9E3779B97F4A7C15L * (location + 1);
			}

		}

		@FilterType("rotation")
		static class RotationFilter implements ValidatedFilter {

			private final double angle;

			RotationFilter(double angle) {
				this.angle = angle;
				validate();
			}

			@Override
			public void validate() {
				if (!Double.isFinite(angle))
					throw new IllegalArgumentException("Rotation angle must be finite, but was " + angle);
			}

			@Override
			public int calculatePixel(PixelGrid source, int x, int y) {
				int x0 = source.getWidth() / 2;
				int y0 = source.getHeight() / 2;
				double cos = Math.cos(angle);
				double sin = Math.sin(angle);
				int xx = source.clipX((int)((x - x0) * cos - (y - y0) * sin) + x0);
				int yy = source.clipY((int)((x - x0) * sin + (y - y0) * cos) + y0);
				if (yy == source.getHeight() - 1)
					return ColorTools.BLACK;
				return source.getRGB(xx, yy);
			}

		}

		@FilterType("transfer")
		static class TransferFilter implements PixelTransform {

			private final int shift;

			TransferFilter(int shift) {
				this.shift = shift;
			}

			@Override
			public int calculatePixel(PixelGrid source, int x, int y) {
				int yy = source.clipY(y + shift);
				if (yy == source.getHeight() - 1)
					return ColorTools.BLACK;
				return source.getRGB(x, yy);
			}

		}

	}

}
