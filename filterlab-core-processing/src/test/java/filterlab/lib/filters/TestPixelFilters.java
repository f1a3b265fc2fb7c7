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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.google.gson.JsonParseException;

import filterlab.lib.common.ColorTools;
import filterlab.lib.images.PixelGrid;
import filterlab.lib.io.GsonTools;
import filterlab.lib.plugins.SimpleProgressMonitor;
import filterlab.lib.processing.PixelProcessor;

@SuppressWarnings("javadoc")
public class TestPixelFilters {

	private static PixelGrid apply(PixelGrid source, PixelTransform transform) {
		return PixelProcessor.process(source, transform, SimpleProgressMonitor.silent()).orElseThrow();
	}

	private static PixelGrid createRandomGrid(int width, int height, long seed) {
		var rand = new Random(seed);
		var grid = PixelGrid.create(width, height);
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++)
				grid.setRGB(x, y, ColorTools.packRGB(rand.nextInt(256), rand.nextInt(256), rand.nextInt(256)));
		}
		return grid;
	}

	/**
	 * Create a grid in which each row has a different gray value.
	 */
	private static PixelGrid createRowGrid(int width, int height, int step) {
		var grid = PixelGrid.create(width, height);
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++)
				grid.setRGB(x, y, ColorTools.packClippedGray(y * step));
		}
		return grid;
	}

	/**
	 * Create a grid with random interior values, surrounded by a two-pixel border of a single sentinel color.
	 */
	private static PixelGrid createBorderedGrid(int width, int height, int sentinel, long seed) {
		var grid = createRandomGrid(width, height, seed);
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				if (x < 2 || y < 2 || x >= width - 2 || y >= height - 2)
					grid.setRGB(x, y, sentinel);
			}
		}
		return grid;
	}

	private static void assertOuterPixels(PixelGrid grid, int expected, String name) {
		for (int y = 0; y < grid.getHeight(); y++) {
			for (int x = 0; x < grid.getWidth(); x++) {
				if (x == 0 || y == 0 || x == grid.getWidth() - 1 || y == grid.getHeight() - 1)
					assertEquals(expected, grid.getRGB(x, y), name + " at (" + x + ", " + y + ")");
			}
		}
	}

	static List<String> filterNames() {
		return PixelFilters.getNames();
	}

	/**
	 * Filters with non-default parameters, covering every serializable type.
	 */
	static List<PixelTransform> parameterizedFilters() {
		var filters = new ArrayList<PixelTransform>();
		for (var name : PixelFilters.getNames()) {
			if (!"glass".equals(name))
				filters.add(PixelFilters.create(name));
		}
		filters.add(PixelFilters.Point.sepia(25));
		filters.add(PixelFilters.Point.brightness(-40));
		filters.add(PixelFilters.Convolution.gaussian(2, 0.8));
		filters.add(PixelFilters.Convolution.filter2D(Kernels.sharpen(), KernelSampling.FIXED_ROW_OFFSET));
		filters.add(PixelFilters.Convolution.gradient(Kernels.scharrX(), Kernels.scharrY(), GradientMode.LUMINOSITY));
		filters.add(PixelFilters.Geometric.glass(7L));
		filters.add(PixelFilters.Geometric.rotation(-0.5));
		filters.add(PixelFilters.Geometric.transfer(-3));
		return filters;
	}

	@ParameterizedTest
	@MethodSource("filterNames")
	public void test_sizeAndRange(String name) {
		var source = createRandomGrid(17, 13, 1L);
		var copy = source.duplicate();
		var result = apply(source, PixelFilters.create(name));
		assertEquals(source.getWidth(), result.getWidth());
		assertEquals(source.getHeight(), result.getHeight());
		for (int rgb : result.getRGB())
			assertEquals(255, rgb >>> 24);
		// Source must be unchanged
		assertEquals(copy, source);
	}

	@ParameterizedTest
	@MethodSource("filterNames")
	public void test_tinyGrids(String name) {
		// Any read outside the grid would throw an IndexOutOfBoundsException
		for (int[] size : new int[][] {{1, 1}, {1, 3}, {3, 1}, {2, 2}, {2, 3}}) {
			var source = createRandomGrid(size[0], size[1], 2L);
			var result = apply(source, PixelFilters.create(name));
			assertEquals(size[0], result.getWidth());
			assertEquals(size[1], result.getHeight());
		}
	}

	@Test
	public void test_sentinelBorder() {
		int sentinel = ColorTools.packRGB(250, 10, 130);
		var source = createBorderedGrid(12, 9, sentinel, 11L);

		// With clamping, the neighborhood of an outer pixel contains only the sentinel
		assertOuterPixels(apply(source, PixelFilters.Convolution.blur()), sentinel, "blur");
		assertOuterPixels(apply(source, PixelFilters.Convolution.sharpen()), sentinel, "sharpen");
		assertOuterPixels(apply(source, PixelFilters.Convolution.emboss()), ColorTools.packRGB(128, 128, 128), "emboss");
		assertOuterPixels(apply(source, PixelFilters.Convolution.sobel()), ColorTools.BLACK, "sobel");
		assertOuterPixels(apply(source, PixelFilters.Convolution.scharr()), ColorTools.BLACK, "scharr");
		assertOuterPixels(apply(source, PixelFilters.Convolution.prewitt()), ColorTools.BLACK, "prewitt");

		// Remapping filters may only copy colors found in the source
		Set<Integer> colors = new HashSet<>();
		for (int rgb : source.getRGB())
			colors.add(rgb);
		for (var transform : List.of(
				PixelFilters.Geometric.verticalWave(),
				PixelFilters.Geometric.horizontalWave(),
				PixelFilters.Geometric.glass(3L))) {
			for (int rgb : apply(source, transform).getRGB())
				assertTrue(colors.contains(rgb), () -> "Unexpected color from " + PixelFilters.getTypeLabel(transform));
		}
	}

	@Test
	public void test_invert() {
		var single = PixelGrid.createFilled(1, 1, ColorTools.packRGB(10, 20, 30));
		assertEquals(ColorTools.packRGB(245, 235, 225), apply(single, PixelFilters.Point.invert()).getRGB(0, 0));

		var source = createRandomGrid(11, 7, 3L);
		var twice = apply(apply(source, PixelFilters.Point.invert()), PixelFilters.Point.invert());
		assertEquals(source, twice);
	}

	@Test
	public void test_grayScale() {
		var single = PixelGrid.createFilled(1, 1, ColorTools.packRGB(100, 150, 200));
		assertEquals(ColorTools.packRGB(140, 140, 140), apply(single, PixelFilters.Point.grayScale()).getRGB(0, 0));

		var result = apply(createRandomGrid(11, 7, 4L), PixelFilters.Point.grayScale());
		for (int rgb : result.getRGB())
			assertTrue(ColorTools.isGray(rgb));
	}

	@Test
	public void test_sepia() {
		var single = PixelGrid.createFilled(1, 1, ColorTools.packRGB(100, 100, 100));
		assertEquals(ColorTools.packRGB(120, 105, 90), apply(single, PixelFilters.Point.sepia()).getRGB(0, 0));

		var white = PixelGrid.createFilled(1, 1, ColorTools.WHITE);
		assertEquals(ColorTools.packRGB(255, 255, 245), apply(white, PixelFilters.Point.sepia()).getRGB(0, 0));
	}

	@Test
	public void test_brightness() {
		var single = PixelGrid.createFilled(1, 1, ColorTools.packRGB(10, 20, 250));
		assertEquals(ColorTools.packRGB(40, 50, 255), apply(single, PixelFilters.Point.brightness()).getRGB(0, 0));
		assertEquals(ColorTools.packRGB(0, 0, 220), apply(single, PixelFilters.Point.brightness(-30)).getRGB(0, 0));
	}

	@Test
	public void test_constantPreserved() {
		var source = PixelGrid.createFilled(5, 4, ColorTools.packRGB(37, 120, 201));
		for (var transform : List.of(
				PixelFilters.Convolution.blur(),
				PixelFilters.Convolution.gaussian(),
				PixelFilters.Convolution.gaussian(1, 0.5),
				PixelFilters.Convolution.sharpen(),
				PixelFilters.Geometric.verticalWave(),
				PixelFilters.Geometric.horizontalWave(),
				PixelFilters.Geometric.glass())) {
			assertEquals(source, apply(source, transform), () -> "Constant image changed by " + transform);
		}

		var small = PixelGrid.createFilled(3, 3, ColorTools.packRGB(100, 100, 100));
		assertEquals(small, apply(small, PixelFilters.Convolution.blur()));
	}

	@Test
	public void test_kernelSampling() {
		var source = createRowGrid(3, 6, 10);
		var neighborhood = apply(source, PixelFilters.Convolution.blur());
		var fixedRow = apply(source, PixelFilters.Convolution.filter2D(Kernels.box(3), KernelSampling.FIXED_ROW_OFFSET));
		// Mean of rows 1, 2 and 3
		assertEquals(ColorTools.packRGB(20, 20, 20), neighborhood.getRGB(1, 2));
		// Only row 3 is sampled
		assertEquals(ColorTools.packRGB(30, 30, 30), fixedRow.getRGB(1, 2));
		// Last row is clipped
		assertEquals(ColorTools.packRGB(50, 50, 50), fixedRow.getRGB(1, 5));
	}

	@Test
	public void test_emboss() {
		var constant = PixelGrid.createFilled(4, 4, ColorTools.packRGB(37, 120, 201));
		var result = apply(constant, PixelFilters.Convolution.emboss());
		for (int rgb : result.getRGB())
			assertEquals(ColorTools.packRGB(128, 128, 128), rgb);

		for (int rgb : apply(createRandomGrid(9, 9, 5L), PixelFilters.Convolution.emboss()).getRGB())
			assertTrue(ColorTools.isGray(rgb));
	}

	@Test
	public void test_gradients() {
		// Vertical edge in the red channel only
		var source = PixelGrid.create(6, 4);
		for (int y = 0; y < 4; y++) {
			for (int x = 3; x < 6; x++)
				source.setRGB(x, y, ColorTools.packRGB(255, 0, 0));
		}

		var sobel = apply(source, PixelFilters.Convolution.sobel());
		for (int rgb : sobel.getRGB())
			assertTrue(ColorTools.isGray(rgb));
		assertTrue(ColorTools.red(sobel.getRGB(3, 1)) > 0);
		assertEquals(ColorTools.BLACK, sobel.getRGB(0, 1));

		for (var transform : List.of(PixelFilters.Convolution.scharr(), PixelFilters.Convolution.prewitt())) {
			var result = apply(source, transform);
			int edge = result.getRGB(3, 1);
			assertEquals(255, ColorTools.red(edge));
			assertEquals(0, ColorTools.green(edge));
			assertFalse(ColorTools.isGray(edge));
			assertEquals(ColorTools.BLACK, result.getRGB(0, 1));
			assertEquals(ColorTools.BLACK, result.getRGB(5, 1));
		}

		// Constant images have no edges
		var constant = PixelGrid.createFilled(5, 5, ColorTools.packRGB(90, 80, 70));
		for (int rgb : apply(constant, PixelFilters.Convolution.sobel()).getRGB())
			assertEquals(ColorTools.BLACK, rgb);
	}

	@Test
	public void test_gradientMismatch() {
		assertThrows(IllegalArgumentException.class,
				() -> PixelFilters.Convolution.gradient(Kernels.sobelX(), Kernels.box(5), GradientMode.PER_CHANNEL));
		assertThrows(NullPointerException.class,
				() -> PixelFilters.Convolution.gradient(Kernels.sobelX(), Kernels.sobelY(), null));
	}

	@Test
	public void test_rotation() {
		var source = PixelGrid.createFilled(10, 10, ColorTools.WHITE);
		var result = apply(source, PixelFilters.Geometric.rotation());
		assertEquals(ColorTools.BLACK, result.getRGB(9, 9));
		assertEquals(ColorTools.WHITE, result.getRGB(5, 5));

		// Without rotation only the sentinel row is changed
		var rows = createRowGrid(4, 5, 20);
		var unrotated = apply(rows, PixelFilters.Geometric.rotation(0));
		for (int x = 0; x < 4; x++) {
			for (int y = 0; y < 4; y++)
				assertEquals(rows.getRGB(x, y), unrotated.getRGB(x, y));
			assertEquals(ColorTools.BLACK, unrotated.getRGB(x, 4));
		}

		assertThrows(IllegalArgumentException.class, () -> PixelFilters.Geometric.rotation(Double.NaN));
	}

	@Test
	public void test_transfer() {
		var source = createRowGrid(2, 100, 1);
		var result = apply(source, PixelFilters.Geometric.transfer());
		assertEquals(ColorTools.packRGB(50, 50, 50), result.getRGB(0, 0));
		assertEquals(ColorTools.packRGB(98, 98, 98), result.getRGB(1, 48));
		// Rows mapped onto the last source row are black
		assertEquals(ColorTools.BLACK, result.getRGB(0, 49));
		assertEquals(ColorTools.BLACK, result.getRGB(0, 99));

		var down = apply(source, PixelFilters.Geometric.transfer(-10));
		assertEquals(ColorTools.packRGB(0, 0, 0), down.getRGB(0, 5));
		assertEquals(ColorTools.packRGB(40, 40, 40), down.getRGB(0, 50));
	}

	@Test
	public void test_waves() {
		var source = createRandomGrid(30, 30, 6L);
		var vertical = apply(source, PixelFilters.Geometric.verticalWave());
		var horizontal = apply(source, PixelFilters.Geometric.horizontalWave());
		// No displacement at zero phase
		for (int i = 0; i < 30; i++) {
			assertEquals(source.getRGB(i, 0), vertical.getRGB(i, 0));
			assertEquals(source.getRGB(0, i), horizontal.getRGB(0, i));
		}
		assertNotEquals(source, vertical);
		assertNotEquals(source, horizontal);
	}

	@Test
	public void test_glass() {
		var source = createRandomGrid(20, 15, 7L);
		var filter = PixelFilters.Geometric.glass(42L);
		var result1 = apply(source, filter);
		// Same instance, applied again
		assertEquals(result1, apply(source, filter));
		// New instance with the same seed
		assertEquals(result1, apply(source, PixelFilters.Geometric.glass(42L)));
		assertNotEquals(source, result1);
		assertNotEquals(result1, apply(source, PixelFilters.Geometric.glass(43L)));

		// Same instance, applied concurrently
		var results = IntStream.range(0, 8)
				.parallel()
				.mapToObj(i -> apply(source, filter))
				.collect(Collectors.toList());
		for (var result : results)
			assertEquals(result1, result);

		// Generators with the same state give the same output
		assertEquals(
				apply(source, PixelFilters.Geometric.glass(new Random(42L))),
				apply(source, PixelFilters.Geometric.glass(new Random(42L))));

		assertThrows(NullPointerException.class, () -> PixelFilters.Geometric.glass((Random)null));
	}

	@Test
	public void test_create() {
		for (var name : PixelFilters.getNames())
			assertNotNull(PixelFilters.create(name));
		assertEquals(16, PixelFilters.getNames().size());

		var source = createRandomGrid(8, 8, 8L);
		assertEquals(apply(source, PixelFilters.create("scharr")), apply(source, PixelFilters.create("sharra")));
		assertEquals(apply(source, PixelFilters.create("prewitt")), apply(source, PixelFilters.create("Pruitt")));
		assertEquals(apply(source, PixelFilters.create("sobel")), apply(source, PixelFilters.create(" SOBEL ")));

		assertThrows(IllegalArgumentException.class, () -> PixelFilters.create("not a filter"));
		assertThrows(NullPointerException.class, () -> PixelFilters.create(null));
	}

	@Test
	public void test_typeLabels() {
		assertEquals("filter.point.invert", PixelFilters.getTypeLabel(PixelFilters.Point.invert()));
		assertEquals("filter.convolution.matrix", PixelFilters.getTypeLabel(PixelFilters.Convolution.gaussian()));
		assertEquals("filter.convolution.gradient", PixelFilters.getTypeLabel(PixelFilters.Convolution.sobel()));
		assertEquals("filter.geometric.glass", PixelFilters.getTypeLabel(PixelFilters.Geometric.glass()));
		PixelTransform custom = (source, x, y) -> ColorTools.BLACK;
		assertNull(PixelFilters.getTypeLabel(custom));
		assertThrows(JsonParseException.class, () -> PixelFilters.toJson(custom));
	}

	@ParameterizedTest
	@MethodSource("parameterizedFilters")
	public void test_json(PixelTransform transform) {
		var source = createRandomGrid(16, 12, 9L);
		String json = PixelFilters.toJson(transform, true);
		assertTrue(json.contains("\"type\": \"" + PixelFilters.getTypeLabel(transform) + "\""), json);

		var transform2 = PixelFilters.fromJson(json);
		assertEquals(transform.getClass(), transform2.getClass());
		assertEquals(apply(source, transform), apply(source, transform2));
	}

	@Test
	public void test_jsonErrors() {
		assertThrows(JsonParseException.class, () -> PixelFilters.fromJson("{\"type\": \"filter.point.unknown\"}"));
		assertThrows(JsonParseException.class, () -> PixelFilters.fromJson("{\"offset\": 10}"));
		assertThrows(JsonParseException.class, () -> PixelFilters.fromJson(
				"{\"type\": \"filter.convolution.matrix\", \"kernel\": {\"weights\": [[1, 1], [1, 1]]}}"));
		assertThrows(JsonParseException.class, () -> PixelFilters.fromJson("null"));

		// Parameters are checked in the same way as on construction
		var gson = GsonTools.getInstance();
		String kernel3 = gson.toJson(Kernels.sobelX());
		String kernel5 = gson.toJson(Kernels.box(5));
		assertThrows(JsonParseException.class, () -> PixelFilters.fromJson(
				"{\"type\": \"filter.convolution.gradient\", \"kernelX\": " + kernel5 + ", \"kernelY\": " + kernel3 + ", \"mode\": \"PER_CHANNEL\"}"));
		assertThrows(JsonParseException.class, () -> PixelFilters.fromJson(
				"{\"type\": \"filter.convolution.gradient\", \"kernelX\": " + kernel3 + ", \"kernelY\": " + kernel3 + "}"));
		assertThrows(JsonParseException.class, () -> PixelFilters.fromJson(
				"{\"type\": \"filter.convolution.gradient\", \"mode\": \"LUMINOSITY\"}"));
		assertThrows(JsonParseException.class, () -> PixelFilters.fromJson("{\"type\": \"filter.convolution.matrix\"}"));
		assertThrows(JsonParseException.class, () -> PixelFilters.fromJson("{\"type\": \"filter.convolution.emboss\", \"offset\": 128}"));
		assertThrows(JsonParseException.class, () -> PixelFilters.fromJson(
				"{\"type\": \"filter.geometric.wave\", \"direction\": \"VERTICAL\", \"amplitude\": 20}"));
		assertThrows(JsonParseException.class, () -> PixelFilters.fromJson("{\"type\": \"filter.geometric.glass\", \"spread\": -1}"));

		var gradient = PixelFilters.fromJson(
				"{\"type\": \"filter.convolution.gradient\", \"kernelX\": " + kernel3 + ", \"kernelY\": " + gson.toJson(Kernels.sobelY()) + ", \"mode\": \"LUMINOSITY\"}");
		var edgeSource = createRandomGrid(6, 6, 12L);
		assertEquals(apply(edgeSource, PixelFilters.Convolution.sobel()), apply(edgeSource, gradient));

		var brightness = PixelFilters.fromJson("{\"type\": \"filter.point.brightness\", \"offset\": 5}");
		var single = PixelGrid.createFilled(1, 1, ColorTools.packRGB(1, 2, 3));
		assertEquals(ColorTools.packRGB(6, 7, 8), apply(single, brightness).getRGB(0, 0));

		// Sampling defaults to the full neighborhood
		var matrix = PixelFilters.fromJson("{\"type\": \"filter.convolution.matrix\", \"kernel\": {\"weights\": [[0, 0, 0], [0, 1, 0], [0, 0, 0]]}}");
		var source = createRandomGrid(5, 5, 10L);
		assertEquals(source, apply(source, matrix));
	}

}
