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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.awt.image.BufferedImage;

import org.junit.jupiter.api.Test;

import filterlab.lib.common.ColorTools;
import filterlab.lib.images.PixelGrid;

@SuppressWarnings("javadoc")
public class TestBufferedImageTools {

	@Test
	public void test_conversion() {
		var img = new BufferedImage(5, 3, BufferedImage.TYPE_INT_ARGB);
		img.setRGB(4, 2, 0x80102030);
		img.setRGB(0, 0, 0xff405060);

		var grid = BufferedImageTools.toPixelGrid(img);
		assertEquals(5, grid.getWidth());
		assertEquals(3, grid.getHeight());
		// Alpha is discarded
		assertEquals(ColorTools.packRGB(0x10, 0x20, 0x30), grid.getRGB(4, 2));
		assertEquals(ColorTools.packRGB(0x40, 0x50, 0x60), grid.getRGB(0, 0));

		var img2 = BufferedImageTools.toBufferedImage(grid);
		assertEquals(BufferedImage.TYPE_INT_RGB, img2.getType());
		assertEquals(grid, BufferedImageTools.toPixelGrid(img2));
	}

	@Test
	public void test_grayImage() {
		var img = new BufferedImage(2, 2, BufferedImage.TYPE_BYTE_GRAY);
		img.getRaster().setSample(1, 1, 0, 200);
		var grid = BufferedImageTools.toPixelGrid(img);
		assertEquals(ColorTools.BLACK, grid.getRGB(0, 0));
		// Exact value depends upon the gray color space, but should be gray and bright
		int rgb = grid.getRGB(1, 1);
		assertEquals(ColorTools.red(rgb), ColorTools.green(rgb));
		assertEquals(ColorTools.red(rgb), ColorTools.blue(rgb));
	}

	@Test
	public void test_emptyGrid() {
		assertThrows(IllegalArgumentException.class, () -> BufferedImageTools.toBufferedImage(PixelGrid.create(0, 4)));
		assertThrows(NullPointerException.class, () -> BufferedImageTools.toPixelGrid(null));
	}

}
