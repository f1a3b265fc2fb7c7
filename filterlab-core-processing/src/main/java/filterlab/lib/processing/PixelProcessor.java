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

package filterlab.lib.processing;

import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.IntConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import filterlab.lib.filters.PixelTransform;
import filterlab.lib.images.PixelGrid;
import filterlab.lib.plugins.SimpleProgressMonitor;

/**
 * Apply a {@link PixelTransform} to every pixel of an image.
 * <p>
 * Pixels are visited column by column. Before each column the progress is reported as
 * {@code x * 100 / width}, and the monitor is checked for cancellation. If cancellation has been
 * requested then processing stops immediately and no partial result is returned.
 * <p>
 * The source image is never modified.
 */
public class PixelProcessor {

	private static final Logger logger = LoggerFactory.getLogger(PixelProcessor.class);

	// Suppressed default constructor for non-instantiability
	private PixelProcessor() {
		throw new AssertionError();
	}

	/**
	 * Apply a transform to an image, reporting progress to a callback.
	 *
	 * @param source the input image
	 * @param transform the transform that calculates each output pixel
	 * @param onProgress receives the progress, as a percentage
	 * @param isCancelled returns true if processing should stop
	 * @return the transformed image, or an empty optional if processing was cancelled
	 * @see #process(PixelGrid, PixelTransform, SimpleProgressMonitor)
	 */
	public static Optional<PixelGrid> process(PixelGrid source, PixelTransform transform,
			IntConsumer onProgress, BooleanSupplier isCancelled) {
		return process(source, transform, SimpleProgressMonitor.create(onProgress, isCancelled));
	}

	/**
	 * Apply a transform to an image.
	 * <p>
	 * The monitor receives a non-decreasing sequence of progress values, ending with 100 if processing
	 * completes. Cancellation is polled once per column, so a request made while a column is
	 * being processed takes effect before the next column.
	 * <p>
	 * Any exception thrown by the transform is propagated; the monitor is still informed that the task
	 * has completed.
	 *
	 * @param source the input image
	 * @param transform the transform that calculates each output pixel
	 * @param monitor progress monitor that may also request cancellation
	 * @return the transformed image, which has the same size as the source, or an empty optional if
	 *         processing was cancelled
	 */
	public static Optional<PixelGrid> process(PixelGrid source, PixelTransform transform, SimpleProgressMonitor monitor) {
		Objects.requireNonNull(source, "Source image must not be null");
		Objects.requireNonNull(transform, "Transform must not be null");
		Objects.requireNonNull(monitor, "Progress monitor must not be null");

		int width = source.getWidth();
		int height = source.getHeight();
		String message = "Applying filter to " + width + "x" + height + " image";
		logger.debug("{} with {}", message, transform);

		long startTime = System.currentTimeMillis();
		monitor.startMonitoring(message, true);
		String completedMessage = null;
		try {
			var result = PixelGrid.create(width, height);
			for (int x = 0; x < width; x++) {
				monitor.setProgress((int)((long)x * 100 / width));
				if (monitor.cancelled()) {
					logger.info("Filter cancelled at column {}/{}", x, width);
					completedMessage = "Filter cancelled";
					return Optional.empty();
				}
				for (int y = 0; y < height; y++) {
					result.setRGB(x, y, transform.calculatePixel(source, x, y));
				}
			}
			monitor.setProgress(100);
			completedMessage = "Filter complete";
			logger.debug("{} completed in {} ms", message, System.currentTimeMillis() - startTime);
			return Optional.of(result);
		} finally {
			if (completedMessage == null)
				completedMessage = "Filter failed";
			monitor.taskCompleted(completedMessage);
		}
	}

}
