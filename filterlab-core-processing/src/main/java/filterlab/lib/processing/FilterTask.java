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
import java.util.concurrent.Callable;

import filterlab.lib.filters.PixelTransform;
import filterlab.lib.images.PixelGrid;
import filterlab.lib.plugins.SimpleProgressMonitor;

/**
 * A task that applies a single filter to an image when called.
 * The result is empty if the task was cancelled through its monitor.
 *
 * @see FilterTaskRunner
 */
public class FilterTask implements Callable<Optional<PixelGrid>> {

	private final PixelGrid source;
	private final PixelTransform transform;
	private final SimpleProgressMonitor monitor;

	/**
	 * Create a task that is never cancelled, and does not report progress.
	 * @param source
	 * @param transform
	 */
	public FilterTask(PixelGrid source, PixelTransform transform) {
		this(source, transform, SimpleProgressMonitor.silent());
	}

	/**
	 * Create a task that reports progress to (and may be cancelled by) a monitor.
	 * @param source
	 * @param transform
	 * @param monitor
	 */
	public FilterTask(PixelGrid source, PixelTransform transform, SimpleProgressMonitor monitor) {
		this.source = Objects.requireNonNull(source, "Source image must not be null");
		this.transform = Objects.requireNonNull(transform, "Transform must not be null");
		this.monitor = Objects.requireNonNull(monitor, "Progress monitor must not be null");
	}

	public PixelGrid getSource() {
		return source;
	}

	public PixelTransform getTransform() {
		return transform;
	}

	public SimpleProgressMonitor getMonitor() {
		return monitor;
	}

	@Override
	public Optional<PixelGrid> call() {
		return PixelProcessor.process(source, transform, monitor);
	}

	@Override
	public String toString() {
		return "FilterTask [" + source.getWidth() + "x" + source.getHeight() + ", " + transform + "]";
	}

}
