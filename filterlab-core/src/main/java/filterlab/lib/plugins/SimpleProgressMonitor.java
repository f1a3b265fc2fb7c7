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

package filterlab.lib.plugins;

import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.function.IntConsumer;

/**
 * Interface for monitoring the progress of a long-running task and giving feedback to the user.
 * <p>
 * Implementing classes receive notifications from the task as it executes, and should display these in an appropriate way -
 * such as with a progress bar, or logging the progress to the system output.
 * Classes may also request that the task is cancelled, e.g. if the user presses a 'cancel' button.
 * The task polls {@link #cancelled()}; it is never interrupted.
 * <p>
 * Progress notifications are sent from the thread running the task.
 * If they need to be shown on a UI thread, it is up to the implementation to pass them on.
 * <p>
 * SimpleProgressMonitors are not intended for reuse, i.e. the startMonitoring method should only be called once.
 */
public interface SimpleProgressMonitor {

	/**
	 * Begin monitoring.
	 *
	 * @param message the message to display; may be null
	 * @param mayCancel true if the task checks {@link #cancelled()}
	 */
	public default void startMonitoring(String message, boolean mayCancel) {}

	/**
	 * Update the displayed progress.
	 *
	 * @param percent completion estimate, between 0 and 100 (inclusive).
	 *                Values are non-decreasing during a single task, but not every value is necessarily reported.
	 */
	public void setProgress(int percent);

	/**
	 * Notify the monitor that the task has finished, either because it completed or because it was cancelled.
	 *
	 * @param message message to show upon completion; may be null
	 */
	public default void taskCompleted(String message) {}

	/**
	 * Returns true if cancel has been requested, for example by the user pressing a 'cancel' button.
	 * @return
	 */
	public boolean cancelled();


	/**
	 * Create a monitor from a progress callback and a cancellation flag.
	 * @param onProgress callback to receive progress percentages
	 * @param isCancelled supplier that returns true when the task should stop
	 * @return
	 */
	public static SimpleProgressMonitor create(IntConsumer onProgress, BooleanSupplier isCancelled) {
		Objects.requireNonNull(onProgress, "Progress callback must not be null");
		Objects.requireNonNull(isCancelled, "Cancellation flag must not be null");
		return new SimpleProgressMonitor() {

			@Override
			public void setProgress(int percent) {
				onProgress.accept(percent);
			}

			@Override
			public boolean cancelled() {
				return isCancelled.getAsBoolean();
			}

		};
	}

	/**
	 * Get a monitor that ignores all progress, and is never cancelled.
	 * @return
	 */
	public static SimpleProgressMonitor silent() {
		return create(p -> {}, () -> false);
	}

}
