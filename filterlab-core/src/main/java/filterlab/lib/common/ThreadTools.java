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

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Helper methods for working with threads.
 */
public class ThreadTools {

	/**
	 * Create a thread factory that names threads by appending a counter (starting at 1) to a prefix.
	 *
	 * @param prefix prefix for thread names, e.g. {@code "filter-runner-"}
	 * @param daemon true if the threads should not prevent the JVM from exiting
	 * @param priority thread priority; values outside {@code [Thread.MIN_PRIORITY, Thread.MAX_PRIORITY]} are clipped
	 * @return
	 */
	public static ThreadFactory createThreadFactory(String prefix, boolean daemon, int priority) {
		Objects.requireNonNull(prefix, "Thread name prefix must not be null");
		int clippedPriority = GeneralTools.clipValue(priority, Thread.MIN_PRIORITY, Thread.MAX_PRIORITY);
		var counter = new AtomicInteger();
		return r -> {
			var thread = new Thread(r, prefix + counter.incrementAndGet());
			thread.setDaemon(daemon);
			thread.setPriority(clippedPriority);
			return thread;
		};
	}

	/**
	 * Create a thread factory using {@link Thread#NORM_PRIORITY}.
	 *
	 * @param prefix
	 * @param daemon
	 * @return
	 * @see #createThreadFactory(String, boolean, int)
	 */
	public static ThreadFactory createThreadFactory(String prefix, boolean daemon) {
		return createThreadFactory(prefix, daemon, Thread.NORM_PRIORITY);
	}

}
