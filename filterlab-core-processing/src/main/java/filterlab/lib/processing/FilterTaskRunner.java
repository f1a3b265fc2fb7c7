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

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import filterlab.lib.common.ThreadTools;
import filterlab.lib.filters.PixelTransform;
import filterlab.lib.images.PixelGrid;
import filterlab.lib.plugins.SimpleProgressMonitor;

/**
 * Run filters in the background, so that the calling thread (e.g. a user interface) is not blocked.
 * <p>
 * Each runner owns a thread pool, which is created when the runner is created and released by
 * {@link #close()}. Threads are daemon threads, so an unclosed runner does not prevent the JVM from exiting.
 * <p>
 * Cancellation is cooperative: a submitted task stops when its monitor reports that it has been cancelled,
 * and then returns an empty result. Cancelling the returned {@link Future} only prevents tasks that have
 * not yet started.
 */
public class FilterTaskRunner implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(FilterTaskRunner.class);

	private static final AtomicInteger counter = new AtomicInteger(0);

	private final ExecutorService pool;
	private final int numThreads;

	/**
	 * Create a runner that processes one filter at a time.
	 */
	public FilterTaskRunner() {
		this(1);
	}

	/**
	 * Create a runner with a fixed number of threads.
	 * @param numThreads number of filters that may be processed concurrently; must be &gt; 0
	 */
	public FilterTaskRunner(int numThreads) {
		if (numThreads <= 0)
			throw new IllegalArgumentException("Number of threads must be > 0, but was " + numThreads);
		this.numThreads = numThreads;
		this.pool = Executors.newFixedThreadPool(numThreads,
				ThreadTools.createThreadFactory("filter-runner-" + counter.incrementAndGet() + "-", true));
		logger.debug("New thread pool created with {} threads", numThreads);
	}

	/**
	 * Get the number of threads used by this runner.
	 * @return
	 */
	public int getNumThreads() {
		return numThreads;
	}

	/**
	 * Submit a task for processing.
	 * @param task
	 * @return a future for the result, which is empty if the task was cancelled
	 * @throws java.util.concurrent.RejectedExecutionException if the runner has been shut down
	 */
	public Future<Optional<PixelGrid>> submit(FilterTask task) {
		Objects.requireNonNull(task, "Task must not be null");
		logger.debug("Submitting {}", task);
		return pool.submit(task);
	}

	/**
	 * Submit a filter for processing.
	 * @param source
	 * @param transform
	 * @param monitor
	 * @return a future for the result, which is empty if the task was cancelled
	 */
	public Future<Optional<PixelGrid>> submit(PixelGrid source, PixelTransform transform, SimpleProgressMonitor monitor) {
		return submit(new FilterTask(source, transform, monitor));
	}

	/**
	 * Request that the runner stops accepting new tasks.
	 * Tasks that have already been submitted are still processed.
	 */
	public void shutdown() {
		pool.shutdown();
	}

	/**
	 * Request that the runner stops, interrupting any running tasks.
	 * Filters do not respond to interrupts, so running tasks should also be cancelled via their monitors.
	 * @return the tasks that were waiting to start
	 */
	public List<Runnable> shutdownNow() {
		return pool.shutdownNow();
	}

	/**
	 * Query if the runner has been shut down.
	 * @return
	 */
	public boolean isShutdown() {
		return pool.isShutdown();
	}

	/**
	 * Wait for submitted tasks to finish after {@link #shutdown()}.
	 * @param timeout
	 * @param unit
	 * @return true if all tasks finished before the timeout elapsed
	 * @throws InterruptedException
	 */
	public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
		return pool.awaitTermination(timeout, unit);
	}

	/**
	 * Shut down the runner, without waiting for submitted tasks to finish.
	 */
	@Override
	public void close() {
		if (!pool.isShutdown()) {
			logger.debug("Shutting down filter runner");
			pool.shutdown();
		}
	}

}
