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

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link SimpleProgressMonitor} that sends progress to a log.
 * <p>
 * To avoid flooding the log, progress is only logged when it has increased by at least
 * a fixed step since the last message (or when it reaches 100%).
 * <p>
 * This doesn't need to be used from any particular thread.
 */
public class CommandLineProgressMonitor implements SimpleProgressMonitor {

	private static final Logger logger = LoggerFactory.getLogger(CommandLineProgressMonitor.class);

	private final int step;
	private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

	private long startTime;
	private String message;
	private int lastLogged = -1;
	private int lastProgress = 0;

	/**
	 * Create a monitor that logs progress in steps of 10%.
	 */
	public CommandLineProgressMonitor() {
		this(10);
	}

	/**
	 * Create a monitor that logs progress in steps of the specified size.
	 * @param step minimum change in percentage between log messages; must be &gt; 0
	 */
	public CommandLineProgressMonitor(int step) {
		if (step <= 0)
			throw new IllegalArgumentException("Progress step must be > 0, but was " + step);
		this.step = step;
	}

	@Override
	public synchronized void startMonitoring(String message, boolean mayCancel) {
		startTime = System.currentTimeMillis();
		this.message = message == null ? "Processing" : message;
		logger.info(this.message);
	}

	@Override
	public synchronized void setProgress(int percent) {
		lastProgress = percent;
		if (lastLogged < 0 || percent >= lastLogged + step || (percent >= 100 && lastLogged < 100)) {
			logger.info("{} ({}%)", message, percent);
			lastLogged = percent;
		}
	}

	@Override
	public synchronized void taskCompleted(String message) {
		double seconds = (System.currentTimeMillis() - startTime) / 1000.0;
		if (message == null)
			logger.info(String.format("Processing complete in %.2f seconds", seconds));
		else
			logger.info(String.format("%s (%.2f seconds)", message, seconds));
	}

	/**
	 * Request that the monitored task stops at the next opportunity.
	 */
	public void requestCancel() {
		if (!cancelRequested.getAndSet(true))
			logger.debug("Cancel requested at {}%", getLastProgress());
	}

	@Override
	public boolean cancelled() {
		return cancelRequested.get();
	}

	/**
	 * Get the most recently reported progress percentage.
	 * @return
	 */
	public synchronized int getLastProgress() {
		return lastProgress;
	}

}
