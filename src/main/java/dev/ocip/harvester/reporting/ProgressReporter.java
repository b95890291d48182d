package dev.ocip.harvester.reporting;

import dev.ocip.harvester.engine.PhaseProgress;
import dev.ocip.harvester.model.Counters;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central reporting thread that receives progress events from all running phases and logs them.
 * Progress updates are throttled to one line per phase every {@code progressEvery} processed units.
 */
public class ProgressReporter implements Runnable, AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(ProgressReporter.class);
	private static final ProgressEvent POISON_PILL = ProgressEvent.completed("SHUTDOWN", "");

	private final BlockingQueue<ProgressEvent> eventQueue;
	private final Set<String> runningPhases;
	private final Map<String, Integer> lastReported;
	private final AtomicBoolean running;
	private final int progressEvery;
	private Thread reporterThread;

	public ProgressReporter() {
		this(10);
	}

	public ProgressReporter(int progressEvery) {
		this.eventQueue = new LinkedBlockingQueue<>();
		this.runningPhases = ConcurrentHashMap.newKeySet();
		this.lastReported = new ConcurrentHashMap<>();
		this.running = new AtomicBoolean(false);
		this.progressEvery = Math.max(1, progressEvery);
	}

	/** Start the reporter thread */
	public void start() {
		if (running.compareAndSet(false, true)) {
			reporterThread = new Thread(this, "ProgressReporter");
			reporterThread.setDaemon(false);
			reporterThread.start();
			logger.debug("Progress reporter started");
		}
	}

	/** Submit a progress event to be processed */
	public void report(ProgressEvent event) {
		try {
			eventQueue.put(event);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.error("Interrupted while submitting event", e);
		}
	}

	/** Progress sink that forwards a phase's counters to this reporter */
	public PhaseProgress forPhase(String phaseId) {
		return counters -> report(ProgressEvent.progress(phaseId, counters));
	}

	@Override
	public void run() {
		while (running.get() || !eventQueue.isEmpty()) {
			try {
				ProgressEvent event = eventQueue.take();

				// Check for shutdown signal
				if (event == POISON_PILL) {
					break;
				}

				processEvent(event);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.warn("Reporter thread interrupted");
				break;
			} catch (Exception e) {
				logger.error("Error processing event", e);
			}
		}
		logger.debug("Progress reporter thread stopped");
	}

	private void processEvent(ProgressEvent event) {
		switch (event.eventType()) {
			case STARTED -> {
				runningPhases.add(event.phaseId());
				logger.info("STARTED: {} | Currently running: {}", event.phaseId(), runningPhases.size());
			}
			case PROGRESS -> {
				if (shouldReport(event.phaseId(), event.counters())) {
					logger.info("PROGRESS: {} - {}", event.phaseId(), event.message());
				}
			}
			case COMPLETED -> {
				runningPhases.remove(event.phaseId());
				logger.info(
						"COMPLETED: {} - {} | Remaining: {}", event.phaseId(), event.message(), runningPhases.size());
			}
			case FAILED -> {
				runningPhases.remove(event.phaseId());
				logger.error(
						"FAILED: {} - {} | Remaining: {}", event.phaseId(), event.message(), runningPhases.size());
			}
		}
	}

	/** Whether a phase has moved far enough since its last progress line, or just finished its units */
	boolean shouldReport(String phaseId, Counters counters) {
		int done = counters.processed() + counters.failed();
		int last = lastReported.getOrDefault(phaseId, 0);
		boolean finished = counters.total() > 0 && done == counters.total();
		if (done - last >= progressEvery || (finished && done != last)) {
			lastReported.put(phaseId, done);
			return true;
		}
		return false;
	}

	/** Get a snapshot of currently running phase IDs */
	public Set<String> getRunningPhases() {
		return Set.copyOf(runningPhases);
	}

	/** Shutdown the reporter and wait for all events to be processed */
	@Override
	public void close() {
		if (running.compareAndSet(true, false)) {
			try {
				// Send poison pill to stop the thread
				eventQueue.put(POISON_PILL);

				if (reporterThread != null) {
					reporterThread.join(5000);
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.error("Interrupted while shutting down reporter", e);
			}
		}
	}
}
