package dev.ocip.harvester.engine;

import dev.ocip.harvester.category.Category;
import dev.ocip.harvester.model.CheckpointState;
import dev.ocip.harvester.model.Counters;
import dev.ocip.harvester.model.ErrorEntry;
import dev.ocip.harvester.model.PhaseState;
import dev.ocip.harvester.portal.PortalSession;
import dev.ocip.harvester.store.JsonFileStore;
import dev.ocip.harvester.util.FileUtils;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import org.slf4j.Logger;

/**
 * Base class for both phases. Decides between resuming and starting fresh, drains the traversal
 * and turns the outcome into a {@link PhaseResult}; {@link #call()} never throws.
 */
public abstract class BasePhase implements Phase {
	protected final PhaseConfig config;
	protected final PhaseLayout layout;
	protected final Category category;
	protected final Logger logger;
	protected final PortalSession session;
	private final CheckpointStore checkpoints;
	private PhaseState phaseState = PhaseState.INIT;

	protected BasePhase(PhaseConfig config, PortalSession session) {
		this(
				config,
				session,
				new FileCheckpointStore(
						config.layout().checkpointFile(), config.definition().id(), config.logger()));
	}

	protected BasePhase(PhaseConfig config, PortalSession session, CheckpointStore checkpoints) {
		this.config = config;
		this.layout = config.layout();
		this.category = config.definition().category();
		this.logger = config.logger();
		this.session = session;
		this.checkpoints = checkpoints;
	}

	/**
	 * Set up the traversal of this phase. Prerequisites are checked here, before the phase counts
	 * as running.
	 */
	protected abstract Iterator<?> traverse(TraversalContext ctx);

	@Override
	public String id() {
		return config.definition().id();
	}

	public PhaseState state() {
		return phaseState;
	}

	@Override
	public PhaseResult call() {
		CheckpointState state = null;
		ErrorLedger ledger = null;
		try {
			ensureDirectories();

			boolean resuming = config.mode() == ResumeMode.RESUME && checkpoints.exists();
			state = resuming ? checkpoints.load() : CheckpointState.empty(id());
			transition(resuming ? PhaseState.RESUMING : PhaseState.FRESH);
			if (resuming) {
				logger.info("Resuming from checkpoint: {} at {}", state.counters(), state.cursor());
			} else {
				logger.info("Starting fresh");
			}

			ledger = new ErrorLedger(layout.ledgerFile(), resuming, logger);
			state.status(PhaseState.RUNNING);
			TraversalContext ctx = new TraversalContext(
					id(),
					category,
					session,
					session,
					new JsonFileStore(layout.masterListFile(), layout.detailsFile(), !resuming),
					checkpoints,
					state,
					new PacingController(config.pacing(), config.sleeper(), logger),
					ledger,
					logger);
			Iterator<?> units = traverse(ctx);
			transition(PhaseState.RUNNING);

			int produced = 0;
			while (units.hasNext()) {
				units.next();
				produced++;
				config.progress().update(state.counters());
				if (config.limitProgress() > 0 && produced >= config.limitProgress()) {
					throw new InterruptedProgressException(
							"Reached progress limit of " + config.limitProgress() + " items");
				}
			}

			state.status(PhaseState.COMPLETE);
			checkpoints.save(state);
			transition(PhaseState.COMPLETE);
			logger.info(
					"Completed: {} succeeded, {} partial, {} failed, {} skipped, {} ledger entries {}",
					state.counters().succeeded(),
					state.counters().partial(),
					state.counters().failed(),
					state.counters().skipped(),
					ledger.size(),
					ledger.summary());
			return PhaseResult.completed(id(), state.counters(), ledger.size());
		} catch (InterruptedProgressException e) {
			logger.info("Stopped: {}", e.getMessage());
			transition(PhaseState.INTERRUPTED);
			if (state == null) {
				return PhaseResult.interrupted(id(), Counters.zero(), 0);
			}
			state.status(PhaseState.INTERRUPTED);
			try {
				checkpoints.save(state);
			} catch (FatalPhaseException saveError) {
				logger.error("Could not record the interruption: {}", saveError.getMessage());
			}
			return PhaseResult.interrupted(id(), state.counters(), ledger == null ? 0 : ledger.size());
		} catch (FatalPhaseException e) {
			return fatal(e, e.fatalCause(), ledger);
		} catch (IOException e) {
			return fatal(e, FatalCause.PERSISTENCE_FAILURE, ledger);
		} catch (RuntimeException e) {
			logger.error("Failed with unexpected error", e);
			transition(PhaseState.FATAL);
			return PhaseResult.failure(id(), e);
		}
	}

	private PhaseResult fatal(Exception e, FatalCause cause, ErrorLedger ledger) {
		logger.error("Aborted ({}): {}", cause, e.getMessage());
		transition(PhaseState.FATAL);
		if (ledger != null) {
			ledger.record(ErrorEntry.fatal(id(), cause.reason(), e.getMessage()));
		}
		return PhaseResult.failure(id(), e);
	}

	private void transition(PhaseState next) {
		logger.debug("{} -> {}", phaseState, next);
		phaseState = next;
	}

	private void ensureDirectories() throws IOException {
		for (Path file : new Path[] {layout.checkpointFile(), layout.outputFile(), layout.ledgerFile()}) {
			Path dir = file.toAbsolutePath().getParent();
			if (dir != null) {
				FileUtils.ensureDirectory(dir);
			}
		}
	}
}
