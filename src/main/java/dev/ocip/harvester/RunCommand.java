package dev.ocip.harvester;

import dev.ocip.harvester.category.Category;
import dev.ocip.harvester.engine.FileCheckpointStore;
import dev.ocip.harvester.engine.HarvestDirs;
import dev.ocip.harvester.engine.PacingPolicy;
import dev.ocip.harvester.engine.Phase;
import dev.ocip.harvester.engine.PhaseDefinition;
import dev.ocip.harvester.engine.PhaseFactory;
import dev.ocip.harvester.engine.PhaseResult;
import dev.ocip.harvester.engine.ResumeMode;
import dev.ocip.harvester.engine.TraversalLimits;
import dev.ocip.harvester.model.CheckpointState;
import dev.ocip.harvester.model.PhaseState;
import dev.ocip.harvester.portal.Portal;
import dev.ocip.harvester.portal.PortalException;
import dev.ocip.harvester.portal.PortalSession;
import dev.ocip.harvester.reporting.ProgressEvent;
import dev.ocip.harvester.reporting.ProgressReporter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Run command to execute extraction phases */
@Command(
		name = "run",
		description = "Run extraction phases; categories run in parallel, phases of a category in order",
		mixinStandardHelpOptions = true)
public class RunCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-d", "--data-dir"},
			description = "Directory holding output/, checkpoints/ and logs/ (default: current directory)",
			defaultValue = ".")
	Path dataDir;

	@Option(
			names = {"-p", "--phases"},
			description = "Comma-separated list of phase IDs to run (if not specified, all phases run)",
			split = ",")
	List<String> phaseIds;

	@Option(
			names = {"-l", "--list"},
			description = "List all available phase IDs and exit")
	boolean listPhases;

	@Option(
			names = {"-t", "--threads"},
			description = "Maximum number of categories running in parallel (default: one per category)",
			defaultValue = "-1")
	int maxThreads;

	@Option(
			names = {"--resume"},
			description = "Resume from existing checkpoints without asking")
	boolean resume;

	@Option(
			names = {"--fresh"},
			description = "Ignore existing checkpoints without asking; old output is replaced by new output")
	boolean fresh;

	@Option(
			names = {"--force"},
			description = "Re-scrape details that were already completed")
	boolean force;

	@Option(
			names = {"--limit-progress"},
			description = "Stop each phase after this many records (default: unlimited)",
			defaultValue = "-1")
	int limitProgress;

	@Option(
			names = {"--portal"},
			description = "Portal driver to use (default: snapshot)",
			defaultValue = "snapshot")
	String portalName;

	@Option(
			names = {"--portal-dir"},
			description = "Location the portal driver reads from (default: snapshot)",
			defaultValue = "snapshot")
	Path portalDir;

	@Option(
			names = {"--request-delay"},
			description = "Milliseconds to wait before every request (default: 1000)",
			defaultValue = "1000")
	long requestDelayMs;

	@Option(
			names = {"--batch-size"},
			description = "Records between longer pauses, 0 to disable (default: 50)",
			defaultValue = "50")
	int batchSize;

	@Option(
			names = {"--batch-pause"},
			description = "Milliseconds of the longer pause (default: 10000)",
			defaultValue = "10000")
	long batchPauseMs;

	@Option(
			names = {"--max-attempts"},
			description = "Attempts per request for timeouts and rate limits (default: 3)",
			defaultValue = "3")
	int maxAttempts;

	@Option(
			names = {"--backoff"},
			description = "Milliseconds to back off after the first failed attempt (default: 1000)",
			defaultValue = "1000")
	long backoffMs;

	@Option(
			names = {"--max-backoff"},
			description = "Upper bound of a single backoff in milliseconds (default: 30000)",
			defaultValue = "30000")
	long maxBackoffMs;

	@Option(
			names = {"--max-pages"},
			description = "Maximum pages fetched per partition (default: 50)",
			defaultValue = "50")
	int maxPages;

	@Option(
			names = {"--max-page-failures"},
			description = "Failed pages in a row before a partition is abandoned (default: 2)",
			defaultValue = "2")
	int maxPageFailures;

	ResumePrompt prompt = ResumePrompt.console();

	@Override
	public Integer call() throws Exception {
		// Handle list command
		if (listPhases) {
			listAvailablePhases();
			return 0;
		}
		if (resume && fresh) {
			logger.error("Error: --resume and --fresh cannot be combined");
			return 2;
		}

		var allPhases = PhaseFactory.getAvailablePhases();
		var selected = new ArrayList<PhaseDefinition>();
		if (phaseIds == null) {
			selected.addAll(allPhases.values());
		} else {
			for (var phaseId : phaseIds) {
				var definition = allPhases.get(phaseId.trim());
				if (definition == null) {
					logger.warn("Warning: Unknown phase ID: {}", phaseId);
					continue;
				}
				selected.add(definition);
			}
			selected.sort((a, b) -> Integer.compare(a.number(), b.number()));
		}
		if (selected.isEmpty()) {
			logger.info("No phases selected.");
			return 0;
		}

		var dirs = HarvestDirs.under(dataDir);
		logger.info("OCIP Portal Harvester - Run");
		logger.info("===========================");
		logger.info("Output directory: {}", dirs.outputDir().toAbsolutePath());
		logger.info("Checkpoint directory: {}", dirs.checkpointDir().toAbsolutePath());
		logger.info("Logs directory: {}", dirs.logsDir().toAbsolutePath());
		logger.info("Portal: {} ({})", portalName, portalDir.toAbsolutePath());
		logger.info("");

		long startTime = System.currentTimeMillis();
		var results = new ArrayList<PhaseResult>();
		var modes = resolveModes(selected, dirs, results);
		if (modes.isEmpty()) {
			logger.info("No phases left to run.");
			return printSummary(results, startTime);
		}

		var byCategory = new LinkedHashMap<Category, List<PhaseDefinition>>();
		for (var definition : modes.keySet()) {
			byCategory.computeIfAbsent(definition.category(), c -> new ArrayList<>()).add(definition);
		}

		Portal portal;
		try {
			portal = Portal.create(portalName, portalDir);
		} catch (IllegalArgumentException e) {
			logger.error("Error: {} (available: {})", e.getMessage(), Portal.availablePortals().keySet());
			return 1;
		}

		var threadCount = maxThreads > 0 ? maxThreads : byCategory.size();
		logger.info("Running phases: {}", String.join(", ", modes.keySet().stream().map(PhaseDefinition::id).toList()));
		logger.info("Max parallel categories: {}", threadCount);
		logger.info("");

		try (var reporter = new ProgressReporter()) {
			reporter.start();
			var factory = PhaseFactory.create(dirs, reporter, pacingPolicy(), traversalLimits(), force, limitProgress);

			ExecutorService executor = Executors.newFixedThreadPool(threadCount);
			try {
				var futures = new ArrayList<Future<List<PhaseResult>>>();
				for (var entry : byCategory.entrySet()) {
					futures.add(executor.submit(
							() -> runCategory(entry.getKey(), entry.getValue(), modes, portal, factory, reporter)));
				}
				for (var future : futures) {
					try {
						results.addAll(future.get());
					} catch (ExecutionException e) {
						logger.error("Category execution failed: {}", e.getCause().getMessage());
					} catch (InterruptedException e) {
						Thread.currentThread().interrupt();
						logger.error("Category execution interrupted");
					}
				}
			} finally {
				executor.shutdownNow();
			}
		}

		return printSummary(results, startTime);
	}

	/**
	 * Ask about checkpoints before any worker starts so prompts don't interleave. Cancelled phases
	 * are left out of the returned modes and get their result right away.
	 */
	Map<PhaseDefinition, ResumeMode> resolveModes(
			List<PhaseDefinition> selected, HarvestDirs dirs, List<PhaseResult> results) {
		var modes = new LinkedHashMap<PhaseDefinition, ResumeMode>();
		for (var definition : selected) {
			var mode = resolveMode(definition, dirs);
			if (mode == null) {
				logger.info("Skipping {} (cancelled)", definition.id());
				results.add(PhaseResult.cancelled(definition.id()));
				continue;
			}
			modes.put(definition, mode);
		}
		return modes;
	}

	private int printSummary(List<PhaseResult> results, long startTime) {
		logger.info("");
		logger.info("Execution Summary");
		logger.info("=================");
		var failed = 0;
		for (var result : results) {
			logger.info("  {}: {}", result.phaseId(), result);
			if (result.ledgerEntries() > 0) {
				logger.info("    Error ledger entries: {}", result.ledgerEntries());
			}
			if (!result.success()) {
				failed++;
			}
		}
		logger.info("");
		logger.info("Total phases: {}", results.size());
		logger.info("Failed: {}", failed);
		var duration = (System.currentTimeMillis() - startTime) / 1000.0;
		logger.info("All phases completed in {} seconds", duration);

		return failed > 0 ? 1 : 0;
	}

	private List<PhaseResult> runCategory(
			Category category,
			List<PhaseDefinition> definitions,
			Map<PhaseDefinition, ResumeMode> modes,
			Portal portal,
			PhaseFactory factory,
			ProgressReporter reporter) {
		var results = new ArrayList<PhaseResult>();
		try (PortalSession session = portal.open(category)) {
			for (var definition : definitions) {
				reporter.report(ProgressEvent.started(definition.id()));
				Phase phase = factory.createPhase(definition, modes.get(definition), session);
				PhaseResult result = phase.call();
				results.add(result);
				if (result.success()) {
					reporter.report(ProgressEvent.completed(definition.id(), result.toString()));
				} else {
					reporter.report(ProgressEvent.failed(
							definition.id(),
							result.error() != null ? result.error().getMessage() : "Unknown error",
							result.error()));
				}
				if (!result.success() || result.state() == PhaseState.INTERRUPTED) {
					logger.warn("Not continuing {} after {} ({})", category.id(), definition.id(), result.state());
					break;
				}
			}
		} catch (PortalException e) {
			logger.error("Cannot open portal session for {}: {}", category.id(), e.getMessage());
			for (var definition : definitions) {
				results.add(PhaseResult.failure(definition.id(), e));
				reporter.report(ProgressEvent.failed(definition.id(), e.getMessage(), e));
			}
		}
		return results;
	}

	/** Returns null when the operator cancels the phase */
	ResumeMode resolveMode(PhaseDefinition definition, HarvestDirs dirs) {
		Path checkpointFile = dirs.layout(definition).checkpointFile();
		if (!Files.exists(checkpointFile)) {
			return ResumeMode.FRESH;
		}
		if (resume) {
			return ResumeMode.RESUME;
		}
		if (fresh) {
			return ResumeMode.FRESH;
		}
		CheckpointState checkpoint = null;
		try {
			checkpoint = FileCheckpointStore.read(checkpointFile);
		} catch (IOException e) {
			logger.warn("Cannot read checkpoint {}: {}", checkpointFile, e.getMessage());
		}
		return switch (prompt.ask(definition, checkpoint)) {
			case RESUME -> ResumeMode.RESUME;
			case FRESH -> ResumeMode.FRESH;
			case CANCEL -> null;
		};
	}

	PacingPolicy pacingPolicy() {
		return new PacingPolicy(
				Duration.ofMillis(requestDelayMs),
				batchSize,
				Duration.ofMillis(batchPauseMs),
				Duration.ofMillis(backoffMs),
				Duration.ofMillis(maxBackoffMs),
				maxAttempts);
	}

	TraversalLimits traversalLimits() {
		return new TraversalLimits(maxPages, maxPageFailures);
	}

	private void listAvailablePhases() {
		logger.info("Available Phases:");
		logger.info("=================");
		var phases = PhaseFactory.getAvailablePhases();
		for (var definition : phases.values()) {
			logger.info("  {}. {} ({})", definition.number(), definition.id(), definition.description());
		}
		logger.info("");
		logger.info("Total: {} phases", phases.size());
	}
}
