package dev.ocip.harvester;

import dev.ocip.harvester.engine.PhaseDefinition;
import dev.ocip.harvester.model.CheckpointState;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/** Asks the operator what to do with a checkpoint left by an earlier run */
@FunctionalInterface
public interface ResumePrompt {

	enum Answer {
		RESUME,
		FRESH,
		CANCEL
	}

	/**
	 * @param checkpoint the saved state, or null when the checkpoint could not be read
	 */
	Answer ask(PhaseDefinition phase, CheckpointState checkpoint);

	static ResumePrompt always(Answer answer) {
		return (phase, checkpoint) -> answer;
	}

	/** Prompt on the terminal, re-asking until the answer is one of y, n or c */
	static ResumePrompt console() {
		return new ConsolePrompt(
				new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
	}

	class ConsolePrompt implements ResumePrompt {
		private final BufferedReader in;
		private final PrintStream out;

		public ConsolePrompt(BufferedReader in, PrintStream out) {
			this.in = in;
			this.out = out;
		}

		@Override
		public synchronized Answer ask(PhaseDefinition phase, CheckpointState checkpoint) {
			out.println();
			out.println("Found checkpoint for " + phase.description());
			if (checkpoint != null) {
				out.println("  Progress: " + checkpoint.counters());
				out.println("  Position: " + checkpoint.cursor());
				out.println("  Saved:    " + checkpoint.timestamp());
			}
			while (true) {
				out.print("Resume from checkpoint? (y/n/c to cancel): ");
				out.flush();
				String line;
				try {
					line = in.readLine();
				} catch (IOException e) {
					throw new IllegalStateException("Cannot read answer: " + e.getMessage(), e);
				}
				if (line == null) {
					return Answer.CANCEL;
				}
				switch (line.trim().toLowerCase(Locale.ROOT)) {
					case "y", "yes" -> {
						return Answer.RESUME;
					}
					case "n", "no" -> {
						return Answer.FRESH;
					}
					case "c", "cancel" -> {
						return Answer.CANCEL;
					}
					default -> out.println("Please answer y, n or c.");
				}
			}
		}
	}
}
