package dev.ocip.harvester;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/** Main application class with CLI support */
@Command(
		name = "portal-harvester",
		version = "1.0.0",
		description = "Checkpointed extraction of experts, facilities and organizations from the OCIP portal",
		mixinStandardHelpOptions = true,
		subcommands = {RunCommand.class, StatusCommand.class, CleanCommand.class})
public class Main implements Callable<Integer> {

	@Spec
	CommandSpec spec;

	@Override
	public Integer call() {
		spec.commandLine().usage(System.out);
		return 0;
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
