package dev.jbang.pycorpus;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/** Main application class with CLI support */
@Command(
		name = "pypi-corpus",
		version = "1.0.0",
		description = "Builds a corpus of real-world packages the parser under test fails on",
		mixinStandardHelpOptions = true,
		subcommands = {DownloadCommand.class, VerifyCommand.class, RunCommand.class})
public class Main implements Runnable {

	@Spec
	CommandSpec spec;

	@Override
	public void run() {
		throw new ParameterException(spec.commandLine(), "Missing required subcommand");
	}

	public static void main(String[] args) {
		int exitCode = new CommandLine(new Main()).execute(args);
		System.exit(exitCode);
	}
}
