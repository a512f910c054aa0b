package dev.jbang.pycorpus.verifier;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Settings for running the verifier as an external command.
 *
 * @param command The verifier executable and its leading arguments
 * @param grammar The grammar definition passed to every invocation
 * @param prepareCommand Command run once before the batch starts, empty for none
 * @param workingDir Directory the commands run in
 * @param timeout Wall-clock bound per invocation, zero for none
 * @param shortReport Ask the verifier for its condensed report
 */
public record VerifierConfig(
		List<String> command,
		Path grammar,
		List<String> prepareCommand,
		Path workingDir,
		Duration timeout,
		boolean shortReport) {

	public static final List<String> DEFAULT_COMMAND = List.of("python3", "-m", "scripts.test_parse_directory");

	public VerifierConfig {
		if (command == null || command.isEmpty()) {
			throw new IllegalArgumentException("Verifier command must not be empty");
		}
		command = List.copyOf(command);
		prepareCommand = prepareCommand == null ? List.of() : List.copyOf(prepareCommand);
		timeout = timeout == null ? Duration.ZERO : timeout;
	}

	public boolean hasTimeout() {
		return !timeout.isZero() && !timeout.isNegative();
	}
}
