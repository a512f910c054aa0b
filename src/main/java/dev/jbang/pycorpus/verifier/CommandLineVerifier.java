package dev.jbang.pycorpus.verifier;

import dev.jbang.pycorpus.model.VerificationResult;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the verifier as a child process. Each invocation gets its own process, so a verifier that
 * crashes or hangs on one tree never affects the others.
 */
public class CommandLineVerifier implements Verifier {
	private static final Logger logger = LoggerFactory.getLogger(CommandLineVerifier.class);

	/** Status reported when an invocation exceeded its time limit */
	public static final int TIMEOUT_STATUS = 124;

	private static final int MAX_OUTPUT_LINES = 50;

	private final VerifierConfig config;

	private CommandLineVerifier(VerifierConfig config) {
		this.config = config;
	}

	/**
	 * Perform the one-time setup and return a verifier ready to be shared by all workers. The
	 * grammar must exist, and the prepare command, when configured, must succeed.
	 *
	 * @param config The verifier settings
	 * @return The verifier
	 * @throws IOException If the grammar is missing or preparation fails
	 * @throws InterruptedException If interrupted while preparing
	 */
	public static CommandLineVerifier initialize(VerifierConfig config) throws IOException, InterruptedException {
		if (!Files.isRegularFile(config.grammar())) {
			throw new IOException("Grammar file not found: " + config.grammar());
		}
		if (!config.prepareCommand().isEmpty()) {
			logger.info("Preparing verifier: {}", String.join(" ", config.prepareCommand()));
			Process process = new ProcessBuilder(config.prepareCommand())
					.directory(config.workingDir().toFile())
					.redirectErrorStream(true)
					.redirectOutput(ProcessBuilder.Redirect.INHERIT)
					.start();
			int exitCode = process.waitFor();
			if (exitCode != 0) {
				throw new IOException("Verifier preparation failed with exit code: " + exitCode);
			}
		}
		return new CommandLineVerifier(config);
	}

	@Override
	public VerificationResult verify(VerificationRequest request) throws IOException, InterruptedException {
		List<String> command = buildCommand(request);
		logger.debug("Running {}", command);

		Path outputFile = Files.createTempFile("pycorpus-verifier-", ".log");
		try {
			Process process = new ProcessBuilder(command)
					.directory(config.workingDir().toFile())
					.redirectErrorStream(true)
					.redirectOutput(outputFile.toFile())
					.start();

			int status;
			try {
				status = waitFor(process, request);
			} catch (InterruptedException e) {
				destroy(process);
				throw e;
			}
			return VerificationResult.of(status, tail(outputFile));
		} finally {
			Files.deleteIfExists(outputFile);
		}
	}

	/** Assemble the command line for one request */
	List<String> buildCommand(VerificationRequest request) {
		List<String> command = new ArrayList<>(config.command());
		command.add("--directory");
		command.add(request.root().toString());
		command.add("--grammar-file");
		command.add(request.grammar().toString());
		for (String glob : request.excludedGlobs()) {
			command.add("--exclude");
			command.add(glob);
		}
		for (int i = 0; i < request.treeLevel(); i++) {
			command.add("--tree");
		}
		if (config.shortReport()) {
			command.add("--short");
		}
		return command;
	}

	private int waitFor(Process process, VerificationRequest request) throws InterruptedException {
		if (!config.hasTimeout()) {
			return process.waitFor();
		}
		if (process.waitFor(config.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
			return process.exitValue();
		}
		logger.warn("Verifier exceeded {} on {}, killing it", config.timeout(), request.root());
		destroy(process);
		process.waitFor(5, TimeUnit.SECONDS);
		return TIMEOUT_STATUS;
	}

	private static void destroy(Process process) {
		process.descendants().forEach(ProcessHandle::destroyForcibly);
		process.destroyForcibly();
	}

	private static List<String> tail(Path outputFile) throws IOException {
		Deque<String> lines = new ArrayDeque<>();
		// InputStreamReader replaces malformed bytes instead of failing on them
		try (BufferedReader reader =
				new BufferedReader(new InputStreamReader(Files.newInputStream(outputFile), StandardCharsets.UTF_8))) {
			String line;
			while ((line = reader.readLine()) != null) {
				if (lines.size() == MAX_OUTPUT_LINES) {
					lines.removeFirst();
				}
				lines.addLast(line);
			}
		}
		return new ArrayList<>(lines);
	}
}
