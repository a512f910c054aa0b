package dev.jbang.pycorpus;

import dev.jbang.pycorpus.pipeline.CorpusVerifier;
import dev.jbang.pycorpus.verifier.VerificationRequest;
import dev.jbang.pycorpus.verifier.Verifier;
import dev.jbang.pycorpus.verifier.VerifierConfig;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import picocli.CommandLine.Option;

/** Options controlling how extracted packages are verified */
public class VerificationOptions {

	@Option(
			names = {"-t", "--tree"},
			description = "Compare parse tree to official AST, repeat to compare more closely")
	boolean[] tree = new boolean[0];

	@Option(
			names = {"-g", "--grammar"},
			description = "Grammar file handed to the verifier (default: data/simpy.gram)",
			defaultValue = "data/simpy.gram")
	Path grammar;

	@Option(
			names = {"--verifier"},
			description = "Verifier command line, whitespace separated (default: python3 -m scripts.test_parse_directory)",
			defaultValue = "python3 -m scripts.test_parse_directory")
	String verifier;

	@Option(
			names = {"--prepare"},
			description = "Command run once before verification starts, e.g. to build the parser")
	String prepare;

	@Option(
			names = {"--verify-timeout"},
			description = "Seconds a single package may take to verify, 0 for no limit (default: 0)",
			defaultValue = "0")
	long verifyTimeout;

	@Option(
			names = {"-e", "--exclude"},
			description = "Additional glob of files the verifier should skip")
	List<String> excludes = new ArrayList<>();

	@Option(
			names = {"--full-report"},
			description = "Ask the verifier for its full report instead of the short one")
	boolean fullReport;

	int treeLevel() {
		return tree.length;
	}

	VerifierConfig toConfig(Path workingDir) {
		if (verifyTimeout < 0) {
			throw new IllegalArgumentException("--verify-timeout must not be negative");
		}
		return new VerifierConfig(
				split(verifier), grammar, split(prepare), workingDir, Duration.ofSeconds(verifyTimeout), !fullReport);
	}

	CorpusVerifier createCorpusVerifier(Verifier verifier) {
		List<String> globs = new ArrayList<>(VerificationRequest.DEFAULT_EXCLUDES);
		globs.addAll(excludes);
		return new CorpusVerifier(verifier, grammar, globs, treeLevel());
	}

	private static List<String> split(String command) {
		if (command == null || command.isBlank()) {
			return List.of();
		}
		return Arrays.asList(command.trim().split("\\s+"));
	}
}
