package dev.jbang.pycorpus.model;

import java.util.List;

/**
 * Outcome of running the verifier over an extracted corpus.
 *
 * @param status Exit status, zero when every file conformed
 * @param output Tail of the verifier's per-file report, possibly empty
 * @param error The exception raised while invoking the verifier, or null
 */
public record VerificationResult(int status, List<String> output, Exception error) {

	public VerificationResult {
		output = output == null ? List.of() : List.copyOf(output);
	}

	public static VerificationResult of(int status, List<String> output) {
		return new VerificationResult(status, output, null);
	}

	public static VerificationResult error(Exception error) {
		return new VerificationResult(1, List.of(), error);
	}

	public boolean passed() {
		return status == 0 && error == null;
	}
}
