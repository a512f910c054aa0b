package dev.jbang.pycorpus.verifier;

import java.nio.file.Path;
import java.util.List;

/**
 * A request to verify one source tree.
 *
 * @param root The directory to verify
 * @param grammar The grammar definition to verify against
 * @param excludedGlobs Patterns of files to leave out
 * @param treeLevel How closely to compare the produced tree with the reference one, 0 disables
 */
public record VerificationRequest(Path root, Path grammar, List<String> excludedGlobs, int treeLevel) {

	/** Known-bad fixtures that every package may ship and that are expected to fail */
	public static final List<String> DEFAULT_EXCLUDES = List.of(
			"*/failset/*",
			"*/failset/**",
			"*/failset/**/*",
			"*/test2to3/*",
			"*/test2to3/**/*",
			"*/bad*",
			"*/lib2to3/tests/data/*");

	public VerificationRequest {
		excludedGlobs = List.copyOf(excludedGlobs);
	}
}
