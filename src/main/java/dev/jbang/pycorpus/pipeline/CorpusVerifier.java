package dev.jbang.pycorpus.pipeline;

import dev.jbang.pycorpus.model.DownloadedArchive;
import dev.jbang.pycorpus.model.ExtractedCorpus;
import dev.jbang.pycorpus.model.VerificationResult;
import dev.jbang.pycorpus.verifier.VerificationRequest;
import dev.jbang.pycorpus.verifier.Verifier;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Finds the tree an archive unpacked into and hands it to the verifier. */
public class CorpusVerifier {
	private static final Logger logger = LoggerFactory.getLogger(CorpusVerifier.class);

	private final Verifier verifier;
	private final Path grammar;
	private final List<String> excludedGlobs;
	private final int treeLevel;

	public CorpusVerifier(Verifier verifier, Path grammar, List<String> excludedGlobs, int treeLevel) {
		this.verifier = verifier;
		this.grammar = grammar;
		this.excludedGlobs = List.copyOf(excludedGlobs);
		this.treeLevel = treeLevel;
	}

	/**
	 * Locate the directory an archive unpacked into. Source archives usually contain a single
	 * versioned directory whose name is a prefix of the archive name ({@code alpha-1.0.tar.gz}
	 * holds {@code alpha-1.0/}), so the workspace directory whose name occurs in the archive name
	 * is taken. When several do, the longest name wins.
	 *
	 * @param archive The archive that was extracted
	 * @param workspace The shared extraction directory
	 * @return The corpus, or empty for a package that unpacked into loose files
	 */
	public Optional<ExtractedCorpus> locateCorpus(DownloadedArchive archive, Path workspace) throws IOException {
		String archiveName = archive.filename();
		try (Stream<Path> entries = Files.list(workspace)) {
			return entries.filter(Files::isDirectory)
					.filter(dir -> archiveName.contains(dir.getFileName().toString()))
					.max(Comparator.comparingInt((Path dir) -> dir.getFileName().toString().length())
							.thenComparing(Comparator.reverseOrder()))
					.map(dir -> new ExtractedCorpus(dir, archive.packageName()));
		}
	}

	/**
	 * Run the verifier over a corpus. Whatever goes wrong while invoking it is logged and reported
	 * as a nonzero result carrying the exception.
	 *
	 * @param corpus The tree to verify
	 * @return The verifier's verdict
	 */
	public VerificationResult verify(ExtractedCorpus corpus) {
		VerificationRequest request = new VerificationRequest(corpus.root(), grammar, excludedGlobs, treeLevel);
		try {
			VerificationResult result = verifier.verify(request);
			if (result == null) {
				throw new IllegalStateException("Verifier returned no result");
			}
			return result;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.warn("Interrupted while verifying {}", corpus.owningPackage());
			return VerificationResult.error(e);
		} catch (Exception e) {
			logger.error("Exception encountered in analyzing {}", corpus.owningPackage(), e);
			return VerificationResult.error(e);
		}
	}
}
