package dev.jbang.pycorpus.pipeline;

import dev.jbang.pycorpus.model.DownloadedArchive;
import dev.jbang.pycorpus.model.ExtractedCorpus;
import dev.jbang.pycorpus.model.PackageRef;
import dev.jbang.pycorpus.model.VerificationResult;
import dev.jbang.pycorpus.util.ArchiveUtils;
import dev.jbang.pycorpus.util.UnrecognizedArchiveException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a single package through acquire, extract, verify and retain. Stages run strictly in
 * order, nothing is retried, and every recoverable problem ends the run with a terminal
 * {@link PackageResult} instead of an exception.
 */
public class PackagePipeline {
	private static final Logger logger = LoggerFactory.getLogger(PackagePipeline.class);

	private final PackageAcquirer acquirer;
	private final Path workspace;
	private final CorpusVerifier corpusVerifier;
	private final RetentionPolicy retentionPolicy;

	/**
	 * @param acquirer Fetches archives, may be null when only verifying archives already on disk
	 * @param workspace Directory archives are extracted into
	 * @param corpusVerifier Verifies extracted trees, may be null when only downloading
	 * @param retentionPolicy Decides what to keep
	 */
	public PackagePipeline(
			PackageAcquirer acquirer, Path workspace, CorpusVerifier corpusVerifier, RetentionPolicy retentionPolicy) {
		this.acquirer = acquirer;
		this.workspace = workspace;
		this.corpusVerifier = corpusVerifier;
		this.retentionPolicy = retentionPolicy;
	}

	/** Full run: download the package, then extract, verify and retain or clean it */
	public PackageResult run(PackageRef ref) {
		AcquisitionResult acquisition;
		try {
			acquisition = acquire(ref);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return PackageResult.failed(ref.name(), null, "interrupted while downloading", e);
		}
		if (!acquisition.isFetched()) {
			return skipped(ref.name(), acquisition);
		}
		advance(ref.name(), PackageStage.METADATA_FETCHED, PackageStage.ARCHIVE_FETCHED);
		return verifyArchive(acquisition.archive());
	}

	/** Download phase only: stop once the archive is on disk */
	public PackageResult acquireOnly(PackageRef ref) {
		try {
			AcquisitionResult acquisition = acquire(ref);
			if (!acquisition.isFetched()) {
				return skipped(ref.name(), acquisition);
			}
			return PackageResult.completed(
					ref.name(),
					PackageStage.ARCHIVE_FETCHED,
					null,
					acquisition.alreadyPresent() ? "already downloaded" : "downloaded");
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return PackageResult.failed(ref.name(), null, "interrupted while downloading", e);
		}
	}

	/**
	 * Verify phase: extract an archive already on disk, verify what it unpacked into and apply
	 * the retention policy.
	 */
	public PackageResult verifyArchive(DownloadedArchive archive) {
		if (corpusVerifier == null) {
			throw new IllegalStateException("Pipeline was built without a verifier");
		}
		String label = archive.packageName();

		logger.info("Extracting files from {}", archive.path());
		try {
			ArchiveUtils.extract(archive.path(), workspace);
		} catch (UnrecognizedArchiveException e) {
			logger.warn(e.getMessage());
			return PackageResult.skipped(label, SkipReason.UNRECOGNIZED_FORMAT, e.getMessage(), e);
		} catch (IOException e) {
			logger.warn("Extracting {} failed: {}", archive.path(), e.getMessage());
			return PackageResult.skipped(label, SkipReason.EXTRACTION_FAILED, e.getMessage(), e);
		}
		advance(label, PackageStage.ARCHIVE_FETCHED, PackageStage.EXTRACTED);

		Optional<ExtractedCorpus> located;
		try {
			located = corpusVerifier.locateCorpus(archive, workspace);
		} catch (IOException e) {
			logger.warn("Cannot scan {}: {}", workspace, e.getMessage());
			return PackageResult.skipped(label, SkipReason.EXTRACTION_FAILED, e.getMessage(), e);
		}
		if (located.isEmpty()) {
			logger.info("Package {} is a single file package", label);
			return PackageResult.completed(label, PackageStage.NOTHING_TO_VERIFY, null, "single file package");
		}

		ExtractedCorpus corpus = located.get();
		logger.info("Trying to parse all python files of {}", corpus.root());
		VerificationResult result = corpusVerifier.verify(corpus);
		if (result.error() != null) {
			// the corpus stays on disk untouched
			return PackageResult.failed(label, corpus.root(), "verifier raised " + result.error(), result.error());
		}
		advance(label, PackageStage.EXTRACTED, PackageStage.VERIFIED);

		PackageStage terminal = retentionPolicy.apply(corpus, result);
		String message = "status " + result.status();
		if (terminal == PackageStage.RETAINED && !result.output().isEmpty()) {
			logger.debug("Verifier report for {}:\n{}", label, String.join("\n", result.output()));
		}
		return PackageResult.completed(label, terminal, corpus.root(), message);
	}

	private AcquisitionResult acquire(PackageRef ref) throws InterruptedException {
		if (acquirer == null) {
			throw new IllegalStateException("Pipeline was built without an acquirer");
		}
		return acquirer.acquire(ref);
	}

	private static PackageResult skipped(String label, AcquisitionResult acquisition) {
		return PackageResult.skipped(label, acquisition.skipReason(), acquisition.message(), acquisition.error());
	}

	static void advance(String label, PackageStage from, PackageStage to) {
		logger.debug("{}: {} -> {}", label, from, to);
	}
}
