package dev.jbang.pycorpus.pipeline;

import dev.jbang.pycorpus.model.ExtractedCorpus;
import dev.jbang.pycorpus.model.VerificationResult;
import dev.jbang.pycorpus.util.FileUtils;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides what happens to a verified corpus: trees that passed are reclaimed, trees that failed
 * stay on disk as the regression corpus. Never throws.
 */
public class RetentionPolicy {
	private static final Logger logger = LoggerFactory.getLogger(RetentionPolicy.class);

	/**
	 * Apply the policy.
	 *
	 * @param corpus The extracted tree
	 * @param result Its verification result
	 * @return {@link PackageStage#CLEANED} or {@link PackageStage#RETAINED}
	 */
	public PackageStage apply(ExtractedCorpus corpus, VerificationResult result) {
		if (!result.passed()) {
			logger.warn("Failed to parse {}, keeping {} for follow-up", corpus.owningPackage(), corpus.root());
			return PackageStage.RETAINED;
		}
		try {
			FileUtils.deleteDirectory(corpus.root());
			logger.info("Verified {}, removed {}", corpus.owningPackage(), corpus.root());
		} catch (IOException e) {
			logger.warn("Verified {} but could not remove {}: {}", corpus.owningPackage(), corpus.root(), e.getMessage());
		}
		return PackageStage.CLEANED;
	}
}
