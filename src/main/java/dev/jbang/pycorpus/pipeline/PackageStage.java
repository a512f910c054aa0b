package dev.jbang.pycorpus.pipeline;

/**
 * Where a package is in its pipeline. A package moves strictly forward through the working stages
 * and ends in exactly one terminal stage.
 */
public enum PackageStage {
	PENDING,
	METADATA_FETCHED,
	ARCHIVE_FETCHED,
	EXTRACTED,
	VERIFIED,
	/** Verification failed, the extracted corpus is kept for inspection */
	RETAINED,
	/** Verification passed, the extracted corpus was removed */
	CLEANED,
	/** The archive unpacked into no directory of its own, so there was nothing to verify */
	NOTHING_TO_VERIFY,
	SKIPPED,
	FAILED
}
