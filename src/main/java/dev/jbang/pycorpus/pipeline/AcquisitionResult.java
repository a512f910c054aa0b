package dev.jbang.pycorpus.pipeline;

import dev.jbang.pycorpus.model.DownloadedArchive;

/** Outcome of fetching a package's metadata and source archive */
public record AcquisitionResult(
		DownloadedArchive archive, boolean alreadyPresent, SkipReason skipReason, String message, Exception error) {

	public static AcquisitionResult fetched(DownloadedArchive archive, boolean alreadyPresent) {
		return new AcquisitionResult(archive, alreadyPresent, null, null, null);
	}

	public static AcquisitionResult skipped(SkipReason reason, String message, Exception error) {
		return new AcquisitionResult(null, false, reason, message, error);
	}

	public boolean isFetched() {
		return archive != null;
	}
}
