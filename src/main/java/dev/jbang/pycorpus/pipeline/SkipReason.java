package dev.jbang.pycorpus.pipeline;

/** Recoverable reasons for a package to leave the pipeline early */
public enum SkipReason {
	NO_METADATA("no metadata"),
	NO_SOURCE_DISTRIBUTION("no source distribution"),
	DUPLICATE_ARCHIVE("archive already being downloaded"),
	ARCHIVE_DOWNLOAD_FAILED("archive download failed"),
	UNRECOGNIZED_FORMAT("unrecognized archive format"),
	EXTRACTION_FAILED("extraction failed");

	private final String description;

	SkipReason(String description) {
		this.description = description;
	}

	public String description() {
		return description;
	}
}
