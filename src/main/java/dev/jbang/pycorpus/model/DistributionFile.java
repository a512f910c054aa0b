package dev.jbang.pycorpus.model;

/**
 * A single distributable artifact listed in a package's registry document.
 *
 * @param pythonVersion The classifier, {@code "source"} for source distributions
 * @param filename The archive file name
 * @param url The download location
 */
public record DistributionFile(String pythonVersion, String filename, String url) {

	public static final String SOURCE = "source";

	/** Whether this artifact is a source distribution */
	public boolean isSource() {
		return SOURCE.equals(pythonVersion) && filename != null && url != null;
	}
}
