package dev.jbang.pycorpus.pipeline;

import java.nio.file.Path;

/**
 * Where package data comes from and where it is kept.
 *
 * @param dataDir Root of the on-disk layout, metadata documents live directly in it
 * @param registryUrl Base URL of the package registry
 * @param removeMetadata Delete each metadata document once the archive step is over
 */
public record AcquisitionConfig(Path dataDir, String registryUrl, boolean removeMetadata) {
	public static final String DEFAULT_REGISTRY = "https://pypi.org";
	public static final String ARCHIVE_DIR = "pypi";

	public AcquisitionConfig {
		registryUrl = registryUrl.endsWith("/") ? registryUrl.substring(0, registryUrl.length() - 1) : registryUrl;
	}

	/** The shared workspace holding archives and their extracted trees */
	public Path archiveDir() {
		return dataDir.resolve(ARCHIVE_DIR);
	}

	public Path metadataFile(String packageName) {
		return dataDir.resolve(packageName + ".json");
	}

	public String metadataUrl(String packageName) {
		return registryUrl + "/pypi/" + packageName + "/json";
	}
}
