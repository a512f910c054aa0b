package dev.jbang.pycorpus.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jbang.pycorpus.model.DistributionFile;
import dev.jbang.pycorpus.model.DownloadedArchive;
import dev.jbang.pycorpus.model.PackageMetadata;
import dev.jbang.pycorpus.model.PackageRef;
import dev.jbang.pycorpus.util.FileUtils;
import dev.jbang.pycorpus.util.HttpUtils;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches a package's registry document and then its source archive. Every recoverable problem is
 * reported through the returned {@link AcquisitionResult}; only interruption escapes.
 */
public class PackageAcquirer {
	private static final Logger logger = LoggerFactory.getLogger(PackageAcquirer.class);

	/** Suffix of the file that reserves an archive while it is being downloaded */
	public static final String RESERVATION_SUFFIX = ".part";

	private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

	private final AcquisitionConfig config;
	private final HttpUtils httpUtils;
	private final ObjectMapper objectMapper = new ObjectMapper();

	public PackageAcquirer(AcquisitionConfig config) {
		this(config, new HttpUtils());
	}

	public PackageAcquirer(AcquisitionConfig config, HttpUtils httpUtils) {
		this.config = config;
		this.httpUtils = httpUtils;
	}

	public AcquisitionConfig config() {
		return config;
	}

	/**
	 * Fetch metadata and source archive for a package.
	 *
	 * @param ref The package
	 * @return The downloaded archive, or the reason there is none
	 * @throws InterruptedException If interrupted while waiting on the network
	 */
	public AcquisitionResult acquire(PackageRef ref) throws InterruptedException {
		String name = ref.name();
		if (!VALID_NAME.matcher(name).matches()) {
			logger.warn("Refusing to fetch {}: not a valid package name", name);
			return AcquisitionResult.skipped(SkipReason.NO_METADATA, "invalid package name", null);
		}

		Path metadataFile = config.metadataFile(name);
		try {
			logger.info("Downloading JSON data for {}", ref);
			try {
				FileUtils.ensureDirectory(config.dataDir());
				httpUtils.downloadFile(config.metadataUrl(name), metadataFile);
			} catch (IOException e) {
				logger.warn("Failed downloading package data for {}: {}", name, e.getMessage());
				return AcquisitionResult.skipped(SkipReason.NO_METADATA, e.getMessage(), e);
			}

			PackagePipeline.advance(name, PackageStage.PENDING, PackageStage.METADATA_FETCHED);
			PackageMetadata metadata;
			try {
				metadata = readMetadata(name, metadataFile);
			} catch (IOException e) {
				logger.warn("Unreadable package data for {}: {}", name, e.getMessage());
				return AcquisitionResult.skipped(SkipReason.NO_METADATA, "unreadable metadata document", e);
			}

			Optional<DistributionFile> source = metadata.sourceDistribution();
			if (source.isEmpty()) {
				logger.info("Could not locate source for {}", name);
				return AcquisitionResult.skipped(
						SkipReason.NO_SOURCE_DISTRIBUTION, metadata.files().size() + " artifacts, none of them source", null);
			}
			return fetchArchive(name, source.get());
		} finally {
			if (config.removeMetadata()) {
				removeMetadata(metadataFile);
			}
		}
	}

	/**
	 * Delete reservation files left behind by an earlier run that died mid-download. Must only be
	 * called while no worker is downloading.
	 *
	 * @return The number of files removed
	 */
	public int clearStaleReservations() throws IOException {
		List<Path> stale = FileUtils.listFiles(config.archiveDir(), List.of(RESERVATION_SUFFIX));
		for (Path path : stale) {
			logger.info("Removing stale partial download {}", path.getFileName());
			Files.deleteIfExists(path);
		}
		return stale.size();
	}

	PackageMetadata readMetadata(String name, Path metadataFile) throws IOException {
		JsonNode json = objectMapper.readTree(metadataFile.toFile());
		if (json == null || !json.isObject()) {
			throw new IOException("Metadata for " + name + " is not a JSON object");
		}
		return PackageMetadata.fromJson(name, json);
	}

	private AcquisitionResult fetchArchive(String name, DistributionFile source) throws InterruptedException {
		String filename = Path.of(source.filename()).getFileName().toString();
		Path archiveDir = config.archiveDir();
		Path destination = archiveDir.resolve(filename);
		DownloadedArchive archive = new DownloadedArchive(destination, name);

		if (Files.exists(destination)) {
			logger.info("{} already downloaded", name);
			return AcquisitionResult.fetched(archive, true);
		}

		Path reservation = archiveDir.resolve(filename + RESERVATION_SUFFIX);
		try {
			FileUtils.ensureDirectory(archiveDir);
			Files.createFile(reservation);
		} catch (FileAlreadyExistsException e) {
			logger.info("{} is already being downloaded by another worker", filename);
			return AcquisitionResult.skipped(SkipReason.DUPLICATE_ARCHIVE, filename, null);
		} catch (IOException e) {
			logger.warn("Cannot reserve {}: {}", reservation, e.getMessage());
			return AcquisitionResult.skipped(SkipReason.ARCHIVE_DOWNLOAD_FAILED, e.getMessage(), e);
		}

		boolean moved = false;
		try {
			// a peer may have completed its download between the check above and our reservation
			if (Files.exists(destination)) {
				logger.info("{} already downloaded", name);
				return AcquisitionResult.fetched(archive, true);
			}
			logger.info("Downloading package {} ({})", name, filename);
			httpUtils.downloadFile(source.url(), reservation);
			Files.move(reservation, destination, StandardCopyOption.ATOMIC_MOVE);
			moved = true;
			logger.info("Downloaded {}", filename);
			return AcquisitionResult.fetched(archive, false);
		} catch (IOException e) {
			logger.warn("Failed downloading {} for {}: {}", filename, name, e.getMessage());
			return AcquisitionResult.skipped(SkipReason.ARCHIVE_DOWNLOAD_FAILED, e.getMessage(), e);
		} finally {
			if (!moved) {
				releaseReservation(reservation);
			}
		}
	}

	private void releaseReservation(Path reservation) {
		try {
			Files.deleteIfExists(reservation);
		} catch (IOException e) {
			logger.warn("Could not remove partial download {}: {}", reservation, e.getMessage());
		}
	}

	private void removeMetadata(Path metadataFile) {
		try {
			Files.deleteIfExists(metadataFile);
		} catch (IOException e) {
			logger.warn("Could not remove metadata {}: {}", metadataFile, e.getMessage());
		}
	}
}
