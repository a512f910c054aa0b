package dev.jbang.pycorpus.util;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Enumeration;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import org.apache.commons.compress.archivers.ArchiveException;
import org.apache.commons.compress.archivers.ArchiveStreamFactory;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.CompressorException;
import org.apache.commons.compress.compressors.CompressorStreamFactory;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.xz.XZCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Utilities for recognizing and unpacking source archives. */
public class ArchiveUtils {
	private static final Logger logger = LoggerFactory.getLogger(ArchiveUtils.class);

	/** Archive layouts we know how to unpack, identified by content */
	public enum ArchiveFormat {
		TAR,
		TAR_GZIP,
		TAR_BZIP2,
		TAR_XZ,
		ZIP
	}

	private ArchiveUtils() {
		// Utility class
	}

	/**
	 * Identify an archive by its leading bytes. The file name plays no part, so a text file renamed
	 * to {@code .zip} is still rejected.
	 *
	 * @param archiveFile The file to inspect
	 * @return The detected format
	 * @throws UnrecognizedArchiveException If the file is neither a tar-family nor a zip archive
	 */
	public static ArchiveFormat detectFormat(Path archiveFile) throws IOException {
		try (InputStream in = new BufferedInputStream(Files.newInputStream(archiveFile))) {
			String compression = detectCompression(in);
			ArchiveFormat compressedTar = compressedTarFormat(compression);
			if (compressedTar != null) {
				try (InputStream decompressed = new BufferedInputStream(decompress(compressedTar, in))) {
					if (ArchiveStreamFactory.TAR.equals(detectContainer(decompressed))) {
						return compressedTar;
					}
				} catch (IOException e) {
					throw new UnrecognizedArchiveException(archiveFile, e);
				}
				throw new UnrecognizedArchiveException(archiveFile);
			}

			String container = detectContainer(in);
			if (ArchiveStreamFactory.TAR.equals(container)) {
				return ArchiveFormat.TAR;
			} else if (ArchiveStreamFactory.ZIP.equals(container) || ArchiveStreamFactory.JAR.equals(container)) {
				return ArchiveFormat.ZIP;
			}
		}
		throw new UnrecognizedArchiveException(archiveFile);
	}

	/**
	 * Extract every directory and regular file of an archive below the target directory.
	 * Links are not materialized. Nothing is cleaned up when extraction fails half way.
	 *
	 * @param archiveFile The archive to unpack
	 * @param targetDir The directory receiving the entries
	 * @return The detected format
	 * @throws UnrecognizedArchiveException If the format is not supported
	 * @throws IOException If reading the archive or writing an entry fails, or an entry points
	 *     outside the target directory
	 */
	public static ArchiveFormat extract(Path archiveFile, Path targetDir) throws IOException {
		ArchiveFormat format = detectFormat(archiveFile);
		FileUtils.ensureDirectory(targetDir);
		Path root = targetDir.toAbsolutePath().normalize();
		logger.debug("Extracting {} ({}) into {}", archiveFile, format, root);
		switch (format) {
			case ZIP -> extractZip(archiveFile, root);
			case TAR -> {
				try (InputStream in = new BufferedInputStream(Files.newInputStream(archiveFile))) {
					extractTar(in, root);
				}
			}
			case TAR_GZIP, TAR_BZIP2, TAR_XZ -> {
				try (InputStream in = new BufferedInputStream(Files.newInputStream(archiveFile));
						InputStream decompressed = new BufferedInputStream(decompress(format, in))) {
					extractTar(decompressed, root);
				}
			}
		}
		return format;
	}

	private static void extractTar(InputStream in, Path root) throws IOException {
		try (TarArchiveInputStream tis = new TarArchiveInputStream(in)) {
			TarArchiveEntry entry;
			while ((entry = tis.getNextEntry()) != null) {
				Path target = resolveEntry(root, entry.getName());
				if (entry.isDirectory()) {
					Files.createDirectories(target);
				} else if (entry.isFile() && tis.canReadEntryData(entry)) {
					Files.createDirectories(target.getParent());
					Files.copy(tis, target, StandardCopyOption.REPLACE_EXISTING);
				} else {
					logger.debug("Skipping non-regular tar entry {}", entry.getName());
				}
			}
		}
	}

	private static void extractZip(Path zipFile, Path root) throws IOException {
		try (ZipFile zip = new ZipFile(zipFile.toFile())) {
			Enumeration<? extends ZipEntry> entries = zip.entries();
			while (entries.hasMoreElements()) {
				ZipEntry entry = entries.nextElement();
				Path target = resolveEntry(root, entry.getName());
				if (entry.isDirectory()) {
					Files.createDirectories(target);
				} else {
					Files.createDirectories(target.getParent());
					try (InputStream is = zip.getInputStream(entry)) {
						Files.copy(is, target, StandardCopyOption.REPLACE_EXISTING);
					}
				}
			}
		}
	}

	/** Resolve an entry name below the root, refusing names that climb out of it */
	static Path resolveEntry(Path root, String entryName) throws IOException {
		Path target = root.resolve(entryName).normalize();
		if (!target.startsWith(root)) {
			throw new IOException("Archive entry is outside of the target directory: " + entryName);
		}
		return target;
	}

	private static String detectCompression(InputStream in) {
		try {
			return CompressorStreamFactory.detect(in);
		} catch (CompressorException e) {
			// not compressed
			return null;
		}
	}

	private static String detectContainer(InputStream in) {
		try {
			return ArchiveStreamFactory.detect(in);
		} catch (ArchiveException e) {
			logger.trace("No archive signature: {}", e.getMessage());
			return null;
		}
	}

	/** The tar format a compression layer wraps, or null for compressions we do not unpack */
	private static ArchiveFormat compressedTarFormat(String compression) {
		if (CompressorStreamFactory.GZIP.equals(compression)) {
			return ArchiveFormat.TAR_GZIP;
		} else if (CompressorStreamFactory.BZIP2.equals(compression)) {
			return ArchiveFormat.TAR_BZIP2;
		} else if (CompressorStreamFactory.XZ.equals(compression)) {
			return ArchiveFormat.TAR_XZ;
		}
		return null;
	}

	private static InputStream decompress(ArchiveFormat format, InputStream in) throws IOException {
		return switch (format) {
			case TAR_GZIP -> new GzipCompressorInputStream(in, true);
			case TAR_BZIP2 -> new BZip2CompressorInputStream(in, true);
			case TAR_XZ -> new XZCompressorInputStream(in, true);
			default -> throw new IllegalArgumentException("Not a compressed tar format: " + format);
		};
	}
}
