package dev.jbang.pycorpus.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/** Utility class for file operations */
public class FileUtils {

	private FileUtils() {
		// Utility class
	}

	/** Ensure a directory exists, creating it if necessary */
	public static void ensureDirectory(Path directory) throws IOException {
		if (!Files.exists(directory)) {
			Files.createDirectories(directory);
		}
	}

	/**
	 * Recursively delete a directory and all its contents. Every path is attempted; the first
	 * failure is rethrown afterwards with the others attached as suppressed exceptions.
	 *
	 * @param directory The directory to delete
	 * @throws IOException If any path could not be removed
	 */
	public static void deleteDirectory(Path directory) throws IOException {
		if (!Files.exists(directory)) {
			return;
		}
		List<Path> paths;
		try (Stream<Path> walk = Files.walk(directory)) {
			// delete children before parents
			paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
		}
		IOException failure = null;
		for (Path path : paths) {
			try {
				Files.deleteIfExists(path);
			} catch (IOException e) {
				if (failure == null) {
					failure = e;
				} else {
					failure.addSuppressed(e);
				}
			}
		}
		if (failure != null) {
			throw failure;
		}
	}

	/**
	 * List the archives found directly in a directory, sorted by name.
	 *
	 * @param directory The directory to scan
	 * @param suffixes Accepted file name endings, e.g. {@code .tar.gz}
	 * @return The matching regular files
	 */
	public static List<Path> listFiles(Path directory, List<String> suffixes) throws IOException {
		if (!Files.isDirectory(directory)) {
			return List.of();
		}
		try (Stream<Path> files = Files.list(directory)) {
			return files.filter(Files::isRegularFile)
					.filter(p -> {
						String name = p.getFileName().toString();
						return suffixes.stream().anyMatch(name::endsWith);
					})
					.sorted()
					.collect(Collectors.toList());
		}
	}
}
