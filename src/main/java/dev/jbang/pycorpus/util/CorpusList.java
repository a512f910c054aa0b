package dev.jbang.pycorpus.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jbang.pycorpus.model.PackageRef;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the priority-ordered list of packages to process. The list is a JSON document with a
 * {@code rows} array whose entries name the package in their {@code project} field, most
 * downloaded first.
 */
public class CorpusList {
	public static final String DEFAULT_NAME = "top-pypi-packages-365-days";
	public static final int MAX_PACKAGES = 4000;

	private static final ObjectMapper objectMapper = new ObjectMapper();

	private CorpusList() {
		// Utility class
	}

	/** Location of a corpus list inside the data directory */
	public static Path location(Path dataDir, String name) {
		return dataDir.resolve(name + ".json");
	}

	/**
	 * Read a corpus list.
	 *
	 * @param file The JSON document
	 * @param limit Maximum number of packages, between 0 and {@link #MAX_PACKAGES}
	 * @param all Take every package and ignore the limit
	 * @return The packages in rank order
	 * @throws IllegalArgumentException If the limit is out of range and {@code all} is not set
	 * @throws IOException If the document cannot be read or has no {@code rows} array
	 */
	public static List<PackageRef> load(Path file, int limit, boolean all) throws IOException {
		if (!all && (limit < 0 || limit > MAX_PACKAGES)) {
			throw new IllegalArgumentException("Unknown value for number of packages: " + limit);
		}
		JsonNode root;
		try (var in = Files.newInputStream(file)) {
			root = objectMapper.readTree(in);
		}
		JsonNode rows = root == null ? null : root.get("rows");
		if (rows == null || !rows.isArray()) {
			throw new IOException("Corpus list " + file + " has no 'rows' array");
		}
		List<PackageRef> packages = new ArrayList<>();
		for (JsonNode row : rows) {
			if (!all && packages.size() >= limit) {
				break;
			}
			String project = row.path("project").asText(null);
			if (project == null || project.isBlank()) {
				throw new IOException("Corpus list " + file + " has a row without 'project' at rank " + packages.size());
			}
			packages.add(new PackageRef(project, packages.size()));
		}
		return packages;
	}
}
