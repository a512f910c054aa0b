package dev.jbang.pycorpus.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Registry-supplied description of a package and the artifacts it distributes */
public record PackageMetadata(String name, List<DistributionFile> files) {

	public PackageMetadata {
		files = List.copyOf(files);
	}

	/**
	 * Build metadata from a PyPI JSON API document. Entries live in the top level {@code urls}
	 * array; a missing array yields an empty file list.
	 *
	 * @param name The package name the document was fetched for
	 * @param json The parsed document
	 * @return The metadata
	 */
	public static PackageMetadata fromJson(String name, JsonNode json) {
		List<DistributionFile> files = new ArrayList<>();
		JsonNode urls = json.path("urls");
		if (urls.isArray()) {
			for (JsonNode entry : urls) {
				files.add(new DistributionFile(
						text(entry, "python_version"),
						text(entry, "filename"),
						text(entry, "url")));
			}
		}
		return new PackageMetadata(name, files);
	}

	/** Find the first source distribution, if the package publishes one */
	public Optional<DistributionFile> sourceDistribution() {
		return files.stream().filter(DistributionFile::isSource).findFirst();
	}

	private static String text(JsonNode node, String field) {
		JsonNode value = node.get(field);
		return value == null || value.isNull() ? null : value.asText();
	}
}
