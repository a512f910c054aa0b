package dev.jbang.pycorpus.model;

import static org.assertj.core.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class PackageMetadataTest {

	private final ObjectMapper objectMapper = new ObjectMapper();

	@Test
	void testFromJsonPicksSourceDistribution() throws Exception {
		// Given
		JsonNode json = objectMapper.readTree("""
			{
				"info": {"name": "alpha", "version": "1.0"},
				"urls": [
					{
						"python_version": "py3",
						"packagetype": "bdist_wheel",
						"filename": "alpha-1.0-py3-none-any.whl",
						"url": "https://files.example/alpha-1.0-py3-none-any.whl"
					},
					{
						"python_version": "source",
						"packagetype": "sdist",
						"filename": "alpha-1.0.tar.gz",
						"url": "https://files.example/alpha-1.0.tar.gz"
					},
					{
						"python_version": "source",
						"packagetype": "sdist",
						"filename": "alpha-1.0.zip",
						"url": "https://files.example/alpha-1.0.zip"
					}
				]
			}""");

		// When
		PackageMetadata metadata = PackageMetadata.fromJson("alpha", json);

		// Then
		assertThat(metadata.name()).isEqualTo("alpha");
		assertThat(metadata.files()).hasSize(3);
		assertThat(metadata.sourceDistribution()).hasValueSatisfying(file -> {
			assertThat(file.filename()).isEqualTo("alpha-1.0.tar.gz");
			assertThat(file.url()).isEqualTo("https://files.example/alpha-1.0.tar.gz");
		});
	}

	@Test
	void testWheelOnlyPackageHasNoSource() throws Exception {
		// Given
		JsonNode json = objectMapper.readTree("""
			{"urls": [{"python_version": "cp311", "filename": "beta-2.0-cp311.whl", "url": "https://x/b.whl"}]}""");

		// When/Then
		assertThat(PackageMetadata.fromJson("beta", json).sourceDistribution()).isEmpty();
	}

	@Test
	void testMissingUrlsYieldsNoFiles() throws Exception {
		// When
		PackageMetadata metadata = PackageMetadata.fromJson("gamma", objectMapper.readTree("{\"info\": {}}"));

		// Then
		assertThat(metadata.files()).isEmpty();
		assertThat(metadata.sourceDistribution()).isEmpty();
	}

	@Test
	void testSourceEntryWithoutUrlIsIgnored() throws Exception {
		// Given
		JsonNode json = objectMapper.readTree("""
			{"urls": [{"python_version": "source", "filename": "delta-1.0.tar.gz", "url": null}]}""");

		// When/Then
		assertThat(PackageMetadata.fromJson("delta", json).sourceDistribution()).isEmpty();
	}

	@Test
	void testDownloadedArchiveNames() {
		assertThat(DownloadedArchive.of(Path.of("pypi/alpha-1.0.tar.gz")).packageName()).isEqualTo("alpha-1.0");
		assertThat(DownloadedArchive.of(Path.of("pypi/beta-2.0.tgz")).packageName()).isEqualTo("beta-2.0");
		assertThat(DownloadedArchive.of(Path.of("pypi/gamma-0.1.zip")).filename()).isEqualTo("gamma-0.1.zip");
		assertThat(DownloadedArchive.of(Path.of("pypi/eta-1.0.tar.xz")).packageName()).isEqualTo("eta-1.0");
	}

	@Test
	void testPackageRefToString() {
		assertThat(new PackageRef("requests", 3)).hasToString("#3 requests");
	}
}
