package dev.jbang.pycorpus.util;

import static org.assertj.core.api.Assertions.*;

import dev.jbang.pycorpus.pipeline.RegistryServer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HttpUtilsTest {

	@TempDir
	Path tempDir;

	RegistryServer server;
	HttpUtils httpUtils;

	@BeforeEach
	void setUp() throws Exception {
		server = RegistryServer.start();
		httpUtils = new HttpUtils(3, Duration.ZERO);
	}

	@AfterEach
	void tearDown() {
		server.close();
	}

	@Test
	void testDownloadFile() throws Exception {
		// Given
		server.respond("/doc", 200, "{\"rows\": []}");
		Path target = tempDir.resolve("doc.json");
		Files.writeString(target, "stale");

		// When
		httpUtils.downloadFile(server.url() + "/doc", target);

		// Then
		assertThat(Files.readString(target)).isEqualTo("{\"rows\": []}");
	}

	@Test
	void testDownloadWritesIntoExistingFile() throws Exception {
		// Given
		server.respond("/archive", 200, "archive bytes");
		Path target = Files.writeString(tempDir.resolve("alpha-1.0.tar.gz.part"), "");
		Object fileKey = Files.readAttributes(target, BasicFileAttributes.class).fileKey();

		// When
		httpUtils.downloadFile(server.url() + "/archive", target);

		// Then
		assertThat(Files.readString(target)).isEqualTo("archive bytes");
		assertThat(Files.readAttributes(target, BasicFileAttributes.class).fileKey()).isEqualTo(fileKey);
	}

	@Test
	void testClientErrorIsNotRetried() {
		// When/Then
		assertThatThrownBy(() -> httpUtils.downloadFile(server.url() + "/missing", tempDir.resolve("x")))
				.isInstanceOfSatisfying(
						HttpStatusException.class, e -> assertThat(e.statusCode()).isEqualTo(404));
		assertThat(server.requests("/missing")).isEqualTo(1);
		assertThat(tempDir.resolve("x")).doesNotExist();
	}

	@Test
	void testServerErrorIsRetried() {
		// Given
		server.respond("/flaky", 503, "busy");

		// When/Then
		assertThatThrownBy(() -> httpUtils.downloadFile(server.url() + "/flaky", tempDir.resolve("flaky")))
				.isInstanceOf(HttpStatusException.class)
				.hasMessageContaining("503");
		assertThat(server.requests("/flaky")).isEqualTo(3);
		assertThat(tempDir.resolve("flaky")).doesNotExist();
	}

	@Test
	void testRetryableStatuses() {
		assertThat(new HttpStatusException("u", 429).isRetryable()).isTrue();
		assertThat(new HttpStatusException("u", 500).isRetryable()).isTrue();
		assertThat(new HttpStatusException("u", 403).isRetryable()).isFalse();
	}
}
