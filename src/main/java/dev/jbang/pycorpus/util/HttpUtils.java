package dev.jbang.pycorpus.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Utility class for HTTP operations */
public class HttpUtils {
	private static final Logger logger = LoggerFactory.getLogger(HttpUtils.class);

	/** Functional interface for operations that can throw IOException and InterruptedException */
	@FunctionalInterface
	private interface IOSupplier<T> {
		T get() throws IOException, InterruptedException;
	}

	private static final int DEFAULT_MAX_RETRIES = 3;
	private static final Duration INITIAL_BACKOFF = Duration.ofSeconds(2);

	private final HttpClient httpClient;
	private final int maxRetries;
	private final Duration initialBackoff;

	public HttpUtils() {
		this(DEFAULT_MAX_RETRIES, INITIAL_BACKOFF);
	}

	public HttpUtils(int maxRetries, Duration initialBackoff) {
		this.httpClient = HttpClient.newBuilder()
				.followRedirects(HttpClient.Redirect.NORMAL)
				.connectTimeout(Duration.ofSeconds(30))
				.build();
		this.maxRetries = Math.max(1, maxRetries);
		this.initialBackoff = initialBackoff;
	}

	/**
	 * Download a file from a URL to a local path. An existing file is truncated and written in
	 * place rather than replaced.
	 */
	public Path downloadFile(String url, Path destination) throws IOException, InterruptedException {
		return retry(() -> {
			HttpRequest request = request(url).build();
			HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
			try (InputStream inputStream = response.body()) {
				if (response.statusCode() < 200 || response.statusCode() >= 300) {
					throw new HttpStatusException(url, response.statusCode());
				}
				try (OutputStream out = Files.newOutputStream(
						destination,
						StandardOpenOption.CREATE,
						StandardOpenOption.TRUNCATE_EXISTING,
						StandardOpenOption.WRITE)) {
					inputStream.transferTo(out);
				}
			}

			// Preserve original file timestamp from Last-Modified header if available
			response.headers().firstValue("Last-Modified").ifPresent(lastModified -> {
				try {
					Instant instant = Instant.from(DateTimeFormatter.RFC_1123_DATE_TIME.parse(lastModified));
					Files.setLastModifiedTime(destination, FileTime.from(instant));
				} catch (DateTimeParseException | IOException e) {
					logger.debug("Could not apply Last-Modified '{}' to {}", lastModified, destination);
				}
			});
			return destination;
		});
	}

	private HttpRequest.Builder request(String url) {
		return HttpRequest.newBuilder()
				.uri(URI.create(url))
				.header("Accept", "application/json, */*")
				.GET();
	}

	/**
	 * Retry an operation with exponential backoff. Client errors other than 429 fail immediately.
	 *
	 * @param operation The operation to retry
	 * @return The result of the operation
	 * @throws IOException If all retry attempts fail
	 * @throws InterruptedException If the thread is interrupted during backoff
	 */
	private <T> T retry(IOSupplier<T> operation) throws IOException, InterruptedException {
		IOException lastException = null;
		for (int attempt = 0; attempt < maxRetries; attempt++) {
			try {
				return operation.get();
			} catch (HttpStatusException e) {
				if (!e.isRetryable()) {
					throw e;
				}
				lastException = e;
			} catch (IOException e) {
				lastException = e;
			}
			if (attempt < maxRetries - 1) {
				// Exponential backoff: 2s, 4s, 8s, ...
				long backoffMillis = initialBackoff.toMillis() * (1L << attempt);
				logger.debug("Attempt {} failed ({}), retrying in {} ms", attempt + 1, lastException.getMessage(), backoffMillis);
				Thread.sleep(backoffMillis);
			}
		}
		throw lastException;
	}
}
