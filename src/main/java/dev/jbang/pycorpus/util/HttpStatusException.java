package dev.jbang.pycorpus.util;

import java.io.IOException;

/** Raised when a server answers with a non-2xx status */
public class HttpStatusException extends IOException {
	private final int statusCode;

	public HttpStatusException(String url, int statusCode) {
		super("HTTP Error " + statusCode + ": " + url);
		this.statusCode = statusCode;
	}

	public int statusCode() {
		return statusCode;
	}

	/** Client errors will not go away by asking again, except for rate limiting */
	public boolean isRetryable() {
		return statusCode == 429 || statusCode >= 500;
	}
}
