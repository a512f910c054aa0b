package dev.jbang.pycorpus.util;

import java.io.IOException;
import java.nio.file.Path;

/** The file is neither a tar-family nor a zip-family archive */
public class UnrecognizedArchiveException extends IOException {
	private final Path archive;

	public UnrecognizedArchiveException(Path archive) {
		super("Could not identify type of compressed file " + archive);
		this.archive = archive;
	}

	public UnrecognizedArchiveException(Path archive, Throwable cause) {
		super("Could not identify type of compressed file " + archive, cause);
		this.archive = archive;
	}

	public Path archive() {
		return archive;
	}
}
