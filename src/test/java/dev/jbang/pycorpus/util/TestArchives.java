package dev.jbang.pycorpus.util;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.GZIPOutputStream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;
import org.apache.commons.compress.compressors.xz.XZCompressorOutputStream;

/** Builds small source archives for tests. Entry names ending in '/' become directories. */
public class TestArchives {
	private final Map<String, String> entries = new LinkedHashMap<>();

	public static TestArchives create() {
		return new TestArchives();
	}

	/** A typical sdist layout: one versioned directory with a module and a setup script */
	public static TestArchives sdist(String dirName) {
		return create().dir(dirName + "/")
				.file(dirName + "/setup.py", "from setuptools import setup\nsetup()\n")
				.file(dirName + "/" + dirName.replaceAll("-.*", "") + "/__init__.py", "VERSION = 1\n");
	}

	public TestArchives dir(String name) {
		entries.put(name.endsWith("/") ? name : name + "/", null);
		return this;
	}

	public TestArchives file(String name, String content) {
		entries.put(name, content);
		return this;
	}

	public Path writeTarGz(Path file) throws IOException {
		try (OutputStream out = Files.newOutputStream(file);
				GZIPOutputStream gzip = new GZIPOutputStream(out)) {
			writeTar(gzip);
		}
		return file;
	}

	public Path writeTarBz2(Path file) throws IOException {
		try (OutputStream out = Files.newOutputStream(file);
				BZip2CompressorOutputStream bzip = new BZip2CompressorOutputStream(out)) {
			writeTar(bzip);
		}
		return file;
	}

	public Path writeTarXz(Path file) throws IOException {
		try (OutputStream out = Files.newOutputStream(file);
				XZCompressorOutputStream xz = new XZCompressorOutputStream(out)) {
			writeTar(xz);
		}
		return file;
	}

	public Path writeTar(Path file) throws IOException {
		try (OutputStream out = Files.newOutputStream(file)) {
			writeTar(out);
		}
		return file;
	}

	public Path writeZip(Path file) throws IOException {
		try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(file))) {
			for (Map.Entry<String, String> entry : entries.entrySet()) {
				zip.putNextEntry(new ZipEntry(entry.getKey()));
				if (entry.getValue() != null) {
					zip.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
				}
				zip.closeEntry();
			}
		}
		return file;
	}

	private void writeTar(OutputStream out) throws IOException {
		// closing the tar stream closes the given one too
		try (TarArchiveOutputStream tar = new TarArchiveOutputStream(out)) {
			tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
			for (Map.Entry<String, String> entry : entries.entrySet()) {
				TarArchiveEntry tarEntry = new TarArchiveEntry(entry.getKey());
				byte[] data =
						entry.getValue() == null ? new byte[0] : entry.getValue().getBytes(StandardCharsets.UTF_8);
				tarEntry.setSize(data.length);
				tar.putArchiveEntry(tarEntry);
				tar.write(data);
				tar.closeArchiveEntry();
			}
			tar.finish();
		}
	}
}
