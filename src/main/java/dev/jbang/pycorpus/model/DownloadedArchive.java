package dev.jbang.pycorpus.model;

import java.nio.file.Path;
import java.util.List;

/** A source archive on disk, waiting to be extracted */
public record DownloadedArchive(Path path, String packageName) {

	/** Archive name endings picked up when scanning the workspace */
	public static final List<String> SUFFIXES = List.of(".tar.gz", ".tgz", ".tar.bz2", ".tar.xz", ".zip");

	/** Describe an archive found on disk, naming its package after the file minus its suffix */
	public static DownloadedArchive of(Path path) {
		String name = path.getFileName().toString();
		for (String suffix : SUFFIXES) {
			if (name.endsWith(suffix)) {
				return new DownloadedArchive(path, name.substring(0, name.length() - suffix.length()));
			}
		}
		return new DownloadedArchive(path, name);
	}

	/** The archive's file name, used to locate the directory it unpacks into */
	public String filename() {
		return path.getFileName().toString();
	}
}
