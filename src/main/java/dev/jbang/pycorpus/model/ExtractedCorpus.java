package dev.jbang.pycorpus.model;

import java.nio.file.Path;

/** The directory tree a source archive unpacked into */
public record ExtractedCorpus(Path root, String owningPackage) {}
