package dev.jbang.pycorpus.util;

import static org.assertj.core.api.Assertions.*;

import dev.jbang.pycorpus.util.ArchiveUtils.ArchiveFormat;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ArchiveUtilsTest {

	@TempDir
	Path tempDir;

	Path workspace;

	@BeforeEach
	void setUp() throws Exception {
		workspace = Files.createDirectories(tempDir.resolve("pypi"));
	}

	@Test
	void testExtractTarGz() throws Exception {
		// Given
		Path archive = TestArchives.sdist("alpha-1.0").writeTarGz(tempDir.resolve("alpha-1.0.tar.gz"));

		// When
		ArchiveFormat format = ArchiveUtils.extract(archive, workspace);

		// Then
		assertThat(format).isEqualTo(ArchiveFormat.TAR_GZIP);
		assertThat(Files.readString(workspace.resolve("alpha-1.0/setup.py"))).isEqualTo("from setuptools import setup\nsetup()\n");
		assertThat(workspace.resolve("alpha-1.0/alpha/__init__.py")).exists();
	}

	@Test
	void testExtractTgz() throws Exception {
		// Given
		Path archive = TestArchives.sdist("beta-2.1").writeTarGz(tempDir.resolve("beta-2.1.tgz"));

		// When
		ArchiveFormat format = ArchiveUtils.extract(archive, workspace);

		// Then
		assertThat(format).isEqualTo(ArchiveFormat.TAR_GZIP);
		assertThat(Files.readString(workspace.resolve("beta-2.1/beta/__init__.py"))).isEqualTo("VERSION = 1\n");
	}

	@Test
	void testExtractZip() throws Exception {
		// Given
		Path archive = TestArchives.sdist("gamma-0.3").writeZip(tempDir.resolve("gamma-0.3.zip"));

		// When
		ArchiveFormat format = ArchiveUtils.extract(archive, workspace);

		// Then
		assertThat(format).isEqualTo(ArchiveFormat.ZIP);
		assertThat(workspace.resolve("gamma-0.3/setup.py")).exists();
		assertThat(Files.readString(workspace.resolve("gamma-0.3/gamma/__init__.py"))).isEqualTo("VERSION = 1\n");
	}

	@Test
	void testExtractTarBz2AndPlainTar() throws Exception {
		// Given
		Path bz2 = TestArchives.sdist("delta-2.0").writeTarBz2(tempDir.resolve("delta-2.0.tar.bz2"));
		Path tar = TestArchives.sdist("eps-1.0").writeTar(tempDir.resolve("eps-1.0.tar"));

		// When/Then
		assertThat(ArchiveUtils.extract(bz2, workspace)).isEqualTo(ArchiveFormat.TAR_BZIP2);
		assertThat(ArchiveUtils.extract(tar, workspace)).isEqualTo(ArchiveFormat.TAR);
		assertThat(workspace.resolve("delta-2.0/setup.py")).exists();
		assertThat(workspace.resolve("eps-1.0/setup.py")).exists();
	}

	@Test
	void testExtractTarXz() throws Exception {
		// Given
		Path archive = TestArchives.sdist("eta-1.0").writeTarXz(tempDir.resolve("eta-1.0.tar.xz"));

		// When
		ArchiveFormat format = ArchiveUtils.extract(archive, workspace);

		// Then
		assertThat(format).isEqualTo(ArchiveFormat.TAR_XZ);
		assertThat(Files.readString(workspace.resolve("eta-1.0/eta/__init__.py"))).isEqualTo("VERSION = 1\n");
		assertThat(workspace.resolve("eta-1.0/setup.py")).exists();
	}

	@Test
	void testDetectFormatIgnoresExtension() throws Exception {
		// Given a zip archive named like a tarball
		Path archive = TestArchives.sdist("zeta-1.0").writeZip(tempDir.resolve("zeta-1.0.tar.gz"));

		// When/Then
		assertThat(ArchiveUtils.detectFormat(archive)).isEqualTo(ArchiveFormat.ZIP);
	}

	@Test
	void testTextFileRenamedToZipIsUnrecognized() throws Exception {
		// Given
		Path archive = tempDir.resolve("fake-1.0.zip");
		Files.writeString(archive, "This is not an archive, just some text.\n".repeat(40));

		// When/Then
		assertThatThrownBy(() -> ArchiveUtils.extract(archive, workspace))
				.isInstanceOf(UnrecognizedArchiveException.class)
				.hasMessageContaining("Could not identify type of compressed file")
				.hasMessageContaining("fake-1.0.zip");
		assertThat(workspace).isEmptyDirectory();
	}

	@Test
	void testCompressedTextIsUnrecognized() throws Exception {
		// Given
		Path archive = tempDir.resolve("text-1.0.tar.gz");
		try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(archive))) {
			out.write("print('hello')\n".repeat(100).getBytes(StandardCharsets.UTF_8));
		}

		// When/Then
		assertThatThrownBy(() -> ArchiveUtils.detectFormat(archive)).isInstanceOf(UnrecognizedArchiveException.class);
	}

	@Test
	void testEntriesEscapingTheWorkspaceAreRejected() throws Exception {
		// Given
		Path archive = TestArchives.create()
				.file("evil-1.0/setup.py", "setup()\n")
				.file("../outside.py", "import os\n")
				.writeZip(tempDir.resolve("evil-1.0.zip"));

		// When/Then
		assertThatThrownBy(() -> ArchiveUtils.extract(archive, workspace))
				.isInstanceOf(java.io.IOException.class)
				.isNotInstanceOf(UnrecognizedArchiveException.class)
				.hasMessageContaining("outside of the target directory");
		assertThat(tempDir.resolve("outside.py")).doesNotExist();
	}

	@Test
	void testExtractIntoMissingDirectoryCreatesIt() throws Exception {
		// Given
		Path archive = TestArchives.sdist("theta-0.1").writeTarGz(tempDir.resolve("theta-0.1.tar.gz"));
		Path target = tempDir.resolve("not/yet/there");

		// When
		ArchiveUtils.extract(archive, target);

		// Then
		assertThat(target.resolve("theta-0.1/setup.py")).exists();
	}
}
