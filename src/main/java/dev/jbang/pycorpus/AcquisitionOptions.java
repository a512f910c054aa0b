package dev.jbang.pycorpus;

import dev.jbang.pycorpus.model.PackageRef;
import dev.jbang.pycorpus.pipeline.AcquisitionConfig;
import dev.jbang.pycorpus.util.CorpusList;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import picocli.CommandLine.Option;

/** Options controlling which packages are fetched and how */
public class AcquisitionOptions {

	@Option(
			names = {"-n", "--number"},
			description = "Number of packages to download, 0 to " + CorpusList.MAX_PACKAGES + " (default: 100)",
			defaultValue = "100")
	int number;

	@Option(
			names = {"-a", "--all"},
			description = "Download all packages listed in the corpus list")
	boolean all;

	@Option(
			names = {"--rm"},
			description = "Remove each package's JSON metadata after use")
	boolean removeMetadata;

	@Option(
			names = {"--corpus-list"},
			description = "Name of the corpus list in the data directory, without .json (default: "
					+ CorpusList.DEFAULT_NAME + ")",
			defaultValue = CorpusList.DEFAULT_NAME)
	String corpusList;

	@Option(
			names = {"--registry"},
			description = "Base URL of the package registry (default: " + AcquisitionConfig.DEFAULT_REGISTRY + ")",
			defaultValue = AcquisitionConfig.DEFAULT_REGISTRY)
	String registry;

	List<PackageRef> loadPackages(Path dataDir) throws IOException {
		return CorpusList.load(CorpusList.location(dataDir, corpusList), number, all);
	}

	AcquisitionConfig toConfig(Path dataDir) {
		return new AcquisitionConfig(dataDir, registry, removeMetadata);
	}
}
