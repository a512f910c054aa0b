package dev.jbang.pycorpus;

import dev.jbang.pycorpus.model.PackageRef;
import dev.jbang.pycorpus.pipeline.BatchSummary;
import dev.jbang.pycorpus.pipeline.PackageAcquirer;
import dev.jbang.pycorpus.pipeline.PackagePipeline;
import dev.jbang.pycorpus.pipeline.PipelineCoordinator;
import dev.jbang.pycorpus.pipeline.RetentionPolicy;
import dev.jbang.pycorpus.util.FileUtils;
import java.io.IOException;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/** Download command fetching the source archives of the top packages */
@Command(
		name = "download",
		description = "Download the source distributions of the packages in the corpus list",
		mixinStandardHelpOptions = true)
public class DownloadCommand extends BatchCommand {

	@Mixin
	AcquisitionOptions acquisition;

	@Override
	protected int execute() throws IOException, InterruptedException {
		List<PackageRef> packages = acquisition.loadPackages(dataDir);
		PackageAcquirer acquirer = new PackageAcquirer(acquisition.toConfig(dataDir));

		logger.info("PyPI Corpus - Download");
		logger.info("======================");
		logger.info("Data directory: {}", dataDir.toAbsolutePath());
		logger.info("Registry: {}", acquirer.config().registryUrl());
		logger.info("Packages: {}", packages.size());
		logger.info("Max parallel downloads: {}", processes);
		logger.info("");

		FileUtils.ensureDirectory(acquirer.config().archiveDir());
		acquirer.clearStaleReservations();
		PackagePipeline pipeline =
				new PackagePipeline(acquirer, acquirer.config().archiveDir(), null, new RetentionPolicy());

		long startTime = System.currentTimeMillis();
		BatchSummary summary =
				new PipelineCoordinator(processes).run(packages, PackageRef::name, pipeline::acquireOnly, this::report);
		printSummary(summary, startTime);
		return 0;
	}
}
