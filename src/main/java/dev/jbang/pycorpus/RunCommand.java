package dev.jbang.pycorpus;

import dev.jbang.pycorpus.model.PackageRef;
import dev.jbang.pycorpus.pipeline.BatchSummary;
import dev.jbang.pycorpus.pipeline.PackageAcquirer;
import dev.jbang.pycorpus.pipeline.PackagePipeline;
import dev.jbang.pycorpus.pipeline.PipelineCoordinator;
import dev.jbang.pycorpus.pipeline.RetentionPolicy;
import dev.jbang.pycorpus.util.FileUtils;
import dev.jbang.pycorpus.verifier.CommandLineVerifier;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/** Run command taking each package from download through retention in one go */
@Command(
		name = "run",
		description = "Download, extract and verify each package, keeping only the trees that fail",
		mixinStandardHelpOptions = true)
public class RunCommand extends BatchCommand {

	@Mixin
	AcquisitionOptions acquisition;

	@Mixin
	VerificationOptions verification;

	@Override
	protected int execute() throws IOException, InterruptedException {
		List<PackageRef> packages = acquisition.loadPackages(dataDir);
		PackageAcquirer acquirer = new PackageAcquirer(acquisition.toConfig(dataDir));
		Path workspace = acquirer.config().archiveDir();

		logger.info("PyPI Corpus - Run");
		logger.info("=================");
		logger.info("Data directory: {}", dataDir.toAbsolutePath());
		logger.info("Registry: {}", acquirer.config().registryUrl());
		logger.info("Grammar: {}", verification.grammar);
		logger.info("Packages: {}", packages.size());
		logger.info("Max parallel packages: {}", processes);
		logger.info("");

		// set up the verifier before any worker starts
		CommandLineVerifier verifier = CommandLineVerifier.initialize(verification.toConfig(Path.of("").toAbsolutePath()));
		FileUtils.ensureDirectory(workspace);
		acquirer.clearStaleReservations();
		PackagePipeline pipeline = new PackagePipeline(
				acquirer, workspace, verification.createCorpusVerifier(verifier), new RetentionPolicy());

		long startTime = System.currentTimeMillis();
		BatchSummary summary =
				new PipelineCoordinator(processes).run(packages, PackageRef::name, pipeline::run, this::report);
		printSummary(summary, startTime);
		return 0;
	}
}
