package dev.jbang.pycorpus;

import dev.jbang.pycorpus.model.DownloadedArchive;
import dev.jbang.pycorpus.pipeline.AcquisitionConfig;
import dev.jbang.pycorpus.pipeline.BatchSummary;
import dev.jbang.pycorpus.pipeline.PackagePipeline;
import dev.jbang.pycorpus.pipeline.PipelineCoordinator;
import dev.jbang.pycorpus.pipeline.RetentionPolicy;
import dev.jbang.pycorpus.util.FileUtils;
import dev.jbang.pycorpus.verifier.CommandLineVerifier;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/** Verify command checking every archive already in the workspace */
@Command(
		name = "verify",
		description = "Extract every downloaded archive, verify it and keep only the trees that fail",
		mixinStandardHelpOptions = true)
public class VerifyCommand extends BatchCommand {

	@Mixin
	VerificationOptions verification;

	@Override
	protected int execute() throws IOException, InterruptedException {
		Path workspace = dataDir.resolve(AcquisitionConfig.ARCHIVE_DIR);
		List<DownloadedArchive> archives = FileUtils.listFiles(workspace, DownloadedArchive.SUFFIXES).stream()
				.map(DownloadedArchive::of)
				.collect(Collectors.toList());

		logger.info("PyPI Corpus - Verify");
		logger.info("====================");
		logger.info("Workspace: {}", workspace.toAbsolutePath());
		logger.info("Grammar: {}", verification.grammar);
		logger.info("Archives: {}", archives.size());
		logger.info("Max parallel verifications: {}", processes);
		logger.info("");

		CommandLineVerifier verifier = CommandLineVerifier.initialize(verification.toConfig(Path.of("").toAbsolutePath()));
		PackagePipeline pipeline =
				new PackagePipeline(null, workspace, verification.createCorpusVerifier(verifier), new RetentionPolicy());

		long startTime = System.currentTimeMillis();
		BatchSummary summary = new PipelineCoordinator(processes)
				.run(archives, DownloadedArchive::packageName, pipeline::verifyArchive, this::report);
		printSummary(summary, startTime);
		return 0;
	}
}
