package dev.jbang.pycorpus;

import dev.jbang.pycorpus.logging.LoggingConfigurator;
import dev.jbang.pycorpus.pipeline.BatchSummary;
import dev.jbang.pycorpus.pipeline.PackageResult;
import dev.jbang.pycorpus.pipeline.PackageStage;
import dev.jbang.pycorpus.pipeline.SkipReason;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;

/** Options and reporting shared by the batch commands */
public abstract class BatchCommand implements Callable<Integer> {
	protected static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"-d", "--data-dir"},
			description = "Directory holding the corpus list, metadata and the pypi workspace (default: data)",
			defaultValue = "data")
	protected Path dataDir;

	@Option(
			names = {"-p", "--processes"},
			description = "Number of packages processed concurrently (default: 1)",
			defaultValue = "1")
	protected int processes;

	@Option(
			names = {"-v", "--verbose"},
			description = "Log debug output")
	protected boolean verbose;

	@Override
	public Integer call() {
		if (verbose) {
			LoggingConfigurator.enableVerboseLogging();
		}
		if (processes < 1) {
			logger.error("Error: --processes must be at least 1, got {}", processes);
			return 1;
		}
		try {
			return execute();
		} catch (IllegalArgumentException | IOException e) {
			logger.error("Error: {}", e.getMessage());
			logger.debug("Batch aborted", e);
			return 1;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.error("Interrupted");
			return 1;
		}
	}

	/** Run the batch; individual package problems never make this fail */
	protected abstract int execute() throws IOException, InterruptedException;

	/** Log one status line per finished package */
	protected void report(PackageResult result) {
		switch (result.outcome()) {
			case SUCCEEDED -> logger.info("  {}", result);
			case SKIPPED -> logger.warn("  {}", result);
			case FAILED -> logger.error("  {}", result);
		}
	}

	protected void printSummary(BatchSummary summary, long startTime) {
		logger.info("");
		logger.info("Execution Summary");
		logger.info("=================");
		for (PackageStage stage : PackageStage.values()) {
			int count = summary.count(stage);
			if (count > 0) {
				logger.info("  {}: {}", stage, count);
			}
		}
		for (SkipReason reason : SkipReason.values()) {
			int count = summary.count(reason);
			if (count > 0) {
				logger.info("    skipped, {}: {}", reason.description(), count);
			}
		}
		logger.info("Total: {}", summary);
		if (!summary.retained().isEmpty()) {
			logger.info("");
			logger.info("Corpora kept for follow-up:");
			summary.retained().forEach(path -> logger.info("  {}", path));
		}
		var duration = (System.currentTimeMillis() - startTime) / 1000.0;
		logger.info("");
		logger.info("Completed in {} seconds", duration);
	}
}
