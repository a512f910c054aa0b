package dev.jbang.pycorpus.pipeline;

import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans a list of work items out over a fixed pool of workers and collects their results in
 * completion order. Each worker is the unit of fault isolation: whatever one task throws becomes
 * a {@link PackageStage#FAILED} result for that item and never stops the others.
 */
public class PipelineCoordinator {
	private static final Logger logger = LoggerFactory.getLogger(PipelineCoordinator.class);

	private final int workers;

	/**
	 * @param workers Number of items processed at the same time, at least one
	 */
	public PipelineCoordinator(int workers) {
		if (workers < 1) {
			throw new IllegalArgumentException("Need at least one worker, got " + workers);
		}
		this.workers = workers;
	}

	/**
	 * Process all items and wait for the last one.
	 *
	 * @param items The work list, submitted in order
	 * @param labeler Names an item for results of tasks that threw
	 * @param task The per-item work
	 * @param listener Called on the coordinating thread for every result as soon as it arrives
	 * @return The tally of all results
	 * @throws InterruptedException If interrupted while waiting; running tasks are cancelled
	 */
	public <T> BatchSummary run(
			List<T> items, Function<T, String> labeler, PackageTask<T> task, Consumer<PackageResult> listener)
			throws InterruptedException {
		BatchSummary summary = new BatchSummary();
		if (items.isEmpty()) {
			return summary;
		}

		AtomicInteger threadCounter = new AtomicInteger();
		ExecutorService executor = Executors.newFixedThreadPool(Math.min(workers, items.size()), runnable -> {
			Thread thread = new Thread(runnable, "worker-" + threadCounter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		});
		CompletionService<PackageResult> completionService = new ExecutorCompletionService<>(executor);
		logger.info("Processing {} items with {} workers", items.size(), workers);

		try {
			for (T item : items) {
				completionService.submit(() -> isolate(item, labeler, task));
			}

			for (int i = 0; i < items.size(); i++) {
				PackageResult result;
				try {
					result = completionService.take().get();
				} catch (ExecutionException e) {
					// only Errors get here, everything else was turned into a result
					Throwable cause = e.getCause();
					if (cause instanceof Error) {
						throw (Error) cause;
					}
					throw new IllegalStateException("Worker escaped its isolation boundary", cause);
				}
				summary.add(result);
				logger.debug("Completed {}/{}: {}", i + 1, items.size(), result);
				listener.accept(result);
			}
			return summary;
		} finally {
			executor.shutdownNow();
			if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
				logger.warn("Workers did not terminate within a minute");
			}
		}
	}

	private static <T> PackageResult isolate(T item, Function<T, String> labeler, PackageTask<T> task) {
		String label = labeler.apply(item);
		try {
			PackageResult result = task.process(item);
			if (result == null) {
				return PackageResult.failed(label, null, "task returned no result", null);
			}
			return result;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return PackageResult.failed(label, null, "interrupted", e);
		} catch (Exception e) {
			logger.error("Unexpected failure processing {}", label, e);
			return PackageResult.failed(label, null, e.getMessage(), e);
		}
	}
}
