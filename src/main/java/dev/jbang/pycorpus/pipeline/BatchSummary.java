package dev.jbang.pycorpus.pipeline;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Tally of a batch run, filled in as results arrive. Not thread-safe. */
public class BatchSummary {
	private final Map<PackageStage, Integer> stageCounts = new EnumMap<>(PackageStage.class);
	private final Map<SkipReason, Integer> skipCounts = new EnumMap<>(SkipReason.class);
	private final List<PackageResult> results = new ArrayList<>();
	private final List<Path> retained = new ArrayList<>();

	public void add(PackageResult result) {
		results.add(result);
		stageCounts.merge(result.stage(), 1, Integer::sum);
		if (result.skipReason() != null) {
			skipCounts.merge(result.skipReason(), 1, Integer::sum);
		}
		if (result.corpus() != null && (result.stage() == PackageStage.RETAINED || result.stage() == PackageStage.FAILED)) {
			retained.add(result.corpus());
		}
	}

	public int total() {
		return results.size();
	}

	public int count(PackageStage stage) {
		return stageCounts.getOrDefault(stage, 0);
	}

	public int count(SkipReason reason) {
		return skipCounts.getOrDefault(reason, 0);
	}

	public int count(PackageResult.Outcome outcome) {
		return (int) results.stream().filter(r -> r.outcome() == outcome).count();
	}

	/** All results, in the order they completed */
	public List<PackageResult> results() {
		return Collections.unmodifiableList(results);
	}

	/** Corpus directories left on disk for follow-up */
	public List<Path> retained() {
		return Collections.unmodifiableList(retained);
	}

	@Override
	public String toString() {
		return "%d packages: %d succeeded, %d skipped, %d failed, %d corpora retained"
				.formatted(
						total(),
						count(PackageResult.Outcome.SUCCEEDED),
						count(PackageResult.Outcome.SKIPPED),
						count(PackageResult.Outcome.FAILED),
						retained.size());
	}
}
