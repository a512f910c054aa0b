package dev.jbang.pycorpus.pipeline;

import java.nio.file.Path;

/**
 * Terminal state of one package's pipeline run. Skip and failure reasons are carried as data so
 * the coordinator can count and report them.
 *
 * @param label The package (or archive) the result is about
 * @param stage The terminal stage reached
 * @param skipReason Why the package was skipped, only set for {@link PackageStage#SKIPPED}
 * @param corpus The extracted corpus directory, if one was located
 * @param message Human readable detail
 * @param error The exception behind a skip or failure, if any
 */
public record PackageResult(
		String label, PackageStage stage, SkipReason skipReason, Path corpus, String message, Exception error) {

	/** Coarse classification of a terminal stage */
	public enum Outcome {
		SUCCEEDED,
		SKIPPED,
		FAILED
	}

	public static PackageResult completed(String label, PackageStage stage, Path corpus, String message) {
		return new PackageResult(label, stage, null, corpus, message, null);
	}

	public static PackageResult skipped(String label, SkipReason reason, String message, Exception error) {
		return new PackageResult(label, PackageStage.SKIPPED, reason, null, message, error);
	}

	public static PackageResult failed(String label, Path corpus, String message, Exception error) {
		return new PackageResult(label, PackageStage.FAILED, null, corpus, message, error);
	}

	public Outcome outcome() {
		return switch (stage) {
			case SKIPPED -> Outcome.SKIPPED;
			case FAILED -> Outcome.FAILED;
			default -> Outcome.SUCCEEDED;
		};
	}

	@Override
	public String toString() {
		String detail = message != null ? message : error != null ? error.getMessage() : null;
		String head = skipReason != null ? stage + " (" + skipReason.description() + ")" : stage.toString();
		return label + ": " + head + (detail != null ? " - " + detail : "");
	}
}
