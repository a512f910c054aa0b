package dev.jbang.pycorpus.pipeline;

/** The work a coordinator worker performs for one item */
@FunctionalInterface
public interface PackageTask<T> {
	PackageResult process(T item) throws Exception;
}
