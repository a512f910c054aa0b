package dev.jbang.pycorpus.model;

/**
 * One unit of work: a package name and its position in the priority-ordered corpus list.
 *
 * @param name The registry name of the package
 * @param rank Zero-based position in the corpus list
 */
public record PackageRef(String name, int rank) {

	@Override
	public String toString() {
		return "#" + rank + " " + name;
	}
}
