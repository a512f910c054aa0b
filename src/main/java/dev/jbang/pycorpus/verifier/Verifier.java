package dev.jbang.pycorpus.verifier;

import dev.jbang.pycorpus.model.VerificationResult;

/**
 * The external grammar/parser verifier. Implementations are created once, before any worker
 * starts, and are shared read-only by all of them.
 */
public interface Verifier {

	/**
	 * Check every source file below the request's root.
	 *
	 * @param request What to verify and how
	 * @return The verifier's verdict, status zero when every file conformed
	 * @throws Exception If the verifier could not be run at all
	 */
	VerificationResult verify(VerificationRequest request) throws Exception;
}
