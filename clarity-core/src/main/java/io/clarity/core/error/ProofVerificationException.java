package io.clarity.core.error;

import java.util.List;

/** A knowledge document no longer matches the translation proof it was issued with. */
public final class ProofVerificationException extends ClarityException {

  private final List<String> failures;

  public ProofVerificationException(List<String> failures) {
    super(ErrorKind.PROOF_VERIFICATION, "Proof verification failed: " + failures, null);
    this.failures = List.copyOf(failures);
  }

  public List<String> failures() {
    return failures;
  }
}
