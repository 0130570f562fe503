package org.waabox.mixtape.report;

import java.util.Objects;
import java.util.Optional;

/**
 * The result of one read from, or one write to, a single replica.
 *
 * <p>Failures are captured here instead of propagating, so the caller
 * observes the aggregate of a run rather than individual exceptions.
 *
 * @param replicaId the replica identifier, never null
 * @param operation whether the replica was read or written, never null
 * @param success   whether the operation completed
 * @param added     the number of items added, zero for reads and failures
 * @param failure   the failure message, null when successful
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ReplicaOutcome(String replicaId, Operation operation,
    boolean success, int added, String failure) {

  /** The kind of access made to a replica. */
  public enum Operation {

    /** Candidates were collected from the replica. */
    READ,

    /** The merged set was written to the replica. */
    WRITE
  }

  /**
   * Creates a new outcome.
   *
   * @param replicaId the replica identifier, never null
   * @param operation the operation, never null
   * @param success   whether the operation completed
   * @param added     the number of items added, never negative
   * @param failure   the failure message, may be null
   */
  public ReplicaOutcome {
    Objects.requireNonNull(replicaId, "replicaId must not be null");
    Objects.requireNonNull(operation, "operation must not be null");
    if (added < 0) {
      throw new IllegalArgumentException(
          "added must not be negative, got: " + added);
    }
  }

  /**
   * Creates a successful read outcome.
   *
   * @param replicaId the replica identifier, never null
   *
   * @return the outcome, never null
   */
  public static ReplicaOutcome read(final String replicaId) {
    return new ReplicaOutcome(replicaId, Operation.READ, true, 0, null);
  }

  /**
   * Creates a failed read outcome.
   *
   * @param replicaId the replica identifier, never null
   * @param cause     the failure, never null
   *
   * @return the outcome, never null
   */
  public static ReplicaOutcome readFailed(final String replicaId,
      final Throwable cause) {
    return new ReplicaOutcome(replicaId, Operation.READ, false, 0,
        describe(cause));
  }

  /**
   * Creates a successful write outcome.
   *
   * @param replicaId the replica identifier, never null
   * @param added     the number of items added to the replica
   *
   * @return the outcome, never null
   */
  public static ReplicaOutcome written(final String replicaId,
      final int added) {
    return new ReplicaOutcome(replicaId, Operation.WRITE, true, added, null);
  }

  /**
   * Creates a failed write outcome.
   *
   * @param replicaId the replica identifier, never null
   * @param cause     the failure, never null
   *
   * @return the outcome, never null
   */
  public static ReplicaOutcome writeFailed(final String replicaId,
      final Throwable cause) {
    return new ReplicaOutcome(replicaId, Operation.WRITE, false, 0,
        describe(cause));
  }

  /**
   * Returns the failure message, if the operation failed.
   *
   * @return the failure message, never null
   */
  public Optional<String> failureMessage() {
    return Optional.ofNullable(failure);
  }

  private static String describe(final Throwable cause) {
    Objects.requireNonNull(cause, "cause must not be null");
    return cause.getMessage() != null
        ? cause.getMessage() : cause.getClass().getSimpleName();
  }
}
