package org.waabox.mixtape;

/**
 * Thrown when a replica scope cannot be entered.
 *
 * <p>This typically occurs when the replica's user is unknown to the
 * catalog, its credentials were revoked, or the server did not answer.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class ScopeUnavailableException extends MixtapeException {

  private static final long serialVersionUID = 1L;

  /** The replica that could not be reached. */
  private final String replicaId;

  /**
   * Creates a new exception for the given replica.
   *
   * @param theReplicaId the replica identifier, never null
   */
  public ScopeUnavailableException(final String theReplicaId) {
    super("Replica scope not available: " + theReplicaId);
    replicaId = theReplicaId;
  }

  /**
   * Creates a new exception for the given replica, with an underlying
   * cause.
   *
   * @param theReplicaId the replica identifier, never null
   * @param cause        the underlying cause of the failure, never null
   */
  public ScopeUnavailableException(final String theReplicaId,
      final Throwable cause) {
    super("Replica scope not available: " + theReplicaId, cause);
    replicaId = theReplicaId;
  }

  /**
   * Returns the replica that could not be reached.
   *
   * @return the replica identifier, never null
   */
  public String replicaId() {
    return replicaId;
  }
}
