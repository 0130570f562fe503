package org.waabox.mixtape;

/**
 * Base exception for all Mixtape errors.
 *
 * <p>Thrown on its own only when a whole reconciliation cannot start, for
 * example when the catalog root is unreachable. Failures scoped to one
 * replica use the subclasses and never escape a reconciliation run.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class MixtapeException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public MixtapeException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public MixtapeException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
