package org.waabox.mixtape;

/**
 * Thrown when creating or mutating a replica's playlist fails.
 *
 * <p>The playlist may have been partially modified; the catalog gives no
 * all-or-nothing guarantee for batch writes.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class PlaylistWriteException extends MixtapeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public PlaylistWriteException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public PlaylistWriteException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}
