package org.waabox.mixtape;

/**
 * Thrown when a replica's playlists or ratings cannot be read.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class PlaylistReadException extends MixtapeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public PlaylistReadException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public PlaylistReadException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
