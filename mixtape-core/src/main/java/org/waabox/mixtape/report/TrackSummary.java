package org.waabox.mixtape.report;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One line of the merged track list handed back to the caller.
 *
 * @param title             the track title, never null
 * @param artist            the primary attribution, never null
 * @param attributedReplica the replica the merge attributed the track to,
 *                          never null
 * @param timestamp         the winning activity timestamp, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record TrackSummary(String title, String artist,
    String attributedReplica, Instant timestamp) {

  public TrackSummary {
    Objects.requireNonNull(title, "title must not be null");
    Objects.requireNonNull(artist, "artist must not be null");
    Objects.requireNonNull(attributedReplica,
        "attributedReplica must not be null");
  }

  /**
   * Returns the winning activity timestamp, if any.
   *
   * @return the timestamp, never null
   */
  public Optional<Instant> activity() {
    return Optional.ofNullable(timestamp);
  }
}
