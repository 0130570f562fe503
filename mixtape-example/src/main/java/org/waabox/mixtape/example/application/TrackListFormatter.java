package org.waabox.mixtape.example.application;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.waabox.mixtape.report.SyncResult;
import org.waabox.mixtape.report.TrackSummary;

/** Renders a {@link SyncResult} as short chat-style lines.
 *
 * <p>Tracks are numbered and grouped in sections of ten, each under a
 * {@code Tracks a-b} header. At most fifty tracks are listed; a trailing
 * line tells how many were left out. The last line is the total.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TrackListFormatter {

  /** Tracks per section. */
  private static final int SECTION_SIZE = 10;

  /** Tracks listed at most. */
  private static final int MAX_LISTED = 50;

  /** Longest title shown as is. */
  private static final int TITLE_MAX = 32;

  /** Longest artist shown as is. */
  private static final int ARTIST_MAX = 20;

  /** Longest replica shown. */
  private static final int REPLICA_MAX = 8;

  /** Formats the result.
   *
   * @param result the result to render, never null
   *
   * @return the lines, never null; empty when the result is empty
   */
  public List<String> format(final SyncResult result) {
    Objects.requireNonNull(result, "result must not be null");

    final List<String> lines = new ArrayList<>();
    if (result.isEmpty()) {
      return lines;
    }

    final List<TrackSummary> tracks = result.tracks();
    final int listed = Math.min(tracks.size(), MAX_LISTED);
    for (int i = 0; i < listed; i++) {
      if (i % SECTION_SIZE == 0) {
        lines.add("Tracks " + (i + 1) + "-"
            + Math.min(i + SECTION_SIZE, listed));
      }
      lines.add(line(i + 1, tracks.get(i)));
    }
    if (tracks.size() > MAX_LISTED) {
      lines.add("And " + (tracks.size() - MAX_LISTED) + " more tracks");
    }
    lines.add(result.total() + " tracks total");
    return lines;
  }

  /** Formats one track.
   *
   * @param position the 1-based position
   * @param track    the track, never null
   *
   * @return the line, never null
   */
  String line(final int position, final TrackSummary track) {
    return String.format("%2d. %s - %s (%s)", position,
        shorten(track.title(), TITLE_MAX),
        shorten(track.artist(), ARTIST_MAX),
        cut(track.attributedReplica(), REPLICA_MAX));
  }

  /** Cuts values longer than max down to max - 2 characters plus "..". */
  private static String shorten(final String value, final int max) {
    if (value.length() <= max) {
      return value;
    }
    return value.substring(0, max - 2) + "..";
  }

  private static String cut(final String value, final int max) {
    return value.length() <= max ? value : value.substring(0, max);
  }
}
