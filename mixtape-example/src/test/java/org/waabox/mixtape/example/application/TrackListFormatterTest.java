package org.waabox.mixtape.example.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import org.waabox.mixtape.report.SyncResult;
import org.waabox.mixtape.report.TrackSummary;

/** Unit tests for {@link TrackListFormatter}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class TrackListFormatterTest {

  private final TrackListFormatter formatter = new TrackListFormatter();

  @Test
  void whenFormatting_givenEmptyResult_shouldReturnNoLines() {
    assertTrue(formatter.format(SyncResult.empty()).isEmpty());
  }

  @Test
  void whenFormatting_givenShortList_shouldNumberTracksUnderOneHeader() {
    final SyncResult result = new SyncResult(2, 2, 1, List.of(
        new TrackSummary("Song", "Band", "alice", null),
        new TrackSummary("Other", "Duo", "bob", null)));

    final List<String> lines = formatter.format(result);

    assertEquals(List.of(
        "Tracks 1-2",
        " 1. Song - Band (alice)",
        " 2. Other - Duo (bob)",
        "2 tracks total"), lines);
  }

  @Test
  void whenFormattingLine_givenLongFields_shouldShortenThem() {
    final TrackSummary track = new TrackSummary(
        "A Very Long Title That Keeps On Going",
        "An Artist With A Long Name",
        "maximilian", null);

    assertEquals(
        "12. A Very Long Title That Keeps O.. - An Artist With A L.."
            + " (maximili)",
        formatter.line(12, track));
  }

  @Test
  void whenFormattingLine_givenFieldsAtTheLimit_shouldKeepThem() {
    final String title = "12345678901234567890123456789012";
    final String artist = "12345678901234567890";

    assertEquals(" 1. " + title + " - " + artist + " (alice)",
        formatter.line(1, new TrackSummary(title, artist, "alice", null)));
  }

  @Test
  void whenFormatting_givenManyTracks_shouldSectionAndLimitThem() {
    final List<TrackSummary> tracks = new ArrayList<>();
    for (int i = 1; i <= 57; i++) {
      tracks.add(new TrackSummary("T" + i, "A", "alice", null));
    }

    final List<String> lines = formatter.format(
        new SyncResult(57, 0, 0, tracks));

    assertEquals("Tracks 1-10", lines.get(0));
    assertEquals("Tracks 11-20", lines.get(11));
    assertEquals("Tracks 41-50", lines.get(44));
    assertEquals("50. T50 - A (alice)", lines.get(54));
    assertEquals("And 7 more tracks", lines.get(55));
    assertEquals("57 tracks total", lines.get(56));
    assertEquals(57, lines.size());
  }

  @Test
  void whenFormatting_givenPartialLastSection_shouldCloseHeaderAtLastTrack() {
    final List<TrackSummary> tracks = new ArrayList<>();
    for (int i = 1; i <= 12; i++) {
      tracks.add(new TrackSummary("T" + i, "A", "bob", null));
    }

    final List<String> lines = formatter.format(
        new SyncResult(12, 12, 1, tracks));

    assertEquals("Tracks 11-12", lines.get(11));
    assertEquals("12 tracks total", lines.get(lines.size() - 1));
  }
}
