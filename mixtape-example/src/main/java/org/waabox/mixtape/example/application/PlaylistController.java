package org.waabox.mixtape.example.application;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import org.waabox.mixtape.Mixtape;
import org.waabox.mixtape.MixtapeException;
import org.waabox.mixtape.PlaylistDefinition;
import org.waabox.mixtape.report.SyncResult;

/** REST controller that exposes the registered playlists through HTTP
 * endpoints for syncing and previewing them.
 *
 * <p>This controller provides three endpoints:
 * <ul>
 *   <li>{@code GET /playlists} - lists the registered playlists and their
 *       policies</li>
 *   <li>{@code POST /playlists/{name}/sync} - reconciles the playlist
 *       across its replicas</li>
 *   <li>{@code GET /playlists/{name}/preview} - computes the merge without
 *       writing anything</li>
 * </ul>
 *
 * <p>Sync and preview answer with the result counters, the merged tracks
 * and the same tracks rendered by {@link TrackListFormatter}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@RestController
@RequestMapping("/playlists")
public class PlaylistController {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(PlaylistController.class);

  /** The Mixtape instance, never null. */
  private final Mixtape mixtape;

  /** The track list renderer, never null. */
  private final TrackListFormatter formatter = new TrackListFormatter();

  /** Creates a new PlaylistController.
   *
   * @param theMixtape the Mixtape instance to delegate to, never null
   */
  public PlaylistController(final Mixtape theMixtape) {
    mixtape = Objects.requireNonNull(theMixtape, "mixtape must not be null");
  }

  /** Lists the registered playlists.
   *
   * @return one entry per playlist with its name and policy, never null
   */
  @GetMapping
  public List<Map<String, Object>> list() {
    final List<Map<String, Object>> playlists = new ArrayList<>();
    for (final PlaylistDefinition definition : mixtape.definitions()) {
      playlists.add(Map.of(
          "name", definition.name(),
          "policy", definition.kind().name()));
    }
    return playlists;
  }

  /** Reconciles a playlist.
   *
   * @param name the playlist name, never null
   *
   * @return the result, never null
   */
  @PostMapping("/{name}/sync")
  public Map<String, Object> sync(@PathVariable("name") final String name) {
    return render(name, mixtape.sync(name));
  }

  /** Computes a playlist's merge without writing it.
   *
   * @param name the playlist name, never null
   *
   * @return the result, never null
   */
  @GetMapping("/{name}/preview")
  public Map<String, Object> preview(
      @PathVariable("name") final String name) {
    return render(name, mixtape.preview(name));
  }

  /** Maps unknown playlists to 404.
   *
   * @param e the failure, never null
   *
   * @return the error body, never null
   */
  @ExceptionHandler(IllegalArgumentException.class)
  @ResponseStatus(HttpStatus.NOT_FOUND)
  public Map<String, Object> unknownPlaylist(
      final IllegalArgumentException e) {
    return Map.of("error", e.getMessage());
  }

  /** Maps runs that could not start to 502.
   *
   * @param e the failure, never null
   *
   * @return the error body, never null
   */
  @ExceptionHandler(MixtapeException.class)
  @ResponseStatus(HttpStatus.BAD_GATEWAY)
  public Map<String, Object> catalogUnavailable(final MixtapeException e) {
    log.error("Playlist run aborted: {}", e.getMessage(), e);
    return Map.of("error", e.getMessage());
  }

  private Map<String, Object> render(final String name,
      final SyncResult result) {
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("playlist", name);
    body.put("total", result.total());
    body.put("added", result.added());
    body.put("replicasUpdated", result.replicasUpdated());
    body.put("tracks", result.tracks());
    body.put("lines", formatter.format(result));
    return body;
  }
}
