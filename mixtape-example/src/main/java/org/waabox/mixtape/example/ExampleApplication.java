package org.waabox.mixtape.example;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Spring Boot application entry point for the Mixtape example service.
 *
 * <p>This application demonstrates how to use Mixtape with Spring Boot:
 * <ul>
 *   <li>A Plex server as the catalog, one replica per Plex user</li>
 *   <li>Playlists declared under {@code mixtape.playlists}</li>
 *   <li>A REST API to sync and preview them</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@SpringBootApplication
public class ExampleApplication {

  /** Launches the Spring Boot application.
   *
   * @param args the command-line arguments
   */
  public static void main(final String[] args) {
    SpringApplication.run(ExampleApplication.class, args);
  }
}
