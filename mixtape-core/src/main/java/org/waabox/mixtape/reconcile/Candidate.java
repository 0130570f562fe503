package org.waabox.mixtape.reconcile;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import org.waabox.mixtape.catalog.Item;

/**
 * An item collected from one replica, before deduplication.
 *
 * @param item      the collected item, never null
 * @param replicaId the replica the item was read from, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Candidate(Item item, String replicaId) {

  public Candidate {
    Objects.requireNonNull(item, "item must not be null");
    Objects.requireNonNull(replicaId, "replicaId must not be null");
  }

  /**
   * Returns the activity timestamp observed in the replica.
   *
   * @return the timestamp, never null
   */
  public Optional<Instant> timestamp() {
    return item.activity();
  }
}
