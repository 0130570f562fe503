package org.waabox.mixtape.catalog.memory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.waabox.mixtape.ScopeUnavailableException;
import org.waabox.mixtape.catalog.CatalogClient;
import org.waabox.mixtape.catalog.ScopedCatalog;

/**
 * A {@link CatalogClient} that keeps every replica in memory.
 *
 * <p>Replicas are created on first use through {@link #replica(String)} and
 * listed by {@link #members()} in creation order. A replica can be marked
 * unreachable, in which case {@link #switchScope(String)} fails for it as a
 * remote catalog would.
 *
 * <p>Intended for tests and local runs. Instances are thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InMemoryCatalogClient implements CatalogClient {

  /** The root replica. */
  private final InMemoryScope root;

  /** The replicas other than the root, in creation order. */
  private final Map<String, InMemoryScope> replicas = new LinkedHashMap<>();

  /** Replicas whose scope cannot be entered. */
  private final Set<String> unreachable = new HashSet<>();

  /**
   * Creates a new catalog whose root replica has the given id.
   *
   * @param theRootId the root replica id, never null
   */
  public InMemoryCatalogClient(final String theRootId) {
    Objects.requireNonNull(theRootId, "rootId must not be null");
    root = new InMemoryScope(theRootId);
  }

  /**
   * Returns the replica with the given id, creating it if needed.
   *
   * @param replicaId the replica id, never null
   *
   * @return the replica scope, never null
   */
  public synchronized InMemoryScope replica(final String replicaId) {
    Objects.requireNonNull(replicaId, "replicaId must not be null");
    if (root.replicaId().equals(replicaId)) {
      return root;
    }
    return replicas.computeIfAbsent(replicaId, InMemoryScope::new);
  }

  /**
   * Makes every later attempt to enter the replica fail.
   *
   * @param replicaId the replica id, never null
   */
  public synchronized void markUnreachable(final String replicaId) {
    unreachable.add(Objects.requireNonNull(replicaId,
        "replicaId must not be null"));
  }

  /**
   * Makes the replica reachable again.
   *
   * @param replicaId the replica id, never null
   */
  public synchronized void markReachable(final String replicaId) {
    unreachable.remove(replicaId);
  }

  @Override
  public synchronized ScopedCatalog root() {
    if (unreachable.contains(root.replicaId())) {
      throw new ScopeUnavailableException(root.replicaId());
    }
    return root;
  }

  @Override
  public synchronized ScopedCatalog switchScope(final String replicaId) {
    Objects.requireNonNull(replicaId, "replicaId must not be null");
    if (unreachable.contains(replicaId)) {
      throw new ScopeUnavailableException(replicaId);
    }
    if (root.replicaId().equals(replicaId)) {
      return root;
    }
    final InMemoryScope scope = replicas.get(replicaId);
    if (scope == null) {
      throw new ScopeUnavailableException(replicaId);
    }
    return scope;
  }

  @Override
  public synchronized List<String> members() {
    return new ArrayList<>(replicas.keySet());
  }
}
