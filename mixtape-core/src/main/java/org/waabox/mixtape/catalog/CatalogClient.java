package org.waabox.mixtape.catalog;

import java.util.List;

/**
 * Entry point to the shared catalog.
 *
 * <p>Implementations own authentication and transport. The reconciliation
 * engine only asks them for scopes and for the replica membership list.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface CatalogClient {

  /**
   * Returns the scope of the catalog owner (the root or admin replica).
   *
   * @return the root scope, never null
   *
   * @throws org.waabox.mixtape.MixtapeException if the catalog itself is not
   *                                             reachable
   */
  ScopedCatalog root();

  /**
   * Switches into the scope of the given replica.
   *
   * @param replicaId the replica identifier, never null
   *
   * @return the scope, never null
   *
   * @throws org.waabox.mixtape.ScopeUnavailableException if the replica
   *                                                      cannot be reached
   */
  ScopedCatalog switchScope(String replicaId);

  /**
   * Lists every replica known to the catalog, excluding the root.
   *
   * @return the replica identifiers, never null
   *
   * @throws org.waabox.mixtape.MixtapeException if the membership cannot be
   *                                             listed
   */
  List<String> members();
}
