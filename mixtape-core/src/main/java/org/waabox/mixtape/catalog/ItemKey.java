package org.waabox.mixtape.catalog;

import java.util.Objects;

/**
 * The canonical identity of an item in the shared catalog.
 *
 * <p>Wraps the stable identifier the catalog assigns to a recording (the
 * Plex {@code ratingKey}, for example). Every deduplication, diff and
 * eviction decision compares keys, never titles or artists: two distinct
 * recordings may share a display name.
 *
 * @param value the catalog-assigned identifier, never null or blank
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ItemKey(String value) {

  /**
   * Creates a new key.
   *
   * @param value the catalog-assigned identifier, never null or blank
   *
   * @throws NullPointerException     if value is null
   * @throws IllegalArgumentException if value is blank
   */
  public ItemKey {
    Objects.requireNonNull(value, "value must not be null");
    if (value.isBlank()) {
      throw new IllegalArgumentException("value must not be blank");
    }
  }

  /**
   * Creates a key from the given identifier.
   *
   * @param value the catalog-assigned identifier, never null or blank
   *
   * @return the key, never null
   */
  public static ItemKey of(final String value) {
    return new ItemKey(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
