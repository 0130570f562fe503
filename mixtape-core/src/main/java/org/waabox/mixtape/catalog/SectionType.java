package org.waabox.mixtape.catalog;

/**
 * The kind of library section a rating search runs against.
 *
 * <p>Each constant carries the type name the catalog server uses for the
 * section (Plex calls music libraries {@code artist} sections) and the
 * numeric type of the leaf items a search returns.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum SectionType {

  /** Music libraries, searched for tracks. */
  MUSIC("artist", 10),

  /** Movie libraries. */
  MOVIE("movie", 1),

  /** TV show libraries, searched for episodes. */
  SHOW("show", 4),

  /** Photo libraries. */
  PHOTO("photo", 13);

  /** The section type name as reported by the catalog server. */
  private final String serverType;

  /** The numeric type of the items searched in the section. */
  private final int itemType;

  SectionType(final String theServerType, final int theItemType) {
    serverType = theServerType;
    itemType = theItemType;
  }

  /**
   * Returns the section type name as reported by the catalog server.
   *
   * @return the server type name, never null
   */
  public String serverType() {
    return serverType;
  }

  /**
   * Returns the numeric type of the items a search in this section returns.
   *
   * @return the item type
   */
  public int itemType() {
    return itemType;
  }
}
