package org.waabox.mixtape.catalog.memory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.waabox.mixtape.catalog.Item;
import org.waabox.mixtape.catalog.ItemKey;
import org.waabox.mixtape.catalog.PlaylistHandle;

/**
 * An ordered playlist held by an {@link InMemoryScope}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class InMemoryPlaylist implements PlaylistHandle {

  /** The owning scope, also used as the lock. */
  private final InMemoryScope owner;

  /** The playlist name. */
  private final String name;

  /** The items, in playlist order. */
  private final List<Item> items;

  InMemoryPlaylist(final InMemoryScope theOwner, final String theName,
      final List<Item> theItems) {
    owner = theOwner;
    name = theName;
    items = new ArrayList<>(theItems);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public List<Item> items() {
    synchronized (owner) {
      owner.checkReadable();
      return List.copyOf(items);
    }
  }

  List<Item> snapshot() {
    synchronized (owner) {
      return List.copyOf(items);
    }
  }

  @Override
  public void addItems(final List<Item> toAdd) {
    synchronized (owner) {
      owner.checkWritable();
      items.addAll(toAdd);
    }
  }

  @Override
  public void removeItems(final List<Item> toRemove) {
    synchronized (owner) {
      owner.checkWritable();
      final Set<ItemKey> keys = new HashSet<>();
      for (final Item item : toRemove) {
        keys.add(item.key());
      }
      items.removeIf(item -> keys.contains(item.key()));
    }
  }

  @Override
  public void removeAt(final List<Integer> positions) {
    synchronized (owner) {
      owner.checkWritable();
      final List<Integer> descending = new ArrayList<>(new TreeSet<>(
          positions));
      Collections.reverse(descending);
      for (final int position : descending) {
        if (position >= 0 && position < items.size()) {
          items.remove(position);
        }
      }
    }
  }
}
