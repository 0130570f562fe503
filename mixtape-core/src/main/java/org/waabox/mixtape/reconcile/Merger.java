package org.waabox.mixtape.reconcile;

import java.util.List;
import java.util.Objects;

/**
 * Folds collected candidates into one deduplicated sequence.
 *
 * <p>The output holds exactly one entry per {@link
 * org.waabox.mixtape.catalog.ItemKey}, ordered by timestamp descending with
 * untimestamped entries last. Ties keep the order in which the candidates
 * were collected, so the same input always yields the same output.
 *
 * <p>This class is stateless and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Merger {

  /** Marker for "no cap". */
  public static final int UNCAPPED = Integer.MAX_VALUE;

  /**
   * Merges the candidates without a size limit.
   *
   * @param candidates the collected candidates, never null
   * @param rule       the tie-break rule, never null
   *
   * @return the merged entries, never null
   */
  public List<MergedItem> merge(final List<Candidate> candidates,
      final MergeRule rule) {
    return merge(candidates, rule, UNCAPPED);
  }

  /**
   * Merges the candidates and keeps at most {@code cap} entries, the
   * newest ones.
   *
   * @param candidates the collected candidates, never null
   * @param rule       the tie-break rule, never null
   * @param cap        the maximum number of entries, greater than zero
   *
   * @return the merged entries, never null
   *
   * @throws IllegalArgumentException if cap is not positive
   */
  public List<MergedItem> merge(final List<Candidate> candidates,
      final MergeRule rule, final int cap) {
    Objects.requireNonNull(candidates, "candidates must not be null");
    Objects.requireNonNull(rule, "rule must not be null");
    if (cap <= 0) {
      throw new IllegalArgumentException(
          "cap must be greater than 0, got: " + cap);
    }

    final List<MergedItem> merged = rule.fold(candidates);
    merged.sort(MergedItem.NEWEST_FIRST);

    if (merged.size() > cap) {
      return List.copyOf(merged.subList(0, cap));
    }
    return List.copyOf(merged);
  }
}
