package com.kyc.vision.app.grouping;

import static com.kyc.vision.app.grouping.KeySets.hasLabel;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Cuts a smoothed label sequence into contiguous groups of page positions.
 *
 * <p>A new group starts before page {@code i} when either
 *
 * <ul>
 *   <li>page {@code i} is labeled and its label differs from the open group's label, or
 *   <li>page {@code i} is still unlabeled, brings at least {@code minFieldsForNewDoc} keys the
 *       previous page did not have, and shares fewer than {@code minKeyOverlapForContinuation}
 *       keys with it.
 * </ul>
 *
 * Every position lands in exactly one group and groups come back in page order.
 */
public class PageGrouper {

  public List<List<Integer>> group(
      List<String> smoothed, List<Set<String>> keySets, GroupingConfig config) {
    if (smoothed.size() != keySets.size()) {
      throw new IllegalArgumentException(
          "label count " + smoothed.size() + " != key set count " + keySets.size());
    }

    List<List<Integer>> groups = new ArrayList<>();
    if (smoothed.isEmpty()) return groups;

    List<Integer> open = new ArrayList<>();
    open.add(0);
    String openLabel = smoothed.get(0);

    for (int i = 1; i < smoothed.size(); i++) {
      String label = smoothed.get(i);
      if (startsNewGroup(label, openLabel, keySets.get(i), keySets.get(i - 1), config)) {
        groups.add(open);
        open = new ArrayList<>();
        openLabel = null;
      }
      open.add(i);
      if (hasLabel(label)) {
        openLabel = label;
      }
    }
    groups.add(open);
    return groups;
  }

  private static boolean startsNewGroup(
      String label,
      String openLabel,
      Set<String> current,
      Set<String> previous,
      GroupingConfig config) {
    if (hasLabel(label)) {
      return hasLabel(openLabel) && !label.equals(openLabel);
    }
    return KeySets.novel(current, previous) >= config.getMinFieldsForNewDoc()
        && KeySets.overlap(current, previous) < config.getMinKeyOverlapForContinuation();
  }
}
