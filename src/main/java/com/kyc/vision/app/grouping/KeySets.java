package com.kyc.vision.app.grouping;

import java.util.Set;

/** Set arithmetic shared by the smoother and the grouper. */
final class KeySets {

  private KeySets() {}

  /** Number of keys present on both pages. */
  static int overlap(Set<String> current, Set<String> previous) {
    int n = 0;
    for (String key : current) {
      if (previous.contains(key)) n++;
    }
    return n;
  }

  /** Number of keys on the current page that the previous page did not have. */
  static int novel(Set<String> current, Set<String> previous) {
    return current.size() - overlap(current, previous);
  }

  static boolean hasLabel(String label) {
    return label != null && !label.isBlank();
  }
}
