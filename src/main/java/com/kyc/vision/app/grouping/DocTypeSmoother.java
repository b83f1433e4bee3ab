package com.kyc.vision.app.grouping;

import static com.kyc.vision.app.grouping.KeySets.hasLabel;

import com.kyc.vision.app.model.PageResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Repairs missing document-type labels across an ordered page sequence.
 *
 * <ol>
 *   <li><b>Forward fill</b>: an unlabeled page inherits the previous page's (smoothed) label when
 *       it shares at least {@code minKeyOverlapForContinuation} keys with that page.
 *   <li><b>Novelty override</b>: forward fill is skipped when the page brings at least {@code
 *       minFieldsForNewDoc} keys the previous page did not have. Novelty wins over overlap.
 *   <li><b>Gap bridging</b>: a single unlabeled page between two pages carrying the same label
 *       takes that label, whatever its keys (e.g. a visa stamp page inside a passport).
 * </ol>
 *
 * <p>Only labels are produced; the input pages are never modified. Blank labels come back as
 * null.
 */
public class DocTypeSmoother {

  public List<String> smooth(List<PageResult> pages, GroupingConfig config) {
    List<String> out = new ArrayList<>(pages.size());
    List<Set<String>> keySets = new ArrayList<>(pages.size());
    for (PageResult page : pages) {
      out.add(page.hasDocType() ? page.getDocType() : null);
      keySets.add(page.keySet());
    }

    if (config.isForwardFill()) {
      forwardFill(out, keySets, config);
    }
    if (config.isBridgeGap()) {
      bridgeGaps(out);
    }
    return out;
  }

  private static void forwardFill(
      List<String> labels, List<Set<String>> keySets, GroupingConfig config) {
    // i-1 is read after it may itself have been filled, so continuation chains propagate.
    for (int i = 1; i < labels.size(); i++) {
      if (hasLabel(labels.get(i))) continue;

      String previous = labels.get(i - 1);
      if (!hasLabel(previous)) continue;

      Set<String> current = keySets.get(i);
      Set<String> before = keySets.get(i - 1);
      if (KeySets.novel(current, before) >= config.getMinFieldsForNewDoc()) continue;

      if (KeySets.overlap(current, before) >= config.getMinKeyOverlapForContinuation()) {
        labels.set(i, previous);
      }
    }
  }

  private static void bridgeGaps(List<String> labels) {
    for (int i = 1; i < labels.size() - 1; i++) {
      if (hasLabel(labels.get(i))) continue;
      String left = labels.get(i - 1);
      if (hasLabel(left) && left.equals(labels.get(i + 1))) {
        labels.set(i, left);
      }
    }
  }
}
