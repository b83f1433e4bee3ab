package com.kyc.vision.app.grouping;

import com.kyc.vision.app.model.FieldValue;
import com.kyc.vision.app.model.PageResult;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the field maps of a group's pages with first-non-empty-wins semantics.
 *
 * <p>Pages are visited in the order given (ascending page index). A key is taken from the first
 * page that carries a non-blank value for it; later pages never replace it, not even with a
 * higher confidence.
 *
 * <p>Result maps keep first-insertion order, so the same ordered input always yields the same
 * maps.
 */
public class GroupMerger {

  public MergedFieldSet merge(List<PageResult> members) {
    Map<String, FieldValue> fields = new LinkedHashMap<>();
    Map<String, FieldValue> extra = new LinkedHashMap<>();
    for (PageResult page : members) {
      mergeInto(fields, page.getFields());
      mergeInto(extra, page.getExtraFields());
    }
    return new MergedFieldSet(fields, extra);
  }

  private static void mergeInto(Map<String, FieldValue> dest, Map<String, FieldValue> src) {
    if (src == null) return;
    for (Map.Entry<String, FieldValue> e : src.entrySet()) {
      FieldValue v = e.getValue();
      if (v == null || v.isBlank()) continue;
      dest.putIfAbsent(e.getKey(), v);
    }
  }
}
