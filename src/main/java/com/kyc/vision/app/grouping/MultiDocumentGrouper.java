package com.kyc.vision.app.grouping;

import com.kyc.vision.app.model.DocumentGroup;
import com.kyc.vision.app.model.PageResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lombok.extern.log4j.Log4j2;

/**
 * Turns an ordered list of per-page results into logical documents.
 *
 * <p>Pipeline: labels are repaired by {@link DocTypeSmoother}, positions are partitioned by
 * {@link PageGrouper}, and each partition is merged by {@link GroupMerger}. Stateless and free
 * of I/O; safe for concurrent use.
 *
 * <p>Well-formed content never makes this throw, including pages with no label and no fields.
 * Malformed shape is the caller's problem and is rejected: null list or elements, or page
 * indices that are not strictly ascending.
 */
@Log4j2
public class MultiDocumentGrouper {

  private final DocTypeSmoother smoother;
  private final PageGrouper grouper;
  private final GroupMerger merger;

  public MultiDocumentGrouper() {
    this(new DocTypeSmoother(), new PageGrouper(), new GroupMerger());
  }

  public MultiDocumentGrouper(DocTypeSmoother smoother, PageGrouper grouper, GroupMerger merger) {
    this.smoother = Objects.requireNonNull(smoother);
    this.grouper = Objects.requireNonNull(grouper);
    this.merger = Objects.requireNonNull(merger);
  }

  public List<DocumentGroup> groupAndMerge(List<PageResult> pages, GroupingConfig config) {
    Objects.requireNonNull(pages, "pages must not be null");
    Objects.requireNonNull(config, "config must not be null");
    checkOrdered(pages);

    List<String> smoothed = smoother.smooth(pages, config);
    List<Set<String>> keySets = new ArrayList<>(pages.size());
    for (PageResult page : pages) {
      keySets.add(page.keySet());
    }
    List<List<Integer>> partitions = grouper.group(smoothed, keySets, config);

    List<DocumentGroup> docs = new ArrayList<>(partitions.size());
    for (List<Integer> positions : partitions) {
      List<PageResult> members = new ArrayList<>(positions.size());
      List<Integer> pageIndices = new ArrayList<>(positions.size());
      String docType = null;
      for (int pos : positions) {
        PageResult page = pages.get(pos);
        members.add(page);
        pageIndices.add(page.getPageIndex());
        if (docType == null && KeySets.hasLabel(smoothed.get(pos))) {
          docType = smoothed.get(pos);
        }
      }

      MergedFieldSet merged = merger.merge(members);
      docs.add(
          DocumentGroup.builder()
              .groupId(docs.size())
              .docType(docType)
              .pageIndices(pageIndices)
              .mergedFields(merged.getFields())
              .mergedExtraFields(merged.getExtraFields())
              .build());
    }

    if (log.isDebugEnabled()) {
      log.debug(
          "grouping.done pages={} groups={} raw={} smoothed={}",
          pages.size(),
          docs.size(),
          rawLabels(pages),
          smoothed);
    }
    return docs;
  }

  private static void checkOrdered(List<PageResult> pages) {
    int last = Integer.MIN_VALUE;
    for (int i = 0; i < pages.size(); i++) {
      PageResult page = Objects.requireNonNull(pages.get(i), "page at position " + i + " is null");
      if (i > 0 && page.getPageIndex() <= last) {
        throw new IllegalArgumentException(
            "page indices must be strictly ascending: "
                + last
                + " followed by "
                + page.getPageIndex());
      }
      last = page.getPageIndex();
    }
  }

  private static List<String> rawLabels(List<PageResult> pages) {
    List<String> labels = new ArrayList<>(pages.size());
    for (PageResult page : pages) {
      labels.add(page.getDocType());
    }
    return labels;
  }
}
