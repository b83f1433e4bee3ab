package com.kyc.vision.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One logical document assembled from a contiguous run of pages. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentGroup {

  @JsonProperty("group_id")
  private int groupId;

  /** First non-empty smoothed label among the member pages, or null. */
  @JsonProperty("doc_type")
  private String docType;

  @JsonProperty("page_indices")
  private List<Integer> pageIndices;

  @Builder.Default
  @JsonProperty("merged_fields")
  private Map<String, FieldValue> mergedFields = new LinkedHashMap<>();

  @Builder.Default
  @JsonProperty("merged_extra_fields")
  private Map<String, FieldValue> mergedExtraFields = new LinkedHashMap<>();
}
