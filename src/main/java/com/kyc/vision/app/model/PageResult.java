package com.kyc.vision.app.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Normalized extraction output for one rasterized page.
 *
 * <p>Produced once per page by the orchestrator and treated as read-only by everything
 * downstream of it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageResult {

  /** 0-based position of the page in the uploaded file. */
  @JsonProperty("page_index")
  private int pageIndex;

  /** Document type label emitted by the model; null when it could not classify the page. */
  @JsonProperty("doc_type")
  private String docType;

  @Builder.Default
  @JsonProperty("fields")
  private Map<String, FieldValue> fields = new LinkedHashMap<>();

  @Builder.Default
  @JsonProperty("extra_fields")
  private Map<String, FieldValue> extraFields = new LinkedHashMap<>();

  /** Placeholder for a page whose model call failed. */
  public static PageResult empty(int pageIndex) {
    return PageResult.builder().pageIndex(pageIndex).build();
  }

  public boolean hasDocType() {
    return docType != null && !docType.isBlank();
  }

  /** Union of canonical and extra field keys seen on this page. */
  @JsonIgnore
  public Set<String> keySet() {
    Set<String> keys = new LinkedHashSet<>();
    if (fields != null) keys.addAll(fields.keySet());
    if (extraFields != null) keys.addAll(extraFields.keySet());
    return keys;
  }
}
