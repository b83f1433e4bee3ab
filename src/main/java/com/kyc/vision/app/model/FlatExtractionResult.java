package com.kyc.vision.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Normalized extraction for a whole file, returned by the single-document endpoint. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlatExtractionResult {

  @JsonProperty("doc_type")
  private String docType;

  @Builder.Default
  @JsonProperty("fields")
  private Map<String, FieldValue> fields = new LinkedHashMap<>();

  @Builder.Default
  @JsonProperty("extra_fields")
  private Map<String, FieldValue> extraFields = new LinkedHashMap<>();
}
