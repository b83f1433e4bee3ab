package com.kyc.vision.app.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Loose model output before normalization. Field values may be plain scalars, lists or {@code
 * {value, confidence}} objects.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawExtraction {

  @JsonProperty("doc_type")
  @JsonAlias("docType")
  @JsonPropertyDescription("Short snake_case document type, e.g. passport, id_card, utility_bill")
  private String docType;

  @Builder.Default
  @JsonProperty("fields")
  @JsonPropertyDescription("Visible canonical field values keyed by canonical key")
  private Map<String, Object> fields = new LinkedHashMap<>();

  @Builder.Default
  @JsonProperty("extra_fields")
  @JsonAlias("extraFields")
  @JsonPropertyDescription("Other clearly labeled values keyed by descriptive snake_case names")
  private Map<String, Object> extraFields = new LinkedHashMap<>();
}
