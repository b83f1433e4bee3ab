package com.kyc.vision.app.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request-level statistics returned alongside the grouped documents. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MultiExtractionMeta {

  @JsonProperty("total_pages")
  private int totalPages;

  @JsonProperty("total_groups")
  private int totalGroups;

  @JsonProperty("elapsed_ms")
  private long elapsedMs;
}
