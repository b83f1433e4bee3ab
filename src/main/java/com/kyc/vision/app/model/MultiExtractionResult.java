package com.kyc.vision.app.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response body of {@code POST /extract/vision/multi}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MultiExtractionResult {
  private List<DocumentGroup> documents;
  private MultiExtractionMeta meta;
}
