package com.kyc.vision.app.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single extracted value with the model's confidence in it.
 *
 * <p>Confidence is kept in [0, 1] by {@code FieldValueNormalizer} before any page reaches the
 * grouping engine. The engine carries it along untouched; it never ranks values by it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldValue {

  private String value;

  private double confidence;

  public static FieldValue of(String value, double confidence) {
    return new FieldValue(value, confidence);
  }

  /** True when there is no usable text in {@link #value}. */
  @JsonIgnore
  public boolean isBlank() {
    return value == null || value.isBlank();
  }
}
