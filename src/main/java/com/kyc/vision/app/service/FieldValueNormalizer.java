package com.kyc.vision.app.service;

import com.kyc.vision.app.model.FieldValue;
import com.kyc.vision.app.model.FlatExtractionResult;
import com.kyc.vision.app.model.PageResult;
import com.kyc.vision.app.model.RawExtraction;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Converts permissive model output into {@link FieldValue} maps.
 *
 * <p>Accepted raw shapes:
 *
 * <ul>
 *   <li>{@link FieldValue}: re-clamped.
 *   <li>map: value under {@code value}, {@code VALUE} or {@code val} (else the first scalar
 *       entry), confidence under {@code confidence}.
 *   <li>list: non-null members joined with a single space.
 *   <li>anything else: its string form.
 * </ul>
 *
 * Values are trimmed; null and blank results are dropped. A missing or unparsable confidence
 * becomes the default; parsed confidences are clamped to the configured bounds.
 */
public class FieldValueNormalizer {

  private static final String[] VALUE_KEYS = {"value", "VALUE", "val"};
  private static final String CONFIDENCE_KEY = "confidence";

  private final double defaultConfidence;
  private final double minConfidence;
  private final double maxConfidence;

  public FieldValueNormalizer(
      double defaultConfidence, double minConfidence, double maxConfidence) {
    if (!(minConfidence >= 0.0 && maxConfidence <= 1.0 && minConfidence <= maxConfidence)) {
      throw new IllegalArgumentException(
          "confidence bounds must satisfy 0 <= min <= max <= 1 but were ["
              + minConfidence
              + ", "
              + maxConfidence
              + "]");
    }
    if (Double.isNaN(defaultConfidence)) {
      throw new IllegalArgumentException("defaultConfidence must be a number");
    }
    this.minConfidence = minConfidence;
    this.maxConfidence = maxConfidence;
    this.defaultConfidence = Math.max(minConfidence, Math.min(maxConfidence, defaultConfidence));
  }

  public PageResult toPageResult(int pageIndex, RawExtraction raw) {
    if (raw == null) return PageResult.empty(pageIndex);
    return PageResult.builder()
        .pageIndex(pageIndex)
        .docType(blankToNull(raw.getDocType()))
        .fields(normalizeMap(raw.getFields()))
        .extraFields(normalizeMap(raw.getExtraFields()))
        .build();
  }

  public FlatExtractionResult toFlatResult(RawExtraction raw) {
    if (raw == null) return FlatExtractionResult.builder().build();
    return FlatExtractionResult.builder()
        .docType(blankToNull(raw.getDocType()))
        .fields(normalizeMap(raw.getFields()))
        .extraFields(normalizeMap(raw.getExtraFields()))
        .build();
  }

  public Map<String, FieldValue> normalizeMap(Map<String, ?> src) {
    Map<String, FieldValue> out = new LinkedHashMap<>();
    if (src == null) return out;
    for (Map.Entry<String, ?> e : src.entrySet()) {
      if (e.getKey() == null || e.getKey().isBlank()) continue;
      FieldValue fv = normalize(e.getValue());
      if (fv != null) {
        out.put(e.getKey().strip(), fv);
      }
    }
    return out;
  }

  /** Returns null when the raw value carries no usable text. */
  public FieldValue normalize(Object raw) {
    if (raw == null) return null;

    if (raw instanceof FieldValue fv) {
      return fv.isBlank() ? null : FieldValue.of(fv.getValue().strip(), clamp(fv.getConfidence()));
    }

    String value;
    double confidence = defaultConfidence;
    if (raw instanceof Map<?, ?> map) {
      value = valueOf(map);
      confidence = parseConfidence(map.get(CONFIDENCE_KEY));
    } else {
      value = flatten(raw);
    }

    if (value == null || value.isBlank()) return null;
    return FieldValue.of(value.strip(), confidence);
  }

  private static String valueOf(Map<?, ?> map) {
    for (String key : VALUE_KEYS) {
      Object v = map.get(key);
      if (v != null) return flatten(v);
    }
    for (Map.Entry<?, ?> e : map.entrySet()) {
      if (CONFIDENCE_KEY.equals(e.getKey())) continue;
      Object v = e.getValue();
      if (v instanceof CharSequence || v instanceof Number || v instanceof Boolean) {
        return v.toString();
      }
    }
    return null;
  }

  private static String flatten(Object v) {
    if (v == null) return null;
    if (v instanceof Map<?, ?> nested) return valueOf(nested);
    if (v instanceof Collection<?> items) {
      return items.stream()
          .map(FieldValueNormalizer::flatten)
          .filter(Objects::nonNull)
          .map(String::strip)
          .filter(s -> !s.isEmpty())
          .collect(Collectors.joining(" "));
    }
    return v.toString();
  }

  private double parseConfidence(Object raw) {
    double parsed;
    if (raw instanceof Number n) {
      parsed = n.doubleValue();
    } else if (raw instanceof CharSequence s) {
      try {
        parsed = Double.parseDouble(s.toString().strip());
      } catch (NumberFormatException e) {
        return defaultConfidence;
      }
    } else {
      return defaultConfidence;
    }
    return Double.isNaN(parsed) ? defaultConfidence : clamp(parsed);
  }

  private double clamp(double v) {
    if (Double.isNaN(v)) return defaultConfidence;
    return Math.max(minConfidence, Math.min(maxConfidence, v));
  }

  private static String blankToNull(String s) {
    return (s == null || s.isBlank()) ? null : s.strip();
  }
}
