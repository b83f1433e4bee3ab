package com.kyc.vision.app.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.kyc.vision.app.model.FieldValue;
import com.kyc.vision.app.model.PageResult;
import com.kyc.vision.app.model.RawExtraction;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FieldValueNormalizerTest {

  private final FieldValueNormalizer normalizer = new FieldValueNormalizer(0.5, 0.0, 1.0);

  @Test
  void scalarGetsDefaultConfidence() {
    assertThat(normalizer.normalize("  SMITH ")).isEqualTo(FieldValue.of("SMITH", 0.5));
    assertThat(normalizer.normalize(42)).isEqualTo(FieldValue.of("42", 0.5));
  }

  @Test
  void mapWithValueAndConfidence() {
    FieldValue fv = normalizer.normalize(Map.of("value", "DOE", "confidence", 0.93));

    assertThat(fv).isEqualTo(FieldValue.of("DOE", 0.93));
  }

  @Test
  void mapWithAlternateValueKeys() {
    assertThat(normalizer.normalize(Map.of("VALUE", "A")).getValue()).isEqualTo("A");
    assertThat(normalizer.normalize(Map.of("val", "B")).getValue()).isEqualTo("B");
  }

  @Test
  void mapWithoutValueKeyUsesFirstScalar() {
    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("confidence", 0.8);
    raw.put("text", "GBR");

    assertThat(normalizer.normalize(raw)).isEqualTo(FieldValue.of("GBR", 0.8));
  }

  @Test
  void confidenceIsClamped() {
    assertThat(normalizer.normalize(Map.of("value", "x", "confidence", 1.7)).getConfidence())
        .isEqualTo(1.0);
    assertThat(normalizer.normalize(Map.of("value", "x", "confidence", -3)).getConfidence())
        .isEqualTo(0.0);
  }

  @Test
  void confidenceStringIsParsed() {
    assertThat(normalizer.normalize(Map.of("value", "x", "confidence", " 0.75 ")).getConfidence())
        .isEqualTo(0.75);
  }

  @Test
  void unparsableConfidenceFallsBackToDefault() {
    assertThat(normalizer.normalize(Map.of("value", "x", "confidence", "high")).getConfidence())
        .isEqualTo(0.5);
    assertThat(
            normalizer.normalize(Map.of("value", "x", "confidence", Double.NaN)).getConfidence())
        .isEqualTo(0.5);
  }

  @Test
  void listIsJoinedWithSpaces() {
    assertThat(normalizer.normalize(Arrays.asList("JOHN", null, " PAUL ", "")).getValue())
        .isEqualTo("JOHN PAUL");
  }

  @Test
  void blankAndNullBecomeNull() {
    assertThat(normalizer.normalize(null)).isNull();
    assertThat(normalizer.normalize("   ")).isNull();
    assertThat(normalizer.normalize(Map.of("value", ""))).isNull();
    assertThat(normalizer.normalize(List.of())).isNull();
    assertThat(normalizer.normalize(FieldValue.of(" ", 0.9))).isNull();
  }

  @Test
  void existingFieldValueIsReclamped() {
    assertThat(normalizer.normalize(FieldValue.of(" X ", 4.0))).isEqualTo(FieldValue.of("X", 1.0));
  }

  @Test
  void normalizeMapDropsEmptyEntriesAndKeepsOrder() {
    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("surname", "DOE");
    raw.put("nationality", null);
    raw.put(" ", "orphan");
    raw.put("given_names", Map.of("value", "JANE", "confidence", 0.9));

    Map<String, FieldValue> out = normalizer.normalizeMap(raw);

    assertThat(out.keySet()).containsExactly("surname", "given_names");
  }

  @Test
  void toPageResultCarriesIndexAndBlankDocTypeBecomesNull() {
    Map<String, Object> fields = new HashMap<>();
    fields.put("surname", "DOE");
    RawExtraction raw = RawExtraction.builder().docType("  ").fields(fields).build();

    PageResult page = normalizer.toPageResult(3, raw);

    assertThat(page.getPageIndex()).isEqualTo(3);
    assertThat(page.getDocType()).isNull();
    assertThat(page.getFields()).containsOnlyKeys("surname");
    assertThat(page.getExtraFields()).isEmpty();
  }

  @Test
  void toPageResultOfNullIsEmptyPage() {
    PageResult page = normalizer.toPageResult(1, null);

    assertThat(page.getPageIndex()).isEqualTo(1);
    assertThat(page.hasDocType()).isFalse();
    assertThat(page.keySet()).isEmpty();
  }

  @Test
  void defaultConfidenceIsClampedIntoBounds() {
    FieldValueNormalizer narrow = new FieldValueNormalizer(0.9, 0.1, 0.6);

    assertThat(narrow.normalize("x").getConfidence()).isEqualTo(0.6);
  }

  @Test
  void rejectsInvertedBounds() {
    assertThatThrownBy(() -> new FieldValueNormalizer(0.5, 0.9, 0.1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsBoundsOutsideUnitInterval() {
    assertThatThrownBy(() -> new FieldValueNormalizer(0.5, -0.1, 1.0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("0 <= min <= max <= 1");
    assertThatThrownBy(() -> new FieldValueNormalizer(0.5, 0.0, 1.5))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new FieldValueNormalizer(0.5, Double.NaN, 1.0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsNanDefault() {
    assertThatThrownBy(() -> new FieldValueNormalizer(Double.NaN, 0.0, 1.0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("defaultConfidence");
  }

  @Test
  void defaultBelowFloorIsRaisedToFloor() {
    FieldValueNormalizer floored = new FieldValueNormalizer(0.0, 0.2, 1.0);

    assertThat(floored.normalize("x").getConfidence()).isEqualTo(0.2);
    assertThat(floored.normalize(Map.of("value", "x", "confidence", "n/a")).getConfidence())
        .isEqualTo(0.2);
  }
}
