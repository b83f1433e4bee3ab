package com.kyc.vision.app.grouping;

import static org.assertj.core.api.Assertions.assertThat;

import com.kyc.vision.app.model.FieldValue;
import com.kyc.vision.app.model.PageResult;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GroupMergerTest {

  private final GroupMerger merger = new GroupMerger();

  @Test
  void firstNonEmptyValueWinsEvenAgainstHigherConfidence() {
    PageResult first =
        Pages.page(0, "passport", Map.of("surname", FieldValue.of("SMITH", 0.4)), Map.of());
    PageResult second =
        Pages.page(1, "passport", Map.of("surname", FieldValue.of("SM1TH", 0.99)), Map.of());

    MergedFieldSet merged = merger.merge(List.of(first, second));

    assertThat(merged.getFields().get("surname")).isEqualTo(FieldValue.of("SMITH", 0.4));
  }

  @Test
  void blankAndNullValuesDoNotClaimAKey() {
    Map<String, FieldValue> blank = new HashMap<>();
    blank.put("surname", FieldValue.of("   ", 0.9));
    blank.put("nationality", null);
    blank.put("given_names", FieldValue.of(null, 0.9));
    PageResult first = Pages.page(0, "passport", blank, Map.of());
    PageResult second =
        Pages.page(
            1,
            "passport",
            Map.of(
                "surname", FieldValue.of("DOE", 0.8),
                "nationality", FieldValue.of("GBR", 0.7)),
            Map.of());

    MergedFieldSet merged = merger.merge(List.of(first, second));

    assertThat(merged.getFields())
        .containsOnlyKeys("surname", "nationality")
        .containsEntry("surname", FieldValue.of("DOE", 0.8))
        .containsEntry("nationality", FieldValue.of("GBR", 0.7));
  }

  @Test
  void extraFieldsMergeIndependently() {
    PageResult first =
        Pages.page(
            0,
            "bank_statement",
            Map.of("account_number", FieldValue.of("123", 0.9)),
            Map.of("branch", FieldValue.of("Main St", 0.6)));
    PageResult second =
        Pages.page(
            1,
            null,
            Map.of("branch", FieldValue.of("not canonical here", 0.9)),
            Map.of("branch", FieldValue.of("Other", 0.9), "iban", FieldValue.of("GB00", 0.9)));

    MergedFieldSet merged = merger.merge(List.of(first, second));

    assertThat(merged.getFields()).containsOnlyKeys("account_number", "branch");
    assertThat(merged.getExtraFields())
        .containsEntry("branch", FieldValue.of("Main St", 0.6))
        .containsEntry("iban", FieldValue.of("GB00", 0.9));
  }

  @Test
  void keysKeepFirstInsertionOrder() {
    PageResult first = Pages.page(0, "passport", "b", "a");
    PageResult second = Pages.page(1, "passport", "c", "a", "d");

    MergedFieldSet merged = merger.merge(List.of(first, second));

    assertThat(merged.getFields().keySet()).containsExactly("b", "a", "c", "d");
  }

  @Test
  void emptyMembersGiveEmptyMaps() {
    MergedFieldSet merged = merger.merge(List.of(PageResult.empty(0)));

    assertThat(merged.getFields()).isEmpty();
    assertThat(merged.getExtraFields()).isEmpty();
  }
}
