package com.kyc.vision.app.grouping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PageGrouperTest {

  private final PageGrouper grouper = new PageGrouper();
  private final GroupingConfig defaults = GroupingConfig.defaults();

  @Test
  void splitsOnLabelChange() {
    List<String> labels = Arrays.asList("passport", "passport", "id_card");
    List<Set<String>> keys = List.of(Set.of("a"), Set.of("a"), Set.of("b"));

    assertThat(grouper.group(labels, keys, defaults))
        .containsExactly(List.of(0, 1), List.of(2));
  }

  @Test
  void leadingUnlabeledPagesJoinFirstLabeledGroup() {
    List<String> labels = Arrays.asList(null, "passport", "passport");
    List<Set<String>> keys = List.of(Set.of("a"), Set.of("a"), Set.of("a"));

    assertThat(grouper.group(labels, keys, defaults)).containsExactly(List.of(0, 1, 2));
  }

  @Test
  void comparesAgainstLastLabelOfOpenGroup() {
    List<String> labels = Arrays.asList("passport", null, null, "id_card");
    List<Set<String>> keys = List.of(Set.of(), Set.of(), Set.of(), Set.of());

    assertThat(grouper.group(labels, keys, defaults))
        .containsExactly(List.of(0, 1, 2), List.of(3));
  }

  @Test
  void unlabeledPageWithNovelKeysAndNoOverlapStartsGroup() {
    List<String> labels = Arrays.asList("passport", null);
    List<Set<String>> keys =
        List.of(Set.of("surname", "passport_number"), Set.of("meter_number", "tariff", "kwh"));

    assertThat(grouper.group(labels, keys, defaults))
        .containsExactly(List.of(0), List.of(1));
  }

  @Test
  void unlabeledPageWithNovelKeysButOverlapStays() {
    List<String> labels = Arrays.asList("passport", null);
    List<Set<String>> keys =
        List.of(Set.of("surname"), Set.of("surname", "visa_number", "visa_type", "visa_place"));

    assertThat(grouper.group(labels, keys, defaults)).containsExactly(List.of(0, 1));
  }

  @Test
  void unlabeledPageWithFewNovelKeysStays() {
    List<String> labels = Arrays.asList("passport", null);
    List<Set<String>> keys = List.of(Set.of("surname"), Set.of("x", "y"));

    assertThat(grouper.group(labels, keys, defaults)).containsExactly(List.of(0, 1));
  }

  @Test
  void labeledPageAfterSplitOpensItsOwnLabel() {
    // page 1 splits off unlabeled, then page 2 labels that group
    List<String> labels = Arrays.asList("passport", null, "utility_bill");
    List<Set<String>> keys =
        List.of(Set.of("surname"), Set.of("meter", "tariff", "kwh"), Set.of("meter"));

    assertThat(grouper.group(labels, keys, defaults))
        .containsExactly(List.of(0), List.of(1, 2));
  }

  @Test
  void singlePageIsOneGroup() {
    assertThat(grouper.group(Arrays.asList((String) null), List.of(Set.of()), defaults))
        .containsExactly(List.of(0));
  }

  @Test
  void emptyInputGivesNoGroups() {
    assertThat(grouper.group(List.of(), List.of(), defaults)).isEmpty();
  }

  @Test
  void rejectsMismatchedSizes() {
    assertThatThrownBy(() -> grouper.group(List.of("a"), List.of(), defaults))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
