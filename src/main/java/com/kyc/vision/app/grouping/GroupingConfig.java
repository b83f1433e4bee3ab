package com.kyc.vision.app.grouping;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Tunables for doc-type smoothing and page grouping.
 *
 * <p>Immutable; thresholds are validated on construction.
 *
 * <ul>
 *   <li>Raise {@code minFieldsForNewDoc} if distinct documents often share only a handful of keys.
 *   <li>Raise {@code minKeyOverlapForContinuation} to be stricter about joining pages.
 *   <li>Disable {@code forwardFill} when doc-type hallucinations cascade across pages.
 *   <li>Disable {@code bridgeGap} if single stray pages should stay isolated for auditing.
 * </ul>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class GroupingConfig {

  public static final boolean DEFAULT_FORWARD_FILL = true;
  public static final boolean DEFAULT_BRIDGE_GAP = true;
  public static final int DEFAULT_MIN_FIELDS_FOR_NEW_DOC = 3;
  public static final int DEFAULT_MIN_KEY_OVERLAP_FOR_CONTINUATION = 1;

  private static final GroupingConfig DEFAULTS = builder().build();

  /** Inherit the previous page's label when the unlabeled page looks like a continuation. */
  private final boolean forwardFill;

  /** Fill a single unlabeled page sandwiched between two pages with the same label. */
  private final boolean bridgeGap;

  /** Novel keys (absent from the previous page) that signal a new document. */
  private final int minFieldsForNewDoc;

  /** Keys shared with the previous page needed to treat a page as a continuation. */
  private final int minKeyOverlapForContinuation;

  @Builder(toBuilder = true)
  private GroupingConfig(
      boolean forwardFill,
      boolean bridgeGap,
      int minFieldsForNewDoc,
      int minKeyOverlapForContinuation) {
    if (minFieldsForNewDoc < 1) {
      throw new IllegalArgumentException(
          "minFieldsForNewDoc must be >= 1 but was " + minFieldsForNewDoc);
    }
    if (minKeyOverlapForContinuation < 0) {
      throw new IllegalArgumentException(
          "minKeyOverlapForContinuation must be >= 0 but was " + minKeyOverlapForContinuation);
    }
    this.forwardFill = forwardFill;
    this.bridgeGap = bridgeGap;
    this.minFieldsForNewDoc = minFieldsForNewDoc;
    this.minKeyOverlapForContinuation = minKeyOverlapForContinuation;
  }

  public static GroupingConfig defaults() {
    return DEFAULTS;
  }

  /** Builder pre-populated with the default thresholds. */
  public static GroupingConfigBuilder builder() {
    return new GroupingConfigBuilder()
        .forwardFill(DEFAULT_FORWARD_FILL)
        .bridgeGap(DEFAULT_BRIDGE_GAP)
        .minFieldsForNewDoc(DEFAULT_MIN_FIELDS_FOR_NEW_DOC)
        .minKeyOverlapForContinuation(DEFAULT_MIN_KEY_OVERLAP_FOR_CONTINUATION);
  }
}
