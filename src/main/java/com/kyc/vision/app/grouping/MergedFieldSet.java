package com.kyc.vision.app.grouping;

import com.kyc.vision.app.model.FieldValue;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Getter;

/** Canonical and extra field maps merged across the pages of one group. */
@Getter
@AllArgsConstructor
public class MergedFieldSet {
  private final Map<String, FieldValue> fields;
  private final Map<String, FieldValue> extraFields;
}
