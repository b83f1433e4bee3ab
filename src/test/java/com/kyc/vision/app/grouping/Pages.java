package com.kyc.vision.app.grouping;

import com.kyc.vision.app.model.FieldValue;
import com.kyc.vision.app.model.PageResult;
import java.util.LinkedHashMap;
import java.util.Map;

/** Test fixtures for building pages tersely. */
final class Pages {

  private Pages() {}

  /** Page whose canonical fields are the given keys, each with value "v-key". */
  static PageResult page(int index, String docType, String... keys) {
    Map<String, FieldValue> fields = new LinkedHashMap<>();
    for (String key : keys) {
      fields.put(key, FieldValue.of("v-" + key, 0.9));
    }
    return PageResult.builder().pageIndex(index).docType(docType).fields(fields).build();
  }

  static PageResult page(
      int index, String docType, Map<String, FieldValue> fields, Map<String, FieldValue> extra) {
    return PageResult.builder()
        .pageIndex(index)
        .docType(docType)
        .fields(new LinkedHashMap<>(fields))
        .extraFields(new LinkedHashMap<>(extra))
        .build();
  }
}
