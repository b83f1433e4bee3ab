package com.kyc.vision.app.model;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/** PNG page images produced from one source file. */
@Getter
@Builder
@AllArgsConstructor
public class RenderedPages {

  /** PNG bytes per page, in page order. */
  private final List<byte[]> pages;

  /** Page count of the source document (1 for images). */
  private final int sourcePageCount;

  /** True when the source had more pages than the render limit allowed. */
  private final boolean truncated;

  public int size() {
    return pages.size();
  }
}
