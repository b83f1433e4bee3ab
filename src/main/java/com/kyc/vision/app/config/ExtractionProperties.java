package com.kyc.vision.app.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Runtime switches for ingestion, rendering, model calls and value normalization.
 *
 * <p>Bound from {@code kyc.extraction.*}; every entry can be overridden through the environment
 * (e.g. {@code KYC_EXTRACTION_MULTI_MAX_PAGES=60}).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "kyc.extraction")
public class ExtractionProperties {

  /** Upload / download size cap in megabytes. */
  @Min(1)
  private int maxFileMb = 15;

  /** PDF pages rasterized on the single-document path. */
  @Min(1)
  private int maxPagesRender = 4;

  /** PDF pages rasterized on the multi-document path. */
  @Min(1)
  private int multiMaxPages = 40;

  @Min(36)
  private int renderDpi = 180;

  private List<String> allowedExtensions = List.of("pdf", "jpg", "jpeg", "png", "webp");

  /** Confidence assigned when the model gives none or an unparsable one. */
  @DecimalMin("0.0")
  @DecimalMax("1.0")
  private double defaultConfidence = 0.5;

  @DecimalMin("0.0")
  @DecimalMax("1.0")
  private double minConfidence = 0.0;

  @DecimalMin("0.0")
  @DecimalMax("1.0")
  private double maxConfidence = 1.0;

  /** Per-page model call timeout on the multi-document path. */
  @Min(1)
  private long pageTimeoutSeconds = 120;

  @Min(1)
  private long fetchTimeoutSeconds = 30;

  /** Allows {@code file_path} sources on the multi endpoint. Trusted deployments only. */
  private boolean localPathEnabled = false;

  /** Verbose model-call diagnostics (prompt sizes, latencies, output previews). */
  private boolean debugExtraction = false;

  public long maxFileBytes() {
    return (long) maxFileMb * 1024 * 1024;
  }
}
