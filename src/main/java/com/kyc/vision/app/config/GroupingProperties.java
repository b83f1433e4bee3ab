package com.kyc.vision.app.config;

import com.kyc.vision.app.grouping.GroupingConfig;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Binds {@code kyc.grouping.*} and converts it into an immutable {@link GroupingConfig}. */
@Data
@Validated
@ConfigurationProperties(prefix = "kyc.grouping")
public class GroupingProperties {

  private boolean forwardFill = GroupingConfig.DEFAULT_FORWARD_FILL;

  private boolean bridgeGap = GroupingConfig.DEFAULT_BRIDGE_GAP;

  @Min(1)
  private int minFieldsForNewDoc = GroupingConfig.DEFAULT_MIN_FIELDS_FOR_NEW_DOC;

  @Min(0)
  private int minKeyOverlapForContinuation =
      GroupingConfig.DEFAULT_MIN_KEY_OVERLAP_FOR_CONTINUATION;

  public GroupingConfig toConfig() {
    return GroupingConfig.builder()
        .forwardFill(forwardFill)
        .bridgeGap(bridgeGap)
        .minFieldsForNewDoc(minFieldsForNewDoc)
        .minKeyOverlapForContinuation(minKeyOverlapForContinuation)
        .build();
  }
}
