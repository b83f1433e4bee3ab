package com.kyc.vision.app.prompt;

import java.util.Map;
import lombok.Data;

/** Prompt file contents. Rules are applied in map order. */
@Data
public class PromptConfig {
  private String systemTemplate;
  private String outputContract;
  private Map<String, String> rules;
}
