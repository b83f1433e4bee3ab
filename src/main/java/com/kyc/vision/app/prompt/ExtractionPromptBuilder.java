package com.kyc.vision.app.prompt;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the single system prompt sent with page images.
 *
 * <p>The base text and output contract come from the YAML prompt file; the canonical key list
 * and the optional document-type hint are appended here.
 */
public class ExtractionPromptBuilder {

  private final PromptConfig prompts;

  public ExtractionPromptBuilder(PromptConfig prompts) {
    this.prompts = Objects.requireNonNull(prompts, "prompts must not be null");
  }

  public String build(String docTypeHint, List<String> allowedKeys) {
    StringBuilder sb = new StringBuilder();
    sb.append(Objects.toString(prompts.getSystemTemplate(), "").strip());

    Map<String, String> rules = prompts.getRules();
    if (rules != null && !rules.isEmpty()) {
      sb.append("\n\nRULES:");
      int n = 1;
      for (String rule : rules.values()) {
        if (rule == null || rule.isBlank()) continue;
        sb.append('\n').append(n++).append(". ").append(rule.strip());
      }
    }

    sb.append("\nAllowed canonical keys: [").append(String.join(", ", allowedKeys)).append("].");
    if (docTypeHint != null && !docTypeHint.isBlank()) {
      sb.append("\nDocument type hint: ").append(docTypeHint.strip()).append('.');
    }

    String contract = prompts.getOutputContract();
    if (contract != null && !contract.isBlank()) {
      sb.append('\n').append(contract.strip());
    }
    return sb.toString();
  }

  public String build(String docTypeHint) {
    return build(docTypeHint, CanonicalFields.KEYS);
  }
}
