package com.kyc.vision.app.prompt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

/**
 * Reads the extraction prompt file ({@code system}, {@code rules}, {@code output_contract}).
 *
 * <p>The file is parsed as YAML first and as JSON when that fails. Rule values of any scalar type
 * are kept as strings, in file order.
 */
@Log4j2
public class PromptLoader {

  private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
  private final ObjectMapper jsonMapper = new ObjectMapper();

  /** Loads a classpath resource such as {@code prompts/vision-extraction.yaml}. */
  public PromptConfig load(String location) {
    return load(new ClassPathResource(location));
  }

  public PromptConfig load(Resource resource) {
    String where = resource.getDescription();
    String text;
    try (InputStream in = resource.getInputStream()) {
      text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      log.error("prompt.load read failed source={}", where, e);
      throw new IllegalStateException("Failed to read prompts from " + where, e);
    }

    JsonNode root = parse(text, where);
    PromptConfig cfg = new PromptConfig();
    cfg.setSystemTemplate(text(root, "system"));
    cfg.setOutputContract(text(root, "output_contract"));
    cfg.setRules(rules(root.get("rules")));
    log.info("prompt.load ok source={} rules={}", where, cfg.getRules().size());
    return cfg;
  }

  private JsonNode parse(String text, String where) {
    try {
      JsonNode node = yamlMapper.readTree(text);
      if (node != null && node.isObject()) return node;
    } catch (JsonProcessingException e) {
      log.warn("prompt.load yaml failed source={} msg={}", where, e.getOriginalMessage());
    }
    try {
      JsonNode node = jsonMapper.readTree(text);
      if (node != null && node.isObject()) return node;
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to parse prompts from " + where, e);
    }
    throw new IllegalStateException("Prompt file " + where + " is not a mapping");
  }

  private static String text(JsonNode root, String field) {
    JsonNode n = root.get(field);
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static Map<String, String> rules(JsonNode node) {
    Map<String, String> out = new LinkedHashMap<>();
    if (node == null || !node.isObject()) return out;
    Iterator<Map.Entry<String, JsonNode>> it = node.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      out.put(e.getKey(), e.getValue().isNull() ? null : e.getValue().asText());
    }
    return out;
  }
}
