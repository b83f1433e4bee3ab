package com.kyc.vision.app.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kyc.vision.app.model.RawExtraction;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.log4j.Log4j2;

/**
 * Parses the model's text reply into a {@link RawExtraction}.
 *
 * <p>Tolerates markdown fences and prose around the JSON object. When the reply has no usable
 * {@code fields}, well-known identity keys written as {@code key: value} are salvaged from the raw
 * text so downstream grouping still has something to work with.
 */
@Log4j2
public class RawExtractionParser {

  private static final Pattern SALVAGE =
      Pattern.compile(
          "\"?(passport_number|surname|given_names|first_name|middle_names|date_of_birth"
              + "|date_of_issue|date_of_expiry|nationality|issuing_country)\"?\\s*[:=]\\s*\"?"
              + "([A-Za-z0-9<\\-/ ]{3,64})",
          Pattern.CASE_INSENSITIVE);

  private final ObjectMapper om;

  public RawExtractionParser(ObjectMapper om) {
    this.om = om;
  }

  public RawExtraction parse(String text) {
    RawExtraction raw = readJson(text);
    if (raw.getFields() == null) raw.setFields(new LinkedHashMap<>());
    if (raw.getExtraFields() == null) raw.setExtraFields(new LinkedHashMap<>());

    if (raw.getFields().isEmpty() && text != null) {
      Map<String, Object> salvaged = salvage(text);
      if (!salvaged.isEmpty()) {
        salvaged.forEach(raw.getFields()::putIfAbsent);
        log.debug("vision.salvage applied fields={}", salvaged.keySet());
      }
    }
    return raw;
  }

  private RawExtraction readJson(String text) {
    String json = extractJsonObject(text);
    if (json == null) {
      log.warn("vision.parse no json object in reply preview={}", preview(text));
      return new RawExtraction();
    }
    try {
      RawExtraction raw = om.readValue(json, RawExtraction.class);
      return raw == null ? new RawExtraction() : raw;
    } catch (JsonProcessingException e) {
      log.warn(
          "vision.parse invalid json msg={} preview={}", e.getOriginalMessage(), preview(text));
      return new RawExtraction();
    }
  }

  /** First '{' to last '}' of the reply, or null when there is no such span. */
  static String extractJsonObject(String text) {
    if (text == null) return null;
    int start = text.indexOf('{');
    int end = text.lastIndexOf('}');
    if (start < 0 || end <= start) return null;
    return text.substring(start, end + 1);
  }

  static Map<String, Object> salvage(String text) {
    Map<String, Object> out = new LinkedHashMap<>();
    Matcher m = SALVAGE.matcher(text);
    while (m.find()) {
      String key = m.group(1).toLowerCase();
      String value = m.group(2).strip();
      if (!value.isEmpty()) out.putIfAbsent(key, value);
    }
    return out;
  }

  private static String preview(String text) {
    if (text == null) return "null";
    String flat = text.replace('\n', ' ');
    return flat.length() > 400 ? flat.substring(0, 400) + "...(truncated)" : flat;
  }
}
