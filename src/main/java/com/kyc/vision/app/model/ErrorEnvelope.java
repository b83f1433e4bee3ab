package com.kyc.vision.app.model;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Uniform error body: {@code {"error": {"code": ..., "message": ...}}}. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorEnvelope {

  private Map<String, String> error;

  public static ErrorEnvelope of(String code, String message) {
    Map<String, String> body = new LinkedHashMap<>();
    body.put("code", code);
    body.put("message", message);
    return new ErrorEnvelope(body);
  }
}
