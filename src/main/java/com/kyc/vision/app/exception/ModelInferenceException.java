package com.kyc.vision.app.exception;

/** The vision model call failed or returned nothing usable. Mapped to HTTP 502. */
public class ModelInferenceException extends RuntimeException {

  public static final String CODE = "model_inference_error";

  public ModelInferenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
