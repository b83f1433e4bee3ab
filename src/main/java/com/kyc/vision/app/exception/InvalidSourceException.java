package com.kyc.vision.app.exception;

import lombok.Getter;

/**
 * Client-side problem with the submitted source: missing or ambiguous input, unsupported type,
 * oversize payload, unreachable URL, unreadable PDF. Mapped to HTTP 400.
 */
@Getter
public class InvalidSourceException extends RuntimeException {

  public static final String PROVIDE_EXACTLY_ONE_SOURCE = "provide_exactly_one_source";
  public static final String EMPTY_FILE = "empty_file";
  public static final String UNSUPPORTED_EXTENSION = "unsupported_extension";
  public static final String FILE_TOO_LARGE = "file_too_large";
  public static final String INVALID_URL_SCHEME = "invalid_url_scheme";
  public static final String URL_FETCH_ERROR = "url_fetch_error";
  public static final String URL_TOO_LARGE = "url_too_large";
  public static final String FILE_PATH_NOT_FOUND = "file_path_not_found";
  public static final String FILE_PATH_DISABLED = "file_path_disabled";
  public static final String RENDER_ERROR = "render_error";
  public static final String LOAD_ERROR = "load_error";

  private final String code;

  public InvalidSourceException(String code) {
    super(code);
    this.code = code;
  }

  public InvalidSourceException(String code, String message) {
    super(message);
    this.code = code;
  }

  public InvalidSourceException(String code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }
}
