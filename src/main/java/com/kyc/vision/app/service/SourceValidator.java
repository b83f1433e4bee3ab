package com.kyc.vision.app.service;

import com.kyc.vision.app.config.ExtractionProperties;
import com.kyc.vision.app.exception.InvalidSourceException;
import java.util.Locale;
import org.apache.commons.io.FilenameUtils;

/** Rejects empty, oversize or unsupported sources before any rendering happens. */
public class SourceValidator {

  private final ExtractionProperties props;

  public SourceValidator(ExtractionProperties props) {
    this.props = props;
  }

  /**
   * @return the lower-case file extension
   * @throws InvalidSourceException with {@code empty_file}, {@code unsupported_extension} or
   *     {@code file_too_large}
   */
  public String validate(String filename, byte[] data) {
    if (data == null || data.length == 0) {
      throw new InvalidSourceException(InvalidSourceException.EMPTY_FILE, "File is empty");
    }
    String ext = extension(filename);
    if (!props.getAllowedExtensions().contains(ext)) {
      throw new InvalidSourceException(
          InvalidSourceException.UNSUPPORTED_EXTENSION,
          "Unsupported file type '" + ext + "', allowed: " + props.getAllowedExtensions());
    }
    if (data.length > props.maxFileBytes()) {
      throw new InvalidSourceException(
          InvalidSourceException.FILE_TOO_LARGE,
          "File exceeds " + props.getMaxFileMb() + " MB");
    }
    return ext;
  }

  static String extension(String filename) {
    if (filename == null) return "";
    String ext = FilenameUtils.getExtension(filename);
    return ext == null ? "" : ext.toLowerCase(Locale.ROOT);
  }
}
