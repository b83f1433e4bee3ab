package com.kyc.vision.app.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.kyc.vision.app.config.ExtractionProperties;
import com.kyc.vision.app.exception.InvalidSourceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SourceValidatorTest {

  private SourceValidator validator;

  @BeforeEach
  void setUp() {
    ExtractionProperties props = new ExtractionProperties();
    props.setMaxFileMb(1);
    validator = new SourceValidator(props);
  }

  @Test
  void returnsLowerCaseExtension() {
    assertThat(validator.validate("Scan.PDF", new byte[] {1})).isEqualTo("pdf");
  }

  @Test
  void rejectsEmptyFile() {
    assertThatThrownBy(() -> validator.validate("a.pdf", new byte[0]))
        .isInstanceOf(InvalidSourceException.class)
        .extracting("code")
        .isEqualTo(InvalidSourceException.EMPTY_FILE);
  }

  @Test
  void rejectsUnsupportedExtension() {
    assertThatThrownBy(() -> validator.validate("notes.docx", new byte[] {1}))
        .isInstanceOf(InvalidSourceException.class)
        .extracting("code")
        .isEqualTo(InvalidSourceException.UNSUPPORTED_EXTENSION);
  }

  @Test
  void rejectsMissingExtension() {
    assertThatThrownBy(() -> validator.validate("README", new byte[] {1}))
        .extracting("code")
        .isEqualTo(InvalidSourceException.UNSUPPORTED_EXTENSION);
  }

  @Test
  void rejectsOversizeFile() {
    byte[] big = new byte[1024 * 1024 + 1];

    assertThatThrownBy(() -> validator.validate("big.png", big))
        .isInstanceOf(InvalidSourceException.class)
        .extracting("code")
        .isEqualTo(InvalidSourceException.FILE_TOO_LARGE);
  }

  @Test
  void acceptsFileAtExactLimit() {
    assertThat(validator.validate("ok.jpg", new byte[1024 * 1024])).isEqualTo("jpg");
  }
}
