package com.kyc.vision.app.config;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class ExtractionPropertiesTest {

  private static ValidatorFactory factory;
  private static Validator validator;

  @BeforeAll
  static void setUp() {
    factory = Validation.buildDefaultValidatorFactory();
    validator = factory.getValidator();
  }

  @AfterAll
  static void tearDown() {
    factory.close();
  }

  @Test
  void defaultsAreValid() {
    assertThat(validator.validate(new ExtractionProperties())).isEmpty();
  }

  @Test
  void confidenceBoundsMustStayInUnitInterval() {
    ExtractionProperties props = new ExtractionProperties();
    props.setMinConfidence(-0.5);
    props.setMaxConfidence(1.5);

    assertThat(invalidPaths(validator.validate(props)))
        .containsExactlyInAnyOrder("minConfidence", "maxConfidence");
  }

  private static Set<String> invalidPaths(Set<ConstraintViolation<ExtractionProperties>> v) {
    return v.stream().map(c -> c.getPropertyPath().toString()).collect(Collectors.toSet());
  }
}
