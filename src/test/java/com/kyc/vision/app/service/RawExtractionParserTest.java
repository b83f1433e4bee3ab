package com.kyc.vision.app.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kyc.vision.app.model.RawExtraction;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RawExtractionParserTest {

  private final RawExtractionParser parser = new RawExtractionParser(new ObjectMapper());

  @Test
  void parsesPlainJson() {
    RawExtraction raw =
        parser.parse(
            "{\"doc_type\":\"passport\",\"fields\":{\"surname\":{\"value\":\"DOE\","
                + "\"confidence\":0.9}},\"extra_fields\":{\"mrz_line\":\"P<GBR\"}}");

    assertThat(raw.getDocType()).isEqualTo("passport");
    assertThat(raw.getFields()).containsOnlyKeys("surname");
    assertThat(raw.getExtraFields()).containsEntry("mrz_line", "P<GBR");
  }

  @Test
  void stripsFencesAndProse() {
    String reply = "Here you go:\n```json\n{\"doc_type\":\"id_card\",\"fields\":{}}\n```\nDone.";

    assertThat(parser.parse(reply).getDocType()).isEqualTo("id_card");
  }

  @Test
  void acceptsCamelCaseAliasesAndIgnoresUnknownKeys() {
    RawExtraction raw =
        parser.parse("{\"docType\":\"visa\",\"extraFields\":{\"a\":\"b\"},\"notes\":\"x\"}");

    assertThat(raw.getDocType()).isEqualTo("visa");
    assertThat(raw.getExtraFields()).containsEntry("a", "b");
    assertThat(raw.getFields()).isEmpty();
  }

  @Test
  void invalidJsonGivesEmptyExtraction() {
    RawExtraction raw = parser.parse("{not json at all}");

    assertThat(raw.getDocType()).isNull();
    assertThat(raw.getFields()).isEmpty();
    assertThat(raw.getExtraFields()).isEmpty();
  }

  @Test
  void nullReplyGivesEmptyExtraction() {
    RawExtraction raw = parser.parse(null);

    assertThat(raw.getFields()).isEmpty();
    assertThat(raw.getExtraFields()).isEmpty();
  }

  @Test
  void salvagesIdentityKeysWhenFieldsAreMissing() {
    RawExtraction raw = parser.parse("Surname: SMITH\npassport_number = 123456789\n");

    assertThat(raw.getFields())
        .containsEntry("surname", "SMITH")
        .containsEntry("passport_number", "123456789");
  }

  @Test
  void salvageDoesNotOverrideParsedFields() {
    RawExtraction raw =
        parser.parse("{\"doc_type\":\"passport\",\"fields\":{\"nationality\":\"GBR\"}} surname: X");

    assertThat(raw.getFields()).containsOnlyKeys("nationality");
  }

  @Test
  void salvageKeepsFirstMatchPerKey() {
    Map<String, Object> out = RawExtractionParser.salvage("surname: ONE\nsurname: TWO");

    assertThat(out).containsEntry("surname", "ONE");
  }

  @Test
  void extractJsonObjectReturnsNullWithoutBraces() {
    assertThat(RawExtractionParser.extractJsonObject("no json here")).isNull();
    assertThat(RawExtractionParser.extractJsonObject("} backwards {")).isNull();
  }
}
