package com.kyc.vision.app.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.victools.jsonschema.generator.OptionPreset;
import com.github.victools.jsonschema.generator.SchemaGenerator;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfigBuilder;
import com.github.victools.jsonschema.generator.SchemaVersion;
import com.github.victools.jsonschema.module.jackson.JacksonModule;
import com.github.victools.jsonschema.module.jackson.JacksonOption;
import com.kyc.vision.app.exception.ModelInferenceException;
import com.kyc.vision.app.model.RawExtraction;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.content.Media;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.ResponseFormat;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.util.MimeTypeUtils;

/**
 * One vision-model call: a system prompt plus one or more PNG page images in, a {@link
 * RawExtraction} out.
 *
 * <p>The reply is requested as JSON matching a schema generated from {@link RawExtraction}. Set
 * {@code kyc.vision.json-schema-enabled=false} for OpenAI-compatible backends that only support
 * plain JSON mode.
 */
@Log4j2
public class VisionExtractor {

  static final String USER_INSTRUCTION =
      "Extract the document data visible in the attached page image(s) as JSON.";

  private final ChatClient chat;
  private final RawExtractionParser parser;
  private final ObjectMapper om;
  private final String modelName;
  private final double temperature;
  private final boolean jsonSchemaEnabled;
  private final boolean debug;
  private final Map<String, Object> schema;

  public VisionExtractor(
      ChatClient.Builder builder,
      RawExtractionParser parser,
      ObjectMapper om,
      String modelName,
      double temperature,
      boolean jsonSchemaEnabled,
      boolean debug) {
    this.chat = builder.build();
    this.parser = parser;
    this.om = om;
    this.modelName = modelName;
    this.temperature = temperature;
    this.jsonSchemaEnabled = jsonSchemaEnabled;
    this.debug = debug;
    this.schema = buildSchemaFromPojo();
  }

  /**
   * @throws ModelInferenceException when the call fails or returns no content
   */
  public RawExtraction extract(String systemPrompt, List<byte[]> images) {
    List<Media> media = new ArrayList<>(images.size());
    for (byte[] img : images) {
      media.add(new Media(MimeTypeUtils.IMAGE_PNG, new ByteArrayResource(img)));
    }

    if (debug) {
      log.debug(
          "vision.run start model={} images={} imgSizes={} promptLen={}",
          modelName,
          images.size(),
          images.stream().map(b -> b.length).toList(),
          systemPrompt.length());
    }

    Message systemMsg = new SystemMessage(systemPrompt);
    Message userMsg = UserMessage.builder().text(USER_INSTRUCTION).media(media).build();

    long t0 = System.nanoTime();
    String reply;
    try {
      reply =
          chat.prompt().messages(List.of(systemMsg, userMsg)).options(options()).call().content();
    } catch (RuntimeException e) {
      log.error("vision.run error model={} msg={}", modelName, e.getMessage(), e);
      throw new ModelInferenceException("Vision model call failed: " + e.getMessage(), e);
    }
    long ms = (System.nanoTime() - t0) / 1_000_000;

    if (reply == null || reply.isBlank()) {
      throw new ModelInferenceException("Vision model returned no content", null);
    }

    RawExtraction raw = parser.parse(reply);
    if (debug) {
      log.debug(
          "vision.run done model={} latencyMs={} reply={}", modelName, ms, truncate(reply, 400));
    }
    if (raw.getFields().isEmpty()) {
      log.warn("vision.run empty fields model={} latencyMs={}", modelName, ms);
    }
    return raw;
  }

  private OpenAiChatOptions options() {
    ResponseFormat format =
        jsonSchemaEnabled
            ? ResponseFormat.builder()
                .type(ResponseFormat.Type.JSON_SCHEMA)
                .jsonSchema(
                    ResponseFormat.JsonSchema.builder()
                        .name("RawExtraction")
                        .schema(schema)
                        .strict(false)
                        .build())
                .build()
            : ResponseFormat.builder().type(ResponseFormat.Type.JSON_OBJECT).build();

    return OpenAiChatOptions.builder()
        .model(modelName)
        .temperature(temperature)
        .responseFormat(format)
        .build();
  }

  private Map<String, Object> buildSchemaFromPojo() {
    SchemaGeneratorConfigBuilder cfgBuilder =
        new SchemaGeneratorConfigBuilder(SchemaVersion.DRAFT_2020_12, OptionPreset.PLAIN_JSON);
    cfgBuilder.with(new JacksonModule(JacksonOption.RESPECT_JSONPROPERTY_REQUIRED));

    SchemaGenerator generator = new SchemaGenerator(cfgBuilder.build());
    JsonNode schemaNode = generator.generateSchema(RawExtraction.class);

    Map<String, Object> out =
        om.convertValue(schemaNode, new TypeReference<Map<String, Object>>() {});
    out.remove("$schema");
    out.remove("$id");
    out.put("type", "object");
    return out;
  }

  Map<String, Object> schema() {
    return schema;
  }

  private static String truncate(String s, int max) {
    String flat = s.replace('\n', ' ');
    return flat.length() > max ? flat.substring(0, max) + "...(truncated)" : flat;
  }
}
