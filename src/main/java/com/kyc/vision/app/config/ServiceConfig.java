package com.kyc.vision.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kyc.vision.app.grouping.GroupingConfig;
import com.kyc.vision.app.grouping.MultiDocumentGrouper;
import com.kyc.vision.app.prompt.ExtractionPromptBuilder;
import com.kyc.vision.app.prompt.PromptLoader;
import com.kyc.vision.app.service.FieldValueNormalizer;
import com.kyc.vision.app.service.MultiDocumentExtractionService;
import com.kyc.vision.app.service.PageRenderer;
import com.kyc.vision.app.service.RawExtractionParser;
import com.kyc.vision.app.service.SingleDocumentExtractionService;
import com.kyc.vision.app.service.SourceLoader;
import com.kyc.vision.app.service.SourceValidator;
import com.kyc.vision.app.service.VisionExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.reactive.function.client.WebClient;

@Log4j2
@Configuration
@RequiredArgsConstructor
public class ServiceConfig {

  private final ExtractionProperties extractionProps;
  private final GroupingProperties groupingProps;

  @Value("${kyc.vision.model:gpt-4o-mini}")
  private String visionModel;

  @Value("${kyc.vision.temperature:0.0}")
  private double temperature;

  @Value("${kyc.vision.json-schema-enabled:true}")
  private boolean jsonSchemaEnabled;

  @Value("${kyc.prompt.location:prompts/vision-extraction.yaml}")
  private String promptLocation;

  // -------------------
  // Prompt
  // -------------------

  @Bean
  public PromptLoader promptLoader() {
    return new PromptLoader();
  }

  @Bean
  public ExtractionPromptBuilder extractionPromptBuilder(PromptLoader promptLoader) {
    return new ExtractionPromptBuilder(promptLoader.load(promptLocation));
  }

  // -------------------
  // Grouping core
  // -------------------

  @Bean
  public GroupingConfig groupingConfig() {
    GroupingConfig cfg = groupingProps.toConfig();
    log.info("Grouping configured {}", cfg);
    return cfg;
  }

  @Bean
  public MultiDocumentGrouper multiDocumentGrouper() {
    return new MultiDocumentGrouper();
  }

  // -------------------
  // Ingestion + model
  // -------------------

  @Bean
  public SourceValidator sourceValidator() {
    return new SourceValidator(extractionProps);
  }

  @Bean
  public SourceLoader sourceLoader(WebClient.Builder webClientBuilder) {
    return new SourceLoader(webClientBuilder, extractionProps);
  }

  @Bean
  public PageRenderer pageRenderer() {
    return new PageRenderer(extractionProps.getRenderDpi());
  }

  @Bean
  public FieldValueNormalizer fieldValueNormalizer() {
    return new FieldValueNormalizer(
        extractionProps.getDefaultConfidence(),
        extractionProps.getMinConfidence(),
        extractionProps.getMaxConfidence());
  }

  @Bean
  public RawExtractionParser rawExtractionParser(ObjectMapper objectMapper) {
    return new RawExtractionParser(objectMapper);
  }

  @Bean
  public VisionExtractor visionExtractor(
      ChatClient.Builder chatClientBuilder, RawExtractionParser parser, ObjectMapper objectMapper) {
    return new VisionExtractor(
        chatClientBuilder,
        parser,
        objectMapper,
        visionModel,
        temperature,
        jsonSchemaEnabled,
        extractionProps.isDebugExtraction());
  }

  // -------------------
  // Core Services
  // -------------------

  @Bean
  public SingleDocumentExtractionService singleDocumentExtractionService(
      SourceValidator validator,
      PageRenderer renderer,
      VisionExtractor visionExtractor,
      ExtractionPromptBuilder promptBuilder,
      FieldValueNormalizer normalizer,
      @Qualifier("documentExtractionExecutor") ThreadPoolTaskExecutor executor) {
    return new SingleDocumentExtractionService(
        validator,
        renderer,
        visionExtractor,
        promptBuilder,
        normalizer,
        executor,
        extractionProps.getMaxPagesRender());
  }

  @Bean
  public MultiDocumentExtractionService multiDocumentExtractionService(
      SourceValidator validator,
      PageRenderer renderer,
      VisionExtractor visionExtractor,
      ExtractionPromptBuilder promptBuilder,
      FieldValueNormalizer normalizer,
      MultiDocumentGrouper grouper,
      GroupingConfig groupingConfig,
      @Qualifier("pageExtractionExecutor") ThreadPoolTaskExecutor executor,
      @Qualifier("pageTimeoutScheduler") ThreadPoolTaskScheduler timeoutScheduler) {
    return new MultiDocumentExtractionService(
        validator,
        renderer,
        visionExtractor,
        promptBuilder,
        normalizer,
        grouper,
        groupingConfig,
        executor,
        timeoutScheduler,
        extractionProps.getMultiMaxPages(),
        extractionProps.getPageTimeoutSeconds());
  }
}
