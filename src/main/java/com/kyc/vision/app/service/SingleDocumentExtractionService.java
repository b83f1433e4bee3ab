package com.kyc.vision.app.service;

import com.kyc.vision.app.model.FlatExtractionResult;
import com.kyc.vision.app.model.LoadedSource;
import com.kyc.vision.app.model.RawExtraction;
import com.kyc.vision.app.model.RenderedPages;
import com.kyc.vision.app.prompt.ExtractionPromptBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.log4j.Log4j2;

/**
 * Single-document extraction: every page of a file goes to the model in one call and comes back
 * as one {@link FlatExtractionResult}. Several files are processed concurrently.
 */
@Log4j2
public class SingleDocumentExtractionService {

  private final SourceValidator validator;
  private final PageRenderer renderer;
  private final VisionExtractor visionExtractor;
  private final ExtractionPromptBuilder promptBuilder;
  private final FieldValueNormalizer normalizer;
  private final Executor executor;
  private final int maxPages;

  public SingleDocumentExtractionService(
      SourceValidator validator,
      PageRenderer renderer,
      VisionExtractor visionExtractor,
      ExtractionPromptBuilder promptBuilder,
      FieldValueNormalizer normalizer,
      Executor executor,
      int maxPages) {
    this.validator = Objects.requireNonNull(validator);
    this.renderer = Objects.requireNonNull(renderer);
    this.visionExtractor = Objects.requireNonNull(visionExtractor);
    this.promptBuilder = Objects.requireNonNull(promptBuilder);
    this.normalizer = Objects.requireNonNull(normalizer);
    this.executor = Objects.requireNonNull(executor);
    this.maxPages = maxPages;
  }

  public FlatExtractionResult extract(String filename, byte[] data, String docTypeHint) {
    String requestId = UUID.randomUUID().toString();
    long t0 = System.nanoTime();

    String ext = validator.validate(filename, data);
    RenderedPages rendered = renderer.render(ext, data, maxPages);
    String prompt = promptBuilder.build(docTypeHint);

    log.debug(
        "single.extract.pre id={} file={} pages={} truncated={} promptLen={} docTypeHint={}",
        requestId,
        filename,
        rendered.size(),
        rendered.isTruncated(),
        prompt.length(),
        docTypeHint);

    RawExtraction raw = visionExtractor.extract(prompt, rendered.getPages());
    FlatExtractionResult result = normalizer.toFlatResult(raw);

    log.info(
        "single.extract.done id={} file={} pages={} docType={} fields={} durationMs={}",
        requestId,
        filename,
        rendered.size(),
        result.getDocType(),
        result.getFields().size(),
        (System.nanoTime() - t0) / 1_000_000);
    return result;
  }

  /** Processes all sources concurrently; results keep the input order. */
  public List<FlatExtractionResult> extractAll(List<LoadedSource> sources, String docTypeHint) {
    List<CompletableFuture<FlatExtractionResult>> futures = new ArrayList<>(sources.size());
    for (LoadedSource source : sources) {
      futures.add(
          CompletableFuture.supplyAsync(
              () -> extract(source.getFilename(), source.getData(), docTypeHint), executor));
    }

    List<FlatExtractionResult> results = new ArrayList<>(futures.size());
    for (CompletableFuture<FlatExtractionResult> f : futures) {
      try {
        results.add(f.join());
      } catch (CompletionException e) {
        // Surface the original exception so the error handler can map it.
        if (e.getCause() instanceof RuntimeException re) throw re;
        throw e;
      }
    }
    return results;
  }
}
