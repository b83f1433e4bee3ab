package com.kyc.vision.app.service;

import com.kyc.vision.app.grouping.GroupingConfig;
import com.kyc.vision.app.grouping.MultiDocumentGrouper;
import com.kyc.vision.app.model.DocumentGroup;
import com.kyc.vision.app.model.MultiExtractionMeta;
import com.kyc.vision.app.model.MultiExtractionResult;
import com.kyc.vision.app.model.PageResult;
import com.kyc.vision.app.model.RawExtraction;
import com.kyc.vision.app.model.RenderedPages;
import com.kyc.vision.app.prompt.ExtractionPromptBuilder;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeoutException;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.TaskScheduler;

/**
 * Multi-page / multi-document extraction.
 *
 * <ol>
 *   <li>Validate and rasterize the source (multi-document page limit).
 *   <li>Extract every page concurrently, one model call per page. Each call has its own deadline,
 *       counted from the moment the call starts.
 *   <li>Turn a failed or timed-out page into an empty page instead of failing the request.
 *   <li>Normalize, order by page index and hand the pages to {@link MultiDocumentGrouper}.
 *   <li>Attach request metadata (page and group counts, elapsed time).
 * </ol>
 */
@Log4j2
public class MultiDocumentExtractionService {

  private final SourceValidator validator;
  private final PageRenderer renderer;
  private final VisionExtractor visionExtractor;
  private final ExtractionPromptBuilder promptBuilder;
  private final FieldValueNormalizer normalizer;
  private final MultiDocumentGrouper grouper;
  private final GroupingConfig groupingConfig;
  private final Executor executor;
  private final TaskScheduler timeoutScheduler;
  private final int maxPages;
  private final Duration pageTimeout;

  public MultiDocumentExtractionService(
      SourceValidator validator,
      PageRenderer renderer,
      VisionExtractor visionExtractor,
      ExtractionPromptBuilder promptBuilder,
      FieldValueNormalizer normalizer,
      MultiDocumentGrouper grouper,
      GroupingConfig groupingConfig,
      Executor executor,
      TaskScheduler timeoutScheduler,
      int maxPages,
      long pageTimeoutSeconds) {
    this.validator = Objects.requireNonNull(validator);
    this.renderer = Objects.requireNonNull(renderer);
    this.visionExtractor = Objects.requireNonNull(visionExtractor);
    this.promptBuilder = Objects.requireNonNull(promptBuilder);
    this.normalizer = Objects.requireNonNull(normalizer);
    this.grouper = Objects.requireNonNull(grouper);
    this.groupingConfig = Objects.requireNonNull(groupingConfig);
    this.executor = Objects.requireNonNull(executor);
    this.timeoutScheduler = Objects.requireNonNull(timeoutScheduler);
    this.maxPages = maxPages;
    this.pageTimeout = Duration.ofSeconds(pageTimeoutSeconds);
  }

  public MultiExtractionResult extract(String filename, byte[] data) {
    String reqId = UUID.randomUUID().toString();
    long t0 = System.nanoTime();

    String ext = validator.validate(filename, data);
    RenderedPages rendered = renderer.render(ext, data, maxPages);
    log.info(
        "multi.extract.start id={} file={} pages={} truncated={}",
        reqId,
        filename,
        rendered.size(),
        rendered.isTruncated());

    List<PageResult> pages = extractPages(reqId, rendered.getPages());
    List<DocumentGroup> docs = grouper.groupAndMerge(pages, groupingConfig);

    long ms = (System.nanoTime() - t0) / 1_000_000;
    MultiExtractionMeta meta =
        MultiExtractionMeta.builder()
            .totalPages(pages.size())
            .totalGroups(docs.size())
            .elapsedMs(ms)
            .build();

    if (docs.size() == 1 && docs.get(0).getDocType() == null) {
      log.warn("multi.extract.unlabeled id={} pages={} no doc_type found", reqId, pages.size());
    }
    log.info(
        "multi.extract.done id={} file={} pages={} groups={} durationMs={}",
        reqId,
        filename,
        meta.getTotalPages(),
        meta.getTotalGroups(),
        ms);
    return MultiExtractionResult.builder().documents(docs).meta(meta).build();
  }

  /** Fans out one model call per page and returns results in ascending page order. */
  List<PageResult> extractPages(String reqId, List<byte[]> images) {
    String prompt = promptBuilder.build(null);

    List<CompletableFuture<PageResult>> futures = new ArrayList<>(images.size());
    for (int i = 0; i < images.size(); i++) {
      final int pageIndex = i;
      PageCall call = new PageCall(prompt, pageIndex, images.get(i));
      executor.execute(call);
      futures.add(call.result.exceptionally(err -> failedPage(reqId, pageIndex, err)));
    }

    List<PageResult> pages = new ArrayList<>(futures.size());
    for (CompletableFuture<PageResult> f : futures) {
      pages.add(f.join());
    }
    pages.sort(Comparator.comparingInt(PageResult::getPageIndex));
    return pages;
  }

  private static PageResult failedPage(String reqId, int pageIndex, Throwable err) {
    Throwable cause =
        (err instanceof CompletionException && err.getCause() != null) ? err.getCause() : err;
    log.warn("multi.extract.page_error id={} page={} error={}", reqId, pageIndex, cause.toString());
    return PageResult.empty(pageIndex);
  }

  /**
   * One page's model call. The deadline is armed when the call starts running, not when it is
   * submitted; on expiry the result fails with a {@link TimeoutException} and the worker thread is
   * interrupted to abandon the blocking call.
   */
  private final class PageCall implements Runnable {

    private final CompletableFuture<PageResult> result = new CompletableFuture<>();
    private final String prompt;
    private final int pageIndex;
    private final byte[] image;
    private Thread worker;

    PageCall(String prompt, int pageIndex, byte[] image) {
      this.prompt = prompt;
      this.pageIndex = pageIndex;
      this.image = image;
    }

    @Override
    public void run() {
      synchronized (this) {
        if (result.isDone()) return;
        worker = Thread.currentThread();
      }
      ScheduledFuture<?> deadline =
          timeoutScheduler.schedule(this::expire, Instant.now().plus(pageTimeout));
      try {
        RawExtraction raw = visionExtractor.extract(prompt, List.of(image));
        result.complete(normalizer.toPageResult(pageIndex, raw));
      } catch (RuntimeException e) {
        result.completeExceptionally(e);
      } catch (Error e) {
        result.completeExceptionally(e);
        throw e;
      } finally {
        deadline.cancel(false);
        synchronized (this) {
          worker = null;
          // an expiry that raced the finish must not leak into the next task on this thread
          Thread.interrupted();
        }
      }
    }

    private synchronized void expire() {
      TimeoutException timeout =
          new TimeoutException(
              "page " + pageIndex + " exceeded " + pageTimeout.getSeconds() + "s");
      if (result.completeExceptionally(timeout) && worker != null) {
        worker.interrupt();
      }
    }
  }
}
