package com.kyc.vision.app.api;

import com.kyc.vision.app.exception.InvalidSourceException;
import com.kyc.vision.app.model.FlatExtractionResult;
import com.kyc.vision.app.model.LoadedSource;
import com.kyc.vision.app.model.MultiExtractionResult;
import com.kyc.vision.app.service.MultiDocumentExtractionService;
import com.kyc.vision.app.service.SingleDocumentExtractionService;
import com.kyc.vision.app.service.SourceLoader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@Log4j2
@RestController
@RequiredArgsConstructor
public class ExtractionController {

  private final SourceLoader sourceLoader;
  private final SingleDocumentExtractionService singleService;
  private final MultiDocumentExtractionService multiService;

  // ------------------------------------------------------------
  // /extract/vision/multi
  // ------------------------------------------------------------
  @PostMapping(
      path = "/extract/vision/multi",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<MultiExtractionResult> extractMulti(
      @RequestPart(name = "file", required = false) MultipartFile file,
      @RequestParam(name = "source_url", required = false) String sourceUrl,
      @RequestParam(name = "file_path", required = false) String filePath) {

    boolean hasFile = file != null && !file.isEmpty();
    boolean hasUrl = hasText(sourceUrl);
    boolean hasPath = hasText(filePath);
    requireExactlyOne(hasFile, hasUrl, hasPath);

    LoadedSource source;
    if (hasFile) {
      source = sourceLoader.fromUpload(file, "upload");
      log.debug(
          "multi.input mode=file name={} size={}", source.getFilename(), source.getData().length);
    } else if (hasUrl) {
      source = sourceLoader.fetchRemote(sourceUrl);
      log.debug("multi.input mode=source_url url={} size={}", sourceUrl, source.getData().length);
    } else {
      source = sourceLoader.readLocal(filePath);
      log.debug("multi.input mode=file_path path={} size={}", filePath, source.getData().length);
    }

    MultiExtractionResult result = multiService.extract(source.getFilename(), source.getData());
    return ResponseEntity.ok(result);
  }

  // ------------------------------------------------------------
  // /extract/vision/single
  // ------------------------------------------------------------
  @PostMapping(
      path = "/extract/vision/single",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<List<FlatExtractionResult>> extractSingle(
      @RequestPart(name = "files", required = false) List<MultipartFile> files,
      @RequestPart(name = "file", required = false) MultipartFile file,
      @RequestParam(name = "source_url", required = false) String sourceUrl,
      @RequestParam(name = "source_urls", required = false) List<String> sourceUrls,
      @RequestParam(name = "doc_type", required = false) String docType) {

    // Legacy single 'file' part joins the 'files' list.
    List<MultipartFile> uploads = new ArrayList<>();
    if (files != null) {
      files.stream().filter(f -> f != null && !f.isEmpty()).forEach(uploads::add);
    }
    if (file != null && !file.isEmpty()) {
      uploads.add(file);
    }

    List<String> urls = new ArrayList<>();
    if (sourceUrls != null) {
      sourceUrls.stream()
          .filter(ExtractionController::hasText)
          .map(String::strip)
          .forEach(urls::add);
    }

    requireExactlyOne(!uploads.isEmpty(), hasText(sourceUrl), !urls.isEmpty());

    List<LoadedSource> sources = new ArrayList<>();
    if (!uploads.isEmpty()) {
      for (int i = 0; i < uploads.size(); i++) {
        sources.add(sourceLoader.fromUpload(uploads.get(i), "upload_" + i));
      }
    } else if (hasText(sourceUrl)) {
      sources.add(sourceLoader.fetchRemote(sourceUrl));
    } else {
      for (String url : urls) {
        sources.add(sourceLoader.fetchRemote(url));
      }
    }

    log.info("single.input sources={} docTypeHint={}", sources.size(), docType);
    return ResponseEntity.ok(singleService.extractAll(sources, docType));
  }

  // ------------------------------------------------------------
  // /health
  // ------------------------------------------------------------
  @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
  public Map<String, String> health() {
    return Map.of("status", "ok");
  }

  // ============================================================
  // Helpers
  // ============================================================
  private static void requireExactlyOne(boolean... provided) {
    int used = 0;
    for (boolean p : provided) {
      if (p) used++;
    }
    if (used != 1) {
      throw new InvalidSourceException(
          InvalidSourceException.PROVIDE_EXACTLY_ONE_SOURCE,
          "Provide exactly one source, got " + used);
    }
  }

  private static boolean hasText(String s) {
    return s != null && !s.isBlank();
  }
}
