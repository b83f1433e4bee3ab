package com.kyc.vision.app.service;

import com.kyc.vision.app.config.ExtractionProperties;
import com.kyc.vision.app.exception.InvalidSourceException;
import com.kyc.vision.app.model.LoadedSource;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/** Reads a source from an upload, a remote URL or a server-local path. */
@Log4j2
public class SourceLoader {

  private final WebClient webClient;
  private final ExtractionProperties props;

  public SourceLoader(WebClient.Builder builder, ExtractionProperties props) {
    this.props = props;
    int limit = (int) Math.min(Integer.MAX_VALUE, props.maxFileBytes());
    this.webClient = builder.codecs(c -> c.defaultCodecs().maxInMemorySize(limit)).build();
  }

  public LoadedSource fromUpload(MultipartFile file, String fallbackName) {
    String filename =
        (file.getOriginalFilename() == null || file.getOriginalFilename().isBlank())
            ? fallbackName
            : file.getOriginalFilename();
    try {
      byte[] data = file.getBytes();
      log.debug("source.upload name={} size={}", filename, data.length);
      return new LoadedSource(filename, data);
    } catch (IOException e) {
      throw new InvalidSourceException(
          InvalidSourceException.LOAD_ERROR, "Could not read upload: " + e.getMessage(), e);
    }
  }

  /** Downloads an http(s) URL into memory, capped at the configured file size. */
  public LoadedSource fetchRemote(String url) {
    String trimmed = url == null ? "" : url.strip();
    String lower = trimmed.toLowerCase(Locale.ROOT);
    if (!(lower.startsWith("http://") || lower.startsWith("https://"))) {
      throw new InvalidSourceException(
          InvalidSourceException.INVALID_URL_SCHEME, "Only http and https URLs are accepted");
    }

    ResponseEntity<byte[]> response;
    try {
      response =
          webClient
              .get()
              .uri(URI.create(trimmed))
              .retrieve()
              .toEntity(byte[].class)
              .block(Duration.ofSeconds(props.getFetchTimeoutSeconds()));
    } catch (RuntimeException e) {
      if (hasCause(e, DataBufferLimitException.class)) {
        throw new InvalidSourceException(
            InvalidSourceException.URL_TOO_LARGE,
            "Remote file exceeds " + props.getMaxFileMb() + " MB",
            e);
      }
      int status = (e instanceof WebClientResponseException w) ? w.getStatusCode().value() : -1;
      log.warn("source.fetch error url={} status={} msg={}", trimmed, status, e.getMessage());
      throw new InvalidSourceException(
          InvalidSourceException.URL_FETCH_ERROR, "Could not fetch " + trimmed, e);
    }

    byte[] data = (response == null) ? null : response.getBody();
    if (data == null || data.length == 0) {
      throw new InvalidSourceException(
          InvalidSourceException.URL_FETCH_ERROR, "Empty response from " + trimmed);
    }
    if (data.length > props.maxFileBytes()) {
      throw new InvalidSourceException(
          InvalidSourceException.URL_TOO_LARGE,
          "Remote file exceeds " + props.getMaxFileMb() + " MB");
    }

    String filename = filenameFromUrl(trimmed, response.getHeaders().getContentType());
    log.debug("source.fetch url={} name={} size={}", trimmed, filename, data.length);
    return new LoadedSource(filename, data);
  }

  public LoadedSource readLocal(String filePath) {
    if (!props.isLocalPathEnabled()) {
      throw new InvalidSourceException(
          InvalidSourceException.FILE_PATH_DISABLED, "file_path sources are disabled");
    }
    Path p;
    try {
      p = Paths.get(filePath.strip()).toAbsolutePath().normalize();
    } catch (RuntimeException e) {
      throw new InvalidSourceException(
          InvalidSourceException.FILE_PATH_NOT_FOUND, "Invalid path: " + filePath, e);
    }
    if (!Files.isRegularFile(p)) {
      throw new InvalidSourceException(
          InvalidSourceException.FILE_PATH_NOT_FOUND, "No such file: " + p);
    }
    try {
      byte[] data = Files.readAllBytes(p);
      log.debug("source.local path={} size={}", p, data.length);
      return new LoadedSource(p.getFileName().toString(), data);
    } catch (IOException e) {
      throw new InvalidSourceException(
          InvalidSourceException.LOAD_ERROR, "Could not read " + p + ": " + e.getMessage(), e);
    }
  }

  /** Last path segment of the URL; an extension is derived from the content type if missing. */
  static String filenameFromUrl(String url, MediaType contentType) {
    String path = URI.create(url).getPath();
    String name = (path == null) ? "" : path.substring(path.lastIndexOf('/') + 1);
    if (name.isBlank()) {
      name = "downloaded";
    }
    if (name.contains(".") || contentType == null) {
      return name;
    }
    String subtype = contentType.getSubtype().toLowerCase(Locale.ROOT);
    if (subtype.contains("pdf")) return name + ".pdf";
    if (subtype.contains("jpeg") || subtype.contains("jpg")) return name + ".jpg";
    if (subtype.contains("png")) return name + ".png";
    if (subtype.contains("webp")) return name + ".webp";
    return name;
  }

  private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
    for (Throwable c = t; c != null; c = c.getCause()) {
      if (type.isInstance(c)) return true;
      if (c.getCause() == c) break;
    }
    return false;
  }
}
