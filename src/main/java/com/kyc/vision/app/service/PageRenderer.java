package com.kyc.vision.app.service;

import com.kyc.vision.app.exception.InvalidSourceException;
import com.kyc.vision.app.model.RenderedPages;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import javax.imageio.ImageIO;
import lombok.extern.log4j.Log4j2;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

/**
 * Rasterizes sources into PNG page images for the vision model.
 *
 * <p>PDFs are rendered page by page with PDFBox up to a caller-supplied page limit. Images are
 * re-encoded as RGB PNG to reduce model variability; an image ImageIO cannot decode (e.g. WebP
 * without a plugin) is passed through as-is.
 */
@Log4j2
public class PageRenderer {

  private final int dpi;

  public PageRenderer(int dpi) {
    this.dpi = dpi;
  }

  public RenderedPages render(String ext, byte[] data, int maxPages) {
    if ("pdf".equals(ext)) {
      return renderPdf(data, maxPages);
    }
    return RenderedPages.builder()
        .pages(List.of(toPng(data)))
        .sourcePageCount(1)
        .truncated(false)
        .build();
  }

  private RenderedPages renderPdf(byte[] data, int maxPages) {
    try (PDDocument document = PDDocument.load(data)) {
      PDFRenderer renderer = new PDFRenderer(document);
      int pageCount = document.getNumberOfPages();
      int limit = Math.min(pageCount, maxPages);

      List<byte[]> pages = new ArrayList<>(limit);
      for (int i = 0; i < limit; i++) {
        BufferedImage image = renderer.renderImageWithDPI(i, dpi, ImageType.RGB);
        pages.add(writePng(image));
      }

      boolean truncated = pageCount > maxPages;
      log.info(
          "render.pdf pages={} rendered={} truncated={} dpi={}",
          pageCount,
          pages.size(),
          truncated,
          dpi);
      return RenderedPages.builder()
          .pages(pages)
          .sourcePageCount(pageCount)
          .truncated(truncated)
          .build();
    } catch (IOException e) {
      log.warn("render.pdf error msg={}", e.getMessage());
      throw new InvalidSourceException(
          InvalidSourceException.RENDER_ERROR, "Could not render PDF: " + e.getMessage(), e);
    }
  }

  byte[] toPng(byte[] data) {
    try {
      BufferedImage src = ImageIO.read(new ByteArrayInputStream(data));
      if (src == null) {
        log.debug("render.image no ImageIO reader, passing raw bytes size={}", data.length);
        return data;
      }
      BufferedImage rgb =
          new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
      Graphics2D g = rgb.createGraphics();
      try {
        g.drawImage(src, 0, 0, Color.WHITE, null);
      } finally {
        g.dispose();
      }
      return writePng(rgb);
    } catch (IOException e) {
      log.debug("render.image decode failed, passing raw bytes msg={}", e.getMessage());
      return data;
    }
  }

  private static byte[] writePng(BufferedImage image) throws IOException {
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    ImageIO.write(image, "png", baos);
    return baos.toByteArray();
  }
}
