package com.flamingo.ai.legaldoc.service.pdf;

import com.flamingo.ai.legaldoc.exception.TextExtractionException;
import io.micrometer.core.annotation.Timed;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

/** {@link PdfTextExtractor} implementation using Apache PDFBox 3.x. */
@Service
@Slf4j
public class PdfBoxTextExtractor implements PdfTextExtractor {

  @Override
  @Timed(value = "pdf.extract", description = "Time to extract text from a PDF")
  public String extract(byte[] pdfBytes) {
    try (PDDocument pdfDoc = Loader.loadPDF(pdfBytes)) {
      PDFTextStripper stripper = new PDFTextStripper();
      StringBuilder text = new StringBuilder();
      int pageCount = pdfDoc.getNumberOfPages();
      for (int page = 1; page <= pageCount; page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        text.append(stripper.getText(pdfDoc)).append("\n");
      }
      log.debug("Extracted {} chars from {} PDF pages", text.length(), pageCount);
      return text.toString().strip();
    } catch (IOException e) {
      log.error("PDFBox extraction failed: {}", e.getMessage());
      throw new TextExtractionException("Failed to process PDF file: " + e.getMessage(), e);
    }
  }
}
