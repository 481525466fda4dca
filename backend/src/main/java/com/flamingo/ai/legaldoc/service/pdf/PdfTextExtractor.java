package com.flamingo.ai.legaldoc.service.pdf;

/** Extracts plain text from PDF bytes. */
public interface PdfTextExtractor {

  /**
   * Extracts the text of every page, pages separated by a newline.
   *
   * <p>A PDF without a text layer yields an empty string; callers must treat that as a failure.
   *
   * @param pdfBytes the PDF content
   * @return the extracted text, trimmed
   * @throws com.flamingo.ai.legaldoc.exception.TextExtractionException if the bytes cannot be
   *     parsed as a PDF
   */
  String extract(byte[] pdfBytes);
}
