package com.flamingo.ai.legaldoc.service.analysis.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Immutable analysis input: the document text plus where it came from.
 *
 * @param text the document text as submitted
 * @param fileName original file name, or null for pasted text
 * @param byteSize size of the submitted content in bytes
 * @param contentHash SHA-256 of the submitted content, hex encoded
 */
public record RawDocument(String text, String fileName, long byteSize, String contentHash) {

  /** Wraps pasted text; size and hash are taken from its UTF-8 encoding. */
  public static RawDocument ofText(String text) {
    byte[] bytes = text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
    return new RawDocument(text, null, bytes.length, sha256(bytes));
  }

  /** Wraps text extracted from an uploaded file; size and hash describe the file bytes. */
  public static RawDocument ofFile(String text, String fileName, byte[] content) {
    return new RawDocument(text, fileName, content.length, sha256(content));
  }

  static String sha256(byte[] content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(content));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
