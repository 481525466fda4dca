package com.flamingo.ai.legaldoc.service.analysis;

import java.util.regex.Pattern;

/** Collapses every whitespace run (spaces, newlines, tabs) to one space and trims the ends. */
public class TextNormalizer {

  private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

  public String normalize(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    return WHITESPACE_RUN.matcher(text).replaceAll(" ").strip();
  }
}
