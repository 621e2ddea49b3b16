package com.polybot.finder.query;

import java.util.Locale;
import java.util.regex.Pattern;

public final class QueryNormalizer {

  private static final Pattern NOT_WORD_OR_SPACE = Pattern.compile("[^\\p{L}\\p{N}\\s]", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern BLANK = Pattern.compile("\\s*", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

  private final int minLength;

  public QueryNormalizer(int minLength) {
    if (minLength < 1) {
      throw new IllegalArgumentException("minLength must be >= 1");
    }
    this.minLength = minLength;
  }

  /**
   * @throws QueryValidationException if the input is blank or too short once canonicalized
   */
  public NormalizedQuery normalize(String raw) {
    if (raw == null || BLANK.matcher(raw).matches()) {
      throw new QueryValidationException(QueryValidationException.Reason.EMPTY, raw, minLength);
    }
    String text = canonicalize(raw);
    if (text.length() < minLength) {
      throw new QueryValidationException(QueryValidationException.Reason.TOO_SHORT, raw, minLength);
    }
    return new NormalizedQuery(text);
  }

  /**
   * Lowercases, drops everything that is not a letter, digit or whitespace, and collapses whitespace.
   * Applied to both queries and market questions. Idempotent.
   */
  public static String canonicalize(String raw) {
    if (raw == null) {
      return "";
    }
    String lower = raw.strip().toLowerCase(Locale.ROOT);
    String stripped = NOT_WORD_OR_SPACE.matcher(lower).replaceAll("");
    return WHITESPACE_RUN.matcher(stripped).replaceAll(" ").strip();
  }

  public int minLength() {
    return minLength;
  }
}
