package com.polybot.finder.query;

import java.util.Objects;

/**
 * Canonical query text: lowercase letters and digits separated by single spaces. Only {@link QueryNormalizer}
 * creates these, so the length constraint has always been checked.
 */
public record NormalizedQuery(String text) {

  public NormalizedQuery {
    Objects.requireNonNull(text, "text");
  }

  @Override
  public String toString() {
    return text;
  }
}
