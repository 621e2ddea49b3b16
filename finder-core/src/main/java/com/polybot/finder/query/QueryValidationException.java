package com.polybot.finder.query;

import java.util.Objects;

/**
 * Raw query rejected before any catalog access.
 */
public final class QueryValidationException extends RuntimeException {

  public enum Reason {
    EMPTY,
    TOO_SHORT,
  }

  private final Reason reason;
  private final String rawQuery;
  private final int minLength;

  public QueryValidationException(Reason reason, String rawQuery, int minLength) {
    super(reason == Reason.EMPTY
        ? "query is empty"
        : "query must have at least " + minLength + " letters or digits");
    this.reason = Objects.requireNonNull(reason, "reason");
    this.rawQuery = rawQuery == null ? "" : rawQuery;
    this.minLength = minLength;
  }

  public Reason reason() {
    return reason;
  }

  public String rawQuery() {
    return rawQuery;
  }

  public int minLength() {
    return minLength;
  }
}
