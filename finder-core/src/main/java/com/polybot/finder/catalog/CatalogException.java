package com.polybot.finder.catalog;

import java.util.Objects;

public abstract class CatalogException extends RuntimeException {

  private final CatalogFailure failure;

  protected CatalogException(CatalogFailure failure, String message, Throwable cause) {
    super(message, cause);
    this.failure = Objects.requireNonNull(failure, "failure");
  }

  public CatalogFailure failure() {
    return failure;
  }
}
