package com.polybot.finder.catalog;

public final class MalformedResponseException extends CatalogException {

  public MalformedResponseException(String message) {
    super(CatalogFailure.MALFORMED_RESPONSE, message, null);
  }

  public MalformedResponseException(String message, Throwable cause) {
    super(CatalogFailure.MALFORMED_RESPONSE, message, cause);
  }
}
