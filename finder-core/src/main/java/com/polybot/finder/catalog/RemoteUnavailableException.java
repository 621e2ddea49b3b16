package com.polybot.finder.catalog;

public final class RemoteUnavailableException extends CatalogException {

  public RemoteUnavailableException(String message, Throwable cause) {
    super(CatalogFailure.REMOTE_UNAVAILABLE, message, cause);
  }
}
