package com.polybot.finder.catalog;

public enum CatalogFailure {
  /**
   * Retries exhausted, or the remote rejected the request, and no cached catalog could stand in.
   */
  REMOTE_UNAVAILABLE,
  /**
   * The remote answered, but the payload does not have the catalog shape. Not retried.
   */
  MALFORMED_RESPONSE,
}
