package com.polybot.finder.catalog;

@FunctionalInterface
public interface CatalogFetcher {

  /**
   * Retrieves the full catalog.
   *
   * @throws RemoteUnavailableException when the remote cannot be reached within the retry budget
   * @throws MalformedResponseException when the remote answers with an unexpected payload shape
   */
  CatalogSnapshot fetch();
}
