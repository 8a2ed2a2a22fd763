package com.wordvault.application;

/**
 * Scraping a source page failed (network error, timeout, unexpected status). The whole lookup is
 * aborted and nothing it collected is persisted.
 */
public class FetchException extends RuntimeException {
  public FetchException(String message) {
    super(message);
  }

  public FetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
