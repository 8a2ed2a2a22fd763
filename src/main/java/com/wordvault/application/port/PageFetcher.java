package com.wordvault.application.port;

import java.util.Optional;

public interface PageFetcher {
  /**
   * Fetch one source page.
   *
   * @param url absolute page address
   * @return the page markup, or empty if the source reports the page does not exist
   * @throws com.wordvault.application.FetchException on transport failure, timeout or any other
   *     unexpected status
   */
  Optional<String> fetch(String url);
}
