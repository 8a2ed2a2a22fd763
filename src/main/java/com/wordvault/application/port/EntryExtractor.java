package com.wordvault.application.port;

import com.wordvault.domain.Entry;
import java.util.Optional;

public interface EntryExtractor {
  /**
   * Extract the entry described by one page of markup. Purely structural, no I/O.
   *
   * @param markup raw page markup
   * @param pageUrl address the markup was fetched from, used to resolve relative links
   * @return the entry, or empty if the page carries no headword
   */
  Optional<Entry> extract(String markup, String pageUrl);
}
