package com.wordvault.dto;

import com.wordvault.domain.Entry;
import java.util.List;

/**
 * Result of a word lookup.
 *
 * @param word canonical key of the record
 * @param quantity number of entries
 * @param source {@code store} when served from the store, {@code scraped} when just ingested
 */
public record LookupResponse(
    String word, int quantity, List<Entry> data, List<String> variants, String source) {
  public static final String SOURCE_STORE = "store";
  public static final String SOURCE_SCRAPED = "scraped";
}
