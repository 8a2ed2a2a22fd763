package com.wordvault.domain;

import java.util.List;

/**
 * Entries plus the spellings that produced them, handed to the canonicalizer in one shape.
 *
 * @param term the originally requested term; keys the record when {@code entries} is empty
 */
public record IngestPayload(String term, List<Entry> entries, List<String> variants) {
  public IngestPayload {
    term = Values.text(term);
    entries = Values.list(entries);
    variants = Values.strings(variants);
  }
}
