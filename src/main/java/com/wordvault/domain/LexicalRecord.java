package com.wordvault.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Persisted record for one canonical word key.
 *
 * @param key canonical key, primary key of the store
 * @param entries one per distinct trimmed headword, in insertion order
 * @param variants spellings known to resolve to {@code key}
 * @param symbol derived CEFR summary, empty if none
 * @param partsOfSpeech sorted union of the entries' parts of speech
 */
public record LexicalRecord(
    String key,
    List<Entry> entries,
    Set<String> variants,
    String symbol,
    List<String> partsOfSpeech,
    Instant createdAt,
    Instant updatedAt) {

  public LexicalRecord {
    key = Values.text(key);
    entries = Values.list(entries);
    variants =
        variants == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(variants));
    symbol = Values.text(symbol);
    partsOfSpeech = Values.strings(partsOfSpeech);
  }

  public List<String> headwords() {
    return entries.stream().map(Entry::headword).toList();
  }
}
