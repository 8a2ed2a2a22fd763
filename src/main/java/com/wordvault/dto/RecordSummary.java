package com.wordvault.dto;

import com.wordvault.domain.LexicalRecord;
import java.time.Instant;
import java.util.List;
import java.util.Set;

public record RecordSummary(
    String key,
    String symbol,
    List<String> partsOfSpeech,
    Set<String> variants,
    List<String> headwords,
    Instant createdAt,
    Instant updatedAt) {

  public static RecordSummary of(LexicalRecord r) {
    return new RecordSummary(
        r.key(), r.symbol(), r.partsOfSpeech(), r.variants(), r.headwords(), r.createdAt(),
        r.updatedAt());
  }
}
