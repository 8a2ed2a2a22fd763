package com.wordvault.dto;

import java.util.List;

public record IdiomSearchResponse(long total, List<IdiomHit> words) {
  public static IdiomSearchResponse empty() {
    return new IdiomSearchResponse(0, List.of());
  }
}
