package com.wordvault.dto;

import java.util.List;

/** One page of matching headwords; {@code total} counts all matches before pagination. */
public record SearchResponse(long total, List<String> words) {}
