package com.wordvault.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record IdiomHit(
    String idiomText,
    String partOfSpeech,
    @JsonProperty("isIdiom") boolean isIdiom,
    String recordKey) {}
