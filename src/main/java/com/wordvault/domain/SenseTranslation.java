package com.wordvault.domain;

public record SenseTranslation(
    String id, String definitionTranslated, String definitionTranslatedShort) {}
