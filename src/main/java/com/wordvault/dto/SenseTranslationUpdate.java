package com.wordvault.dto;

/** Either field may be null, meaning "leave as is". */
public record SenseTranslationUpdate(
    String id, String definitionTranslated, String definitionTranslatedShort) {}
