package com.wordvault.dto;

public record ExampleTranslationUpdate(String id, String translatedText) {}
