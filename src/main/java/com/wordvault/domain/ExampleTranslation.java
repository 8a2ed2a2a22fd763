package com.wordvault.domain;

public record ExampleTranslation(String id, String translatedText) {}
