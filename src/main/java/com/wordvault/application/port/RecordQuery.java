package com.wordvault.application.port;

/**
 * Filter for record listings. Null members do not constrain the result.
 *
 * @param keyPrefix case-insensitive prefix of the canonical key
 * @param symbol exact CEFR symbol
 * @param partOfSpeech part of speech that must appear in the record summary
 */
public record RecordQuery(String keyPrefix, String symbol, String partOfSpeech) {}
