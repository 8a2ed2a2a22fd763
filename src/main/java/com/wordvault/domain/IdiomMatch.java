package com.wordvault.domain;

/**
 * An idiom found in the store, with the part of speech of its owning entry.
 *
 * @param recordKey canonical key of the record holding the idiom
 */
public record IdiomMatch(String idiomText, String partOfSpeech, String recordKey) {}
