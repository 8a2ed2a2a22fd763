package com.wordvault.application.port;

import com.wordvault.domain.ExampleTranslation;
import com.wordvault.domain.IdiomMatch;
import com.wordvault.domain.LexicalRecord;
import com.wordvault.domain.SenseTranslation;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/** Persisted per-key lexical records and the nested-document queries run against them. */
public interface LexicalStore {
  Optional<LexicalRecord> findByKey(String key);

  /**
   * Find the record for a word: exact canonical key first, otherwise any record listing
   * {@code spelling} among its variants (case-insensitive).
   */
  Optional<LexicalRecord> findByWord(String key, String spelling);

  /**
   * Atomically read, transform and write the record stored under {@code key}.
   *
   * <p>{@code merge} receives the stored record, or null if there is none, and returns the record
   * to persist. No other update of the store interleaves between the read and the write.
   *
   * @return the record as persisted, timestamps included
   */
  LexicalRecord update(String key, UnaryOperator<LexicalRecord> merge);

  /**
   * Distinct entry headwords of every (record, entry) pair where the headword, the record key or
   * one of the record's variants starts with {@code prefix} (case-insensitive), sorted descending.
   */
  List<String> headwordsByPrefix(String prefix);

  /** Idioms whose text matches {@code pattern}, in stored order (record, entry, idiom). */
  List<IdiomMatch> idioms(Pattern pattern);

  RecordSlice list(RecordQuery query, int offset, int limit);

  List<String> partsOfSpeech();

  /**
   * Write {@code translatedText} into every example with id {@code exampleId} whose translation is
   * currently empty, across direct senses, idiom senses and phrasal-verb senses.
   *
   * @return number of example locations modified
   */
  int fillExampleTranslation(String exampleId, String translatedText);

  /**
   * Write the non-null arguments into every sense with id {@code senseId} whose corresponding
   * field is currently empty.
   *
   * @return number of sense locations with at least one field modified
   */
  int fillSenseTranslation(String senseId, String definitionTranslated, String definitionShort);

  List<ExampleTranslation> exampleTranslations(Collection<String> exampleIds);

  List<SenseTranslation> senseTranslations(Collection<String> senseIds);
}
