package com.wordvault.domain;

import java.util.List;

/**
 * Structured content of one scraped page for one headword rendering.
 *
 * <p>Every string is empty rather than null and every sequence is empty rather than absent, so
 * entries stored under older shapes (no idioms, no phrasal-verb senses) read back uniformly.
 */
public record Entry(
    String headword,
    String partOfSpeech,
    String symbol,
    Phonetics british,
    Phonetics american,
    String grammarNote,
    String labels,
    String variantForms,
    List<Sense> senses,
    List<Idiom> idioms,
    List<PhrasalVerbRef> phrasalVerbs,
    List<Sense> phrasalVerbSenses) {

  public Entry {
    headword = Values.text(headword);
    partOfSpeech = Values.text(partOfSpeech);
    symbol = Values.text(symbol);
    british = british == null ? Phonetics.EMPTY : british;
    american = american == null ? Phonetics.EMPTY : american;
    grammarNote = Values.text(grammarNote);
    labels = Values.text(labels);
    variantForms = Values.text(variantForms);
    senses = Values.list(senses);
    idioms = Values.list(idioms);
    phrasalVerbs = Values.list(phrasalVerbs);
    phrasalVerbSenses = Values.list(phrasalVerbSenses);
  }

  /** Copy in which every nested sense and example carries an id. */
  public Entry withIdsAssigned() {
    return new Entry(
        headword,
        partOfSpeech,
        symbol,
        british,
        american,
        grammarNote,
        labels,
        variantForms,
        senses.stream().map(Sense::withIdsAssigned).toList(),
        idioms.stream().map(Idiom::withIdsAssigned).toList(),
        phrasalVerbs,
        phrasalVerbSenses.stream().map(Sense::withIdsAssigned).toList());
  }
}
