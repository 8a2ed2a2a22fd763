package com.wordvault.domain;

import java.util.List;

/**
 * One definition with its cross references and examples.
 *
 * <p>{@code id} is assigned when the sense is extracted and is the join key for translation
 * backfill; it is carried unchanged through every merge.
 */
public record Sense(
    String id,
    String definition,
    String definitionTranslated,
    String definitionTranslatedShort,
    String symbol,
    String labels,
    String disambiguation,
    String grammar,
    String collocationForm,
    String variantForms,
    List<String> synonyms,
    List<String> opposites,
    List<String> seeAlsos,
    List<Example> examples) {

  public Sense {
    id = Values.text(id);
    definition = Values.text(definition);
    definitionTranslated = Values.text(definitionTranslated);
    definitionTranslatedShort = Values.text(definitionTranslatedShort);
    symbol = Values.text(symbol);
    labels = Values.text(labels);
    disambiguation = Values.text(disambiguation);
    grammar = Values.text(grammar);
    collocationForm = Values.text(collocationForm);
    variantForms = Values.text(variantForms);
    synonyms = Values.strings(synonyms);
    opposites = Values.strings(opposites);
    seeAlsos = Values.strings(seeAlsos);
    examples = Values.list(examples);
  }

  /** Copy with fresh ids for this sense and any of its examples that lack one. */
  public Sense withIdsAssigned() {
    return new Sense(
        id.isEmpty() ? Identifiers.newId() : id,
        definition,
        definitionTranslated,
        definitionTranslatedShort,
        symbol,
        labels,
        disambiguation,
        grammar,
        collocationForm,
        variantForms,
        synonyms,
        opposites,
        seeAlsos,
        examples.stream().map(Example::withIdAssigned).toList());
  }
}
