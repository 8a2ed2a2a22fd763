package com.wordvault.domain;

public record Example(
    String id, String collocationForm, String labels, String sourceText, String translatedText) {
  public Example {
    id = Values.text(id);
    collocationForm = Values.text(collocationForm);
    labels = Values.text(labels);
    sourceText = Values.text(sourceText);
    translatedText = Values.text(translatedText);
  }

  /** This example, or a copy with a fresh id if it has none. */
  public Example withIdAssigned() {
    if (!id.isEmpty()) return this;
    return new Example(Identifiers.newId(), collocationForm, labels, sourceText, translatedText);
  }
}
