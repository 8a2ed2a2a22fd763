package com.wordvault.domain;

import java.util.List;

public record Idiom(String idiomText, String labels, String variantForms, List<Sense> senses) {
  public Idiom {
    idiomText = Values.text(idiomText);
    labels = Values.text(labels);
    variantForms = Values.text(variantForms);
    senses = Values.list(senses);
  }

  public Idiom withIdsAssigned() {
    return new Idiom(
        idiomText, labels, variantForms, senses.stream().map(Sense::withIdsAssigned).toList());
  }
}
