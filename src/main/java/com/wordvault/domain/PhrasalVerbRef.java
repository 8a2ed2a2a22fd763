package com.wordvault.domain;

public record PhrasalVerbRef(String word, String link) {
  public PhrasalVerbRef {
    word = Values.text(word);
    link = Values.text(link);
  }
}
