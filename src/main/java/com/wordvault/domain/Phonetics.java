package com.wordvault.domain;

/** One pronunciation: an optional audio reference plus its transcription. */
public record Phonetics(String audioUrl, String transcription) {
  public static final Phonetics EMPTY = new Phonetics("", "");

  public Phonetics {
    audioUrl = Values.text(audioUrl);
    transcription = Values.text(transcription);
  }
}
