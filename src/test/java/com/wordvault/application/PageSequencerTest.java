package com.wordvault.application;

import static com.wordvault.domain.Entries.entry;
import static org.junit.jupiter.api.Assertions.*;

import com.wordvault.application.port.EntryExtractor;
import com.wordvault.application.port.PageFetcher;
import com.wordvault.domain.Entry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PageSequencerTest {
  private static final String BASE = "https://dict.example/definition/english/";

  /** Serves canned pages by URL and records every request. */
  static class FakeFetcher implements PageFetcher {
    final Map<String, String> pages = new HashMap<>();
    final Map<String, RuntimeException> failures = new HashMap<>();
    final List<String> requested = new ArrayList<>();

    @Override
    public Optional<String> fetch(String url) {
      requested.add(url);
      RuntimeException failure = failures.get(url);
      if (failure != null) throw failure;
      return Optional.ofNullable(pages.get(url));
    }
  }

  /** Treats the whole markup as the headword; blank markup has none. */
  static final EntryExtractor HEADWORD_ONLY =
      (markup, url) ->
          markup.isBlank()
              ? Optional.empty()
              : Optional.of(entry(markup, "noun", "", List.of()));

  private final FakeFetcher fetcher = new FakeFetcher();

  @Test
  @DisplayName("Pages are requested in order until one is missing")
  void testStopsAtMissingPage() {
    fetcher.pages.put(BASE + "bank_1", "bank");
    fetcher.pages.put(BASE + "bank_2", "Bank");

    List<Entry> entries = sequencer(5).collect("bank");

    assertEquals(List.of("bank", "Bank"), entries.stream().map(Entry::headword).toList());
    assertEquals(List.of(BASE + "bank_1", BASE + "bank_2", BASE + "bank_3"), fetcher.requested);
  }

  @Test
  @DisplayName("A page without a headword also ends the walk")
  void testStopsAtEmptyExtraction() {
    fetcher.pages.put(BASE + "bank_1", "bank");
    fetcher.pages.put(BASE + "bank_2", " ");
    fetcher.pages.put(BASE + "bank_3", "bank");

    assertEquals(1, sequencer(5).collect("bank").size());
    assertEquals(2, fetcher.requested.size());
  }

  @Test
  @DisplayName("The walk never exceeds the page limit")
  void testPageLimit() {
    for (int i = 1; i <= 10; i++) fetcher.pages.put(BASE + "go_" + i, "go");

    assertEquals(5, sequencer(5).collect("go").size());
    assertEquals(3, sequencer(5).collect("go", 3).size());
  }

  @Test
  @DisplayName("Multi-word terms become hyphenated slugs")
  void testSlug() {
    assertEquals("take-care", PageSequencer.slug(" Take   care "));
    assertEquals(BASE + "take-care_2", sequencer(5).pageUrl("take-care", 2));

    sequencer(1).collect("take care");
    assertEquals(List.of(BASE + "take-care_1"), fetcher.requested);
  }

  @Test
  @DisplayName("A failing page aborts the whole walk")
  void testFetchFailurePropagates() {
    fetcher.pages.put(BASE + "bank_1", "bank");
    fetcher.failures.put(BASE + "bank_2", new FetchException("Unexpected status 503"));

    assertThrows(FetchException.class, () -> sequencer(5).collect("bank"));
  }

  @Test
  @DisplayName("An unknown word yields no entries")
  void testUnknownWord() {
    assertTrue(sequencer(5).collect("zzxq").isEmpty());
    assertEquals(1, fetcher.requested.size());
  }

  private PageSequencer sequencer(int maxPages) {
    return new PageSequencer(fetcher, HEADWORD_ONLY, BASE, maxPages, 0);
  }
}
