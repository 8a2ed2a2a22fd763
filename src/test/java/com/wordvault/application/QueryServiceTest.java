package com.wordvault.application;

import static com.wordvault.domain.Entries.entry;
import static com.wordvault.domain.Entries.sense;
import static com.wordvault.domain.Entries.example;
import static com.wordvault.domain.Entries.idiom;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wordvault.domain.Entry;
import com.wordvault.domain.Example;
import com.wordvault.domain.ExampleTranslation;
import com.wordvault.domain.Idiom;
import com.wordvault.domain.IdiomMatch;
import com.wordvault.domain.IngestPayload;
import com.wordvault.domain.Sense;
import com.wordvault.domain.SenseTranslation;
import com.wordvault.dto.BackfillResult;
import com.wordvault.dto.ExampleTranslationUpdate;
import com.wordvault.dto.IdiomHit;
import com.wordvault.dto.IdiomSearchResponse;
import com.wordvault.dto.RecordListResponse;
import com.wordvault.dto.SearchResponse;
import com.wordvault.dto.SenseTranslationUpdate;
import com.wordvault.infrastructure.SqliteLexicalStore;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class QueryServiceTest {
  @TempDir Path dir;

  private SqliteLexicalStore store;
  private QueryService query;
  private final Canonicalizer canonicalizer = new Canonicalizer();

  @BeforeEach
  void setUp() throws Exception {
    store = new SqliteLexicalStore("jdbc:sqlite:" + dir.resolve("query.db"), new ObjectMapper());
    store.open();
    query = new QueryService(store, 100);
  }

  @AfterEach
  void tearDown() {
    store.close();
  }

  @Test
  @DisplayName("Prefix search is paginated after sorting")
  void testSearchPrefix() {
    put(entry("ability", "noun", "a2", List.of()));
    put(entry("above", "preposition", "a1", List.of()));
    put(entry("cab", "noun", "", List.of()));

    assertEquals(new SearchResponse(2, List.of("above", "ability")), query.searchPrefix("ab", 1, 100));
    assertEquals(new SearchResponse(2, List.of("above")), query.searchPrefix("ab", 1, 1));
    assertEquals(new SearchResponse(2, List.of("ability")), query.searchPrefix("ab", 2, 1));
    assertEquals(new SearchResponse(2, List.of()), query.searchPrefix("ab", 3, 1));
    assertEquals(new SearchResponse(0, List.of()), query.searchPrefix("zz", 1, 10));
  }

  @Test
  @DisplayName("Prefix search validates the query and paging")
  void testSearchPrefixValidation() {
    assertThrows(InvalidInputException.class, () -> query.searchPrefix(null, 1, 10));
    assertThrows(InvalidInputException.class, () -> query.searchPrefix(" ", 1, 10));
    assertThrows(InvalidInputException.class, () -> query.searchPrefix("ab%", 1, 10));
    assertThrows(InvalidInputException.class, () -> query.searchPrefix("ab", 0, 10));
    assertThrows(InvalidInputException.class, () -> query.searchPrefix("ab", 1, 0));
    assertThrows(InvalidInputException.class, () -> query.searchPrefix("ab", 1, 101));
  }

  @Test
  @DisplayName("Idioms rank exact, then containing, then loose matches")
  void testSearchIdiomsRanking() {
    put(idioms("take", "take good care of", "take something into account"));
    put(idioms("care", "take care of somebody", "take care"));
    put(idioms("good", "take care"));

    IdiomSearchResponse res = query.searchIdioms("Take-care!", 1, 100);

    assertEquals(3, res.total());
    assertEquals(
        List.of("take care", "take care of somebody", "take good care of"),
        res.words().stream().map(IdiomHit::idiomText).toList());
    IdiomHit exact = res.words().get(0);
    assertEquals("care", exact.recordKey());
    assertTrue(exact.isIdiom());
    assertEquals("verb", exact.partOfSpeech());

    IdiomSearchResponse second = query.searchIdioms("take care", 2, 2);
    assertEquals(3, second.total());
    assertEquals("take good care of", second.words().get(0).idiomText());
  }

  @Test
  @DisplayName("An exact idiom outranks earlier idioms that merely contain it")
  void testExactIdiomFirst() {
    put(idioms("take", "take it easy", "take easy steps"));
    put(idioms("easy", "easy"));

    assertEquals(
        List.of("easy", "take it easy", "take easy steps"),
        query.searchIdioms("easy", 1, 10).words().stream().map(IdiomHit::idiomText).toList());
  }

  @Test
  @DisplayName("Punctuation in stored idioms does not hide an exact match")
  void testRankIgnoresPunctuation() {
    List<IdiomMatch> matches =
        List.of(
            new IdiomMatch("easy does it all the time", "", "easy"),
            new IdiomMatch("easy does it!", "", "easy"),
            new IdiomMatch("take it easy, does it", "", "take"));

    List<IdiomMatch> ranked =
        QueryService.rank(matches, QueryService.sanitizePhrase("Easy does it!"));

    assertEquals(
        List.of("easy does it!", "easy does it all the time", "take it easy, does it"),
        ranked.stream().map(IdiomMatch::idiomText).toList());
  }

  @Test
  @DisplayName("Idioms with apostrophes rank exact through the search")
  void testSearchIdiomsWithApostrophe() {
    put(idioms("mind", "mind sbs own business and more", "mind sb's own business"));

    assertEquals(
        "mind sb's own business",
        query.searchIdioms("mind sb's own business", 1, 10).words().get(0).idiomText());
  }

  @Test
  @DisplayName("Idiom search with nothing but punctuation finds nothing")
  void testSearchIdiomsEmptyPhrase() {
    put(idioms("take", "take care"));
    assertEquals(IdiomSearchResponse.empty(), query.searchIdioms(" ?! ", 1, 10));
    assertEquals(IdiomSearchResponse.empty(), query.searchIdioms(null, 1, 10));
  }

  @Test
  @DisplayName("Phrases become loose case-insensitive patterns")
  void testPhrasePattern() {
    assertEquals("take care", QueryService.sanitizePhrase("  take-care!! "));
    assertTrue(QueryService.phrasePattern("take into").matcher("Take something INTO account").find());
    assertFalse(QueryService.phrasePattern("into take").matcher("take something into").find());
  }

  @Test
  @DisplayName("Example backfill counts updated and skipped items")
  void testBackfillExamples() {
    Example ex = example("Take an umbrella.");
    put(entry("take", "verb", "", List.of(sense("to carry", List.of(ex)))));

    BackfillResult first =
        query.backfillExamples(
            Arrays.asList(
                new ExampleTranslationUpdate(ex.id(), "Lleva un paraguas."),
                new ExampleTranslationUpdate("not-an-id", "x"),
                new ExampleTranslationUpdate(ex.id(), "  "),
                null));
    assertEquals(new BackfillResult(1, 3), first);

    BackfillResult again =
        query.backfillExamples(List.of(new ExampleTranslationUpdate(ex.id(), "Otra.")));
    assertEquals(new BackfillResult(0, 1), again);

    assertEquals(
        List.of(new ExampleTranslation(ex.id(), "Lleva un paraguas.")),
        query.exampleTranslations(List.of(ex.id(), "bogus", ex.id())));
  }

  @Test
  @DisplayName("Sense backfill fills each form independently")
  void testBackfillSenses() {
    Sense sense = sense("to carry", List.of());
    put(entry("take", "verb", "", List.of(sense)));

    assertEquals(
        new BackfillResult(1, 1),
        query.backfillSenses(
            List.of(
                new SenseTranslationUpdate(sense.id(), "llevar", null),
                new SenseTranslationUpdate(sense.id(), " ", ""))));
    assertEquals(
        new BackfillResult(1, 0),
        query.backfillSenses(List.of(new SenseTranslationUpdate(sense.id(), "otro", "llevar"))));

    assertEquals(
        List.of(new SenseTranslation(sense.id(), "llevar", "llevar")),
        query.senseTranslations(List.of(sense.id())));
  }

  @Test
  @DisplayName("Record listing pages by key and reports the filter total")
  void testList() {
    put(entry("ability", "noun", "a2", List.of()));
    put(entry("able", "adjective", "a2", List.of()));
    put(entry("above", "preposition", "a1", List.of()));

    RecordListResponse page = query.list(2, 2, null, " ", "");
    assertEquals(3, page.total());
    assertEquals(1, page.data().size());
    assertEquals("above", page.data().get(0).key());
    assertEquals(List.of("above"), page.data().get(0).headwords());

    assertEquals(2, query.list(1, 10, null, "a2", null).total());
    assertEquals(List.of("adjective", "noun", "preposition"), query.partsOfSpeech());
    assertThrows(InvalidInputException.class, () -> query.list(1, 1001, null, null, null));
  }

  private static Entry idioms(String headword, String... texts) {
    List<Idiom> found =
        Arrays.stream(texts).map(t -> idiom(t, sense("meaning of " + t, List.of()))).toList();
    return entry(headword, "verb", "", List.of(), found, List.of());
  }

  private void put(Entry entry) {
    IngestPayload payload = new IngestPayload(entry.headword(), List.of(entry), List.of());
    store.update(
        canonicalizer.keyFor(payload), existing -> canonicalizer.merge(existing, payload));
  }
}
