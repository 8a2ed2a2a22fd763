package com.wordvault.application;

import com.wordvault.application.port.LexicalStore;
import com.wordvault.application.port.RecordQuery;
import com.wordvault.application.port.RecordSlice;
import com.wordvault.domain.ExampleTranslation;
import com.wordvault.domain.IdiomMatch;
import com.wordvault.domain.Identifiers;
import com.wordvault.domain.SenseTranslation;
import com.wordvault.dto.BackfillResult;
import com.wordvault.dto.ExampleTranslationUpdate;
import com.wordvault.dto.IdiomHit;
import com.wordvault.dto.IdiomSearchResponse;
import com.wordvault.dto.RecordListResponse;
import com.wordvault.dto.RecordSummary;
import com.wordvault.dto.SearchResponse;
import com.wordvault.dto.SenseTranslationUpdate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Read and backfill operations over the store, independent of ingestion.
 *
 * <p>Search results are paginated in memory after de-duplication and ranking: page {@code p} of
 * size {@code n} covers positions {@code (p-1)*n} up to {@code p*n}. Backfills never overwrite a
 * populated field and never throw on a bad item; such items count as skipped.
 */
@Service
public class QueryService {
  private static final Logger log = LoggerFactory.getLogger(QueryService.class);

  private static final Pattern PREFIX = Pattern.compile("^[A-Za-z\\s-]+$");
  private static final Pattern NON_LETTERS = Pattern.compile("[^A-Za-z]+");
  private static final int LIST_MAX_PER_PAGE = 1000;

  private final LexicalStore store;
  private final int maxPerPage;

  public QueryService(LexicalStore store, @Value("${wordvault.max-per-page:100}") int maxPerPage) {
    this.store = store;
    this.maxPerPage = maxPerPage;
  }

  public int maxPerPage() {
    return maxPerPage;
  }

  /**
   * Headwords whose text, record key or record variant starts with {@code prefix}
   * (case-insensitive), de-duplicated, sorted descending, then paginated.
   *
   * @throws InvalidInputException on an empty or non-letter prefix or bad paging
   */
  public SearchResponse searchPrefix(String prefix, int page, int perPage) {
    if (prefix == null || prefix.isBlank()) {
      throw new InvalidInputException("Query parameter 'q' is required");
    }
    String q = prefix.trim();
    if (!PREFIX.matcher(q).matches()) throw new InvalidInputException("Invalid query format");
    checkPaging(page, perPage, maxPerPage);

    List<String> all = store.headwordsByPrefix(q);
    return new SearchResponse(all.size(), slice(all, page, perPage));
  }

  /**
   * Idioms matching a loose phrase: non-letters become spaces and every space matches any run of
   * characters, so {@code "take into"} finds {@code "take something into account"}.
   *
   * <p>Matches are de-duplicated by idiom text (first in stored order wins), then ranked: exact
   * phrase, phrase as a contiguous substring, everything else; order within each rank is the stored
   * order.
   */
  public IdiomSearchResponse searchIdioms(String phrase, int page, int perPage) {
    checkPaging(page, perPage, maxPerPage);
    String clean = sanitizePhrase(phrase);
    if (clean.isEmpty()) return IdiomSearchResponse.empty();

    Map<String, IdiomMatch> unique = new LinkedHashMap<>();
    for (IdiomMatch m : store.idioms(phrasePattern(clean))) {
      unique.putIfAbsent(m.idiomText(), m);
    }
    List<IdiomMatch> ranked = rank(new ArrayList<>(unique.values()), clean);
    List<IdiomHit> hits =
        slice(ranked, page, perPage).stream()
            .map(m -> new IdiomHit(m.idiomText(), m.partOfSpeech(), true, m.recordKey()))
            .toList();
    return new IdiomSearchResponse(ranked.size(), hits);
  }

  public RecordListResponse list(
      int page, int perPage, String keyPrefix, String symbol, String partOfSpeech) {
    checkPaging(page, perPage, LIST_MAX_PER_PAGE);
    RecordQuery q =
        new RecordQuery(blankToNull(keyPrefix), blankToNull(symbol), blankToNull(partOfSpeech));
    RecordSlice slice = store.list(q, (page - 1) * perPage, perPage);
    return new RecordListResponse(
        slice.total(),
        page,
        perPage,
        slice.records().stream().map(RecordSummary::of).toList());
  }

  public List<String> partsOfSpeech() {
    return store.partsOfSpeech();
  }

  /**
   * Fill empty example translations. Each update counts as updated if it changed at least one
   * stored example, otherwise as skipped.
   */
  public BackfillResult backfillExamples(List<ExampleTranslationUpdate> updates) {
    int updated = 0;
    int skipped = 0;
    for (ExampleTranslationUpdate u : updates) {
      if (u == null || !Identifiers.isWellFormed(u.id())) {
        log.debug("Skipping example update with malformed id: {}", u == null ? null : u.id());
        skipped++;
        continue;
      }
      String text = u.translatedText() == null ? "" : u.translatedText().trim();
      if (text.isEmpty()) {
        skipped++;
        continue;
      }
      if (store.fillExampleTranslation(u.id(), text) > 0) updated++;
      else skipped++;
    }
    log.info("Example backfill: {} updated, {} skipped", updated, skipped);
    return new BackfillResult(updated, skipped);
  }

  /**
   * Fill empty sense definition translations, long and short form independently. Blank values in
   * an update are ignored.
   */
  public BackfillResult backfillSenses(List<SenseTranslationUpdate> updates) {
    int updated = 0;
    int skipped = 0;
    for (SenseTranslationUpdate u : updates) {
      if (u == null || !Identifiers.isWellFormed(u.id())) {
        log.debug("Skipping sense update with malformed id: {}", u == null ? null : u.id());
        skipped++;
        continue;
      }
      String def = blankToNull(u.definitionTranslated());
      String shortDef = blankToNull(u.definitionTranslatedShort());
      if (def == null && shortDef == null) {
        skipped++;
        continue;
      }
      if (store.fillSenseTranslation(u.id(), def, shortDef) > 0) updated++;
      else skipped++;
    }
    log.info("Sense backfill: {} updated, {} skipped", updated, skipped);
    return new BackfillResult(updated, skipped);
  }

  /** Stored example translations for the well-formed ids among {@code ids}. */
  public List<ExampleTranslation> exampleTranslations(List<String> ids) {
    return store.exampleTranslations(wellFormed(ids));
  }

  public List<SenseTranslation> senseTranslations(List<String> ids) {
    return store.senseTranslations(wellFormed(ids));
  }

  // Helpers

  /** Letters and single spaces only. */
  static String sanitizePhrase(String phrase) {
    if (phrase == null) return "";
    return NON_LETTERS.matcher(phrase).replaceAll(" ").trim().replaceAll("\\s+", " ");
  }

  /** Case-insensitive, unanchored; each space between words matches anything in between. */
  static Pattern phrasePattern(String clean) {
    String regex =
        Arrays.stream(clean.split(" ")).map(Pattern::quote).collect(Collectors.joining(".*"));
    return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
  }

  /**
   * Stable ranking: exact matches, then substring matches, then the rest. Idiom texts are
   * sanitized like the phrase before comparing, so {@code "easy does it!"} is exact for
   * {@code "easy does it"}.
   */
  static List<IdiomMatch> rank(List<IdiomMatch> matches, String phrase) {
    String p = sanitizePhrase(phrase).toLowerCase(Locale.ROOT);
    List<IdiomMatch> exact = new ArrayList<>();
    List<IdiomMatch> contains = new ArrayList<>();
    List<IdiomMatch> rest = new ArrayList<>();
    for (IdiomMatch m : matches) {
      String t = sanitizePhrase(m.idiomText()).toLowerCase(Locale.ROOT);
      if (t.equals(p)) exact.add(m);
      else if (t.contains(p)) contains.add(m);
      else rest.add(m);
    }
    List<IdiomMatch> out = new ArrayList<>(matches.size());
    out.addAll(exact);
    out.addAll(contains);
    out.addAll(rest);
    return out;
  }

  static <T> List<T> slice(List<T> all, int page, int perPage) {
    long from = (long) (page - 1) * perPage;
    if (from >= all.size()) return List.of();
    int to = (int) Math.min(all.size(), from + perPage);
    return List.copyOf(all.subList((int) from, to));
  }

  private static void checkPaging(int page, int perPage, int max) {
    if (page < 1) throw new InvalidInputException("page must be >= 1");
    if (perPage < 1 || perPage > max) {
      throw new InvalidInputException("per_page must be between 1 and " + max);
    }
  }

  private static List<String> wellFormed(List<String> ids) {
    return ids.stream().filter(Identifiers::isWellFormed).distinct().toList();
  }

  private static String blankToNull(String s) {
    return s == null || s.isBlank() ? null : s.trim();
  }
}
