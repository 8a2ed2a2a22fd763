package com.wordvault.application;

import com.wordvault.application.port.LexicalStore;
import com.wordvault.domain.Entry;
import com.wordvault.domain.IngestPayload;
import com.wordvault.domain.LexicalRecord;
import com.wordvault.dto.LookupResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Word lookup and ingestion.
 *
 * <p>Lookup flow: validate the term, compute its canonical key, serve from the store on a hit;
 * otherwise scrape the numbered source pages, merge the result into the store and return the
 * merged record. A key also hits the record stored under its hyphen/space twin, so
 * {@code take-care} finds {@code take care}. Scraping happens outside any store lock; only the
 * final merge is atomic.
 */
@Service
public class LexiconService {
  private static final Logger log = LoggerFactory.getLogger(LexiconService.class);

  /** Letters, whitespace and hyphens only. */
  private static final Pattern TERM = Pattern.compile("^[A-Za-z\\s-]+$");

  private final LexicalStore store;
  private final PageSequencer sequencer;
  private final Canonicalizer canonicalizer;

  public LexiconService(LexicalStore store, PageSequencer sequencer, Canonicalizer canonicalizer) {
    this.store = store;
    this.sequencer = sequencer;
    this.canonicalizer = canonicalizer;
  }

  /**
   * Look up a word, scraping and persisting it if the store does not know it yet.
   *
   * @param word raw term from the caller
   * @return the record's entries, or empty if scraping produced no entry
   * @throws InvalidInputException if the term is empty or contains anything but letters, spaces
   *     and hyphens
   * @throws FetchException if a source page could not be fetched; nothing is persisted
   */
  public Optional<LookupResponse> lookup(String word) {
    String term = validateTerm(word);
    String key = canonicalizer.normalize(term);
    if (key.isEmpty()) throw new InvalidInputException("Invalid word format");

    Optional<LexicalRecord> stored = findStored(key, term);
    if (stored.isPresent()) {
      log.debug("Lookup '{}' served from store as '{}'", term, stored.get().key());
      return stored.map(r -> response(r, LookupResponse.SOURCE_STORE));
    }

    List<Entry> entries = sequencer.collect(key);
    if (entries.isEmpty()) {
      log.info("Lookup '{}': no entries at source", term);
      return Optional.empty();
    }

    IngestPayload payload =
        new IngestPayload(key, entries, canonicalizer.spellingsOf(term, entries));
    LexicalRecord merged = merge(payload);
    return Optional.of(response(merged, LookupResponse.SOURCE_SCRAPED));
  }

  /**
   * Merge externally supplied entries into the store. Senses and examples without an id get one.
   *
   * @throws InvalidInputException if neither the entries nor the term yield a canonical key
   */
  public LexicalRecord ingest(IngestPayload payload) {
    List<Entry> entries = payload.entries().stream().map(Entry::withIdsAssigned).toList();
    List<String> variants = new ArrayList<>(payload.variants());
    variants.addAll(canonicalizer.spellingsOf(payload.term(), entries));
    return merge(new IngestPayload(payload.term(), entries, variants));
  }

  /** Find a stored record by term without scraping. */
  public Optional<LexicalRecord> find(String word) {
    String term = validateTerm(word);
    return findStored(canonicalizer.normalize(term), term);
  }

  /** Record for the key or a known spelling, else the record under the key's hyphen/space twin. */
  private Optional<LexicalRecord> findStored(String key, String term) {
    Optional<LexicalRecord> stored = store.findByWord(key, term);
    if (stored.isPresent()) return stored;
    String twin = canonicalizer.counterpart(key);
    return twin.isEmpty() ? Optional.empty() : store.findByKey(twin);
  }

  private LexicalRecord merge(IngestPayload payload) {
    String key = canonicalizer.keyFor(payload);
    if (key.isEmpty()) {
      throw new InvalidInputException("No canonical key for '" + payload.term() + "'");
    }
    return store.update(key, existing -> canonicalizer.merge(existing, payload));
  }

  private static LookupResponse response(LexicalRecord r, String source) {
    return new LookupResponse(
        r.key(), r.entries().size(), r.entries(), List.copyOf(r.variants()), source);
  }

  /**
   * Trimmed term if it is non-empty and made of letters, spaces and hyphens.
   *
   * @throws InvalidInputException otherwise
   */
  static String validateTerm(String word) {
    if (word == null || word.isBlank()) {
      throw new InvalidInputException("Word parameter is required");
    }
    String term = word.trim();
    if (!TERM.matcher(term).matches()) {
      throw new InvalidInputException("Invalid word format");
    }
    return term;
  }
}
