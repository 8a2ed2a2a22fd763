package com.wordvault.application;

import com.wordvault.domain.Entry;
import com.wordvault.domain.IngestPayload;
import com.wordvault.domain.LexicalRecord;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Canonical keys and record merging.
 *
 * <p>All methods are pure: they never touch the store. Atomicity of a merge against concurrent
 * writers is the store's job (see {@link com.wordvault.application.port.LexicalStore#update}).
 */
@Component
public class Canonicalizer {
  private static final Logger log = LoggerFactory.getLogger(Canonicalizer.class);

  /** CEFR levels in the order they win when several entries carry a symbol. */
  static final List<String> SYMBOL_PRIORITY = List.of("a1", "a2", "b1", "b2", "c1");

  private static final Pattern NOT_KEY_CHAR = Pattern.compile("[^A-Za-z\\s-]+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern HYPHENS = Pattern.compile("-{2,}");
  private static final Pattern EDGES = Pattern.compile("^[\\s-]+|[\\s-]+$");

  /**
   * Reduce a raw spelling to its canonical key: letters, single spaces and single inner hyphens,
   * lower-cased. {@code normalize(normalize(s)).equals(normalize(s))} holds for every input.
   *
   * @param raw spelling (may be null)
   * @return canonical key, empty if nothing survives
   */
  public String normalize(String raw) {
    if (raw == null) return "";
    String s = NOT_KEY_CHAR.matcher(raw).replaceAll("");
    s = WHITESPACE.matcher(s).replaceAll(" ");
    s = HYPHENS.matcher(s).replaceAll("-");
    s = EDGES.matcher(s).replaceAll("");
    return s.toLowerCase(Locale.ROOT);
  }

  /**
   * The hyphen/space twin of a canonical key: {@code "take-care"} for {@code "take care"} and
   * back. Empty for single words.
   */
  public String counterpart(String key) {
    if (key == null) return "";
    if (key.contains("-")) return normalize(key.replace('-', ' '));
    if (key.contains(" ")) return key.replace(' ', '-');
    return "";
  }

  /**
   * Canonical key for a payload: the first entry's headword, or the requested term when the
   * payload carries no entries.
   */
  public String keyFor(IngestPayload payload) {
    for (Entry e : payload.entries()) {
      String k = normalize(e.headword());
      if (!k.isEmpty()) return k;
    }
    return normalize(payload.term());
  }

  /**
   * Spellings that produced a set of entries: each headword as printed and in canonical form,
   * plus the requested term, in first-seen order.
   */
  public List<String> spellingsOf(String term, List<Entry> entries) {
    Set<String> out = new LinkedHashSet<>();
    for (Entry e : entries) {
      String raw = e.headword().trim();
      String norm = normalize(raw);
      if (!norm.isEmpty()) out.add(norm);
      if (!raw.isEmpty()) out.add(raw);
    }
    if (term != null && !term.isBlank()) out.add(term.trim());
    return new ArrayList<>(out);
  }

  /**
   * Highest-priority CEFR symbol across entries; if none is a known level, the first non-empty
   * symbol; otherwise empty.
   */
  public String deriveSymbol(List<Entry> entries) {
    List<String> found = new ArrayList<>();
    for (Entry e : entries) {
      String s = e.symbol().trim();
      if (!s.isEmpty()) found.add(s);
    }
    for (String level : SYMBOL_PRIORITY) {
      if (found.contains(level)) return level;
    }
    return found.isEmpty() ? "" : found.get(0);
  }

  /** Sorted, de-duplicated, non-empty parts of speech. */
  public List<String> derivePartsOfSpeech(List<Entry> entries) {
    Set<String> out = new TreeSet<>();
    for (Entry e : entries) {
      String p = e.partOfSpeech().trim();
      if (!p.isEmpty()) out.add(p);
    }
    return List.copyOf(out);
  }

  /**
   * Merge freshly scraped entries into the stored record for their key.
   *
   * <p>Entries whose trimmed headword is already present (exact, case-sensitive) are skipped,
   * as are entries and spellings that do not canonicalize to the record key. Stored entries keep
   * their order and their sense/example ids; new ones are appended. Symbol and parts of speech
   * are recomputed over the merged list.
   *
   * @param existing stored record, or null if the key is new
   * @param payload new entries and the spellings that produced them
   * @return the record to persist; timestamps are carried over from {@code existing}
   */
  public LexicalRecord merge(LexicalRecord existing, IngestPayload payload) {
    String key = existing != null ? existing.key() : keyFor(payload);
    if (key.isEmpty()) {
      throw new InvalidInputException("No canonical key for '" + payload.term() + "'");
    }

    List<Entry> entries = new ArrayList<>(existing != null ? existing.entries() : List.of());
    Set<String> seen = new LinkedHashSet<>();
    entries.forEach(e -> seen.add(e.headword().trim()));

    int appended = 0;
    for (Entry e : payload.entries()) {
      String h = e.headword().trim();
      if (!key.equals(normalize(h))) {
        log.warn("Dropping entry '{}': does not canonicalize to '{}'", h, key);
        continue;
      }
      if (seen.add(h)) {
        entries.add(e);
        appended++;
      }
    }

    Set<String> variants = new LinkedHashSet<>(existing != null ? existing.variants() : Set.of());
    for (String v : payload.variants()) {
      String t = v.trim();
      if (!t.isEmpty() && key.equals(normalize(t))) variants.add(t);
    }

    log.debug("Merge into '{}': {} new entr{}, {} variants", key, appended,
        appended == 1 ? "y" : "ies", variants.size());
    return new LexicalRecord(
        key,
        entries,
        variants,
        deriveSymbol(entries),
        derivePartsOfSpeech(entries),
        existing != null ? existing.createdAt() : null,
        existing != null ? existing.updatedAt() : null);
  }
}
