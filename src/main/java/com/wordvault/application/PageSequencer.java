package com.wordvault.application;

import com.wordvault.application.port.EntryExtractor;
import com.wordvault.application.port.PageFetcher;
import com.wordvault.domain.Entry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Walks the numbered source pages of a word ({@code <base><slug>_1}, {@code _2}, ...) and
 * extracts one entry per page.
 *
 * <p>Each fetch is preceded by a fixed delay to stay under the source's rate limit. The walk ends
 * quietly at the first page without a headword; a {@link FetchException} from any page aborts the
 * whole walk and the entries collected so far are discarded. The delay blocks only the calling
 * request thread.
 */
@Service
public class PageSequencer {
  private static final Logger log = LoggerFactory.getLogger(PageSequencer.class);

  private final PageFetcher fetcher;
  private final EntryExtractor extractor;
  private final String baseUrl;
  private final int maxPages;
  private final long delayMs;

  public PageSequencer(
      PageFetcher fetcher,
      EntryExtractor extractor,
      @Value("${wordvault.source-base-url}") String baseUrl,
      @Value("${wordvault.max-pages:5}") int maxPages,
      @Value("${wordvault.request-delay-ms:400}") long delayMs) {
    this.fetcher = fetcher;
    this.extractor = extractor;
    this.baseUrl = baseUrl;
    this.maxPages = maxPages;
    this.delayMs = delayMs;
  }

  public int maxPages() {
    return maxPages;
  }

  public long delayMs() {
    return delayMs;
  }

  /** Collect entries for {@code term} using the configured page limit. */
  public List<Entry> collect(String term) {
    return collect(term, maxPages);
  }

  /**
   * Collect entries for {@code term} from at most {@code pages} numbered pages.
   *
   * @param term normalized search term
   * @param pages maximum number of pages to try
   * @return entries in page order, possibly empty
   * @throws FetchException if any page fails to load
   */
  public List<Entry> collect(String term, int pages) {
    String slug = slug(term);
    List<Entry> entries = new ArrayList<>();
    for (int i = 1; i <= pages; i++) {
      String url = pageUrl(slug, i);
      pause();
      Optional<String> markup = fetcher.fetch(url);
      Optional<Entry> entry = markup.flatMap(m -> extractor.extract(m, url));
      if (entry.isEmpty()) {
        log.debug("No headword at {}; stopping after {} page(s)", url, i - 1);
        break;
      }
      entries.add(entry.get());
    }
    log.info("Collected {} entr{} for '{}'", entries.size(),
        entries.size() == 1 ? "y" : "ies", term);
    return entries;
  }

  /** Address of the {@code n}-th candidate page for a slug. */
  String pageUrl(String slug, int n) {
    return baseUrl + slug + "_" + n;
  }

  /** URL slug: trimmed, lower-cased, whitespace runs replaced by a hyphen. */
  static String slug(String term) {
    return term.trim().replaceAll("\\s+", "-").toLowerCase(Locale.ROOT);
  }

  private void pause() {
    if (delayMs <= 0) return;
    try {
      Thread.sleep(delayMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FetchException("Interrupted while waiting between page requests", e);
    }
  }
}
