package com.wordvault.interfaces.rest;

import com.wordvault.application.LexiconService;
import com.wordvault.application.QueryService;
import com.wordvault.domain.IngestPayload;
import com.wordvault.domain.LexicalRecord;
import com.wordvault.dto.ErrorMessage;
import com.wordvault.dto.IdiomSearchResponse;
import com.wordvault.dto.RecordListResponse;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class LexiconController {
  private final LexiconService lexicon;
  private final QueryService query;

  public LexiconController(LexiconService lexicon, QueryService query) {
    this.lexicon = lexicon;
    this.query = query;
  }

  @GetMapping("/lookup")
  public ResponseEntity<?> lookup(@RequestParam(name = "word", required = false) String word) {
    return lexicon
        .lookup(word)
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(() -> notFound("Word not found"));
  }

  /** Prefix search by default; {@code type=idiom} switches to idiom search. */
  @GetMapping("/search")
  public Object search(
      @RequestParam(name = "q", required = false) String q,
      @RequestParam(name = "page", defaultValue = "1") int page,
      @RequestParam(name = "per_page", defaultValue = "100") int perPage,
      @RequestParam(name = "type", defaultValue = "word") String type) {
    if ("idiom".equalsIgnoreCase(type)) {
      return query.searchIdioms(q, page, perPage);
    }
    return query.searchPrefix(q, page, perPage);
  }

  @GetMapping("/search/idioms")
  public IdiomSearchResponse searchIdioms(
      @RequestParam(name = "q", required = false) String q,
      @RequestParam(name = "page", defaultValue = "1") int page,
      @RequestParam(name = "per_page", defaultValue = "100") int perPage) {
    return query.searchIdioms(q, page, perPage);
  }

  @GetMapping("/words")
  public RecordListResponse list(
      @RequestParam(name = "page", defaultValue = "1") int page,
      @RequestParam(name = "per_page", defaultValue = "100") int perPage,
      @RequestParam(name = "q", required = false) String q,
      @RequestParam(name = "symbol", required = false) String symbol,
      @RequestParam(name = "pos", required = false) String pos) {
    return query.list(page, perPage, q, symbol, pos);
  }

  /** Stored record for a word; never scrapes. */
  @GetMapping("/words/{word}")
  public ResponseEntity<?> record(@PathVariable("word") String word) {
    return lexicon
        .find(word)
        .<ResponseEntity<?>>map(ResponseEntity::ok)
        .orElseGet(() -> notFound("Word not stored"));
  }

  @GetMapping("/parts-of-speech")
  public List<String> partsOfSpeech() {
    return query.partsOfSpeech();
  }

  @PostMapping("/ingest")
  public LexicalRecord ingest(@RequestBody IngestPayload payload) {
    return lexicon.ingest(payload);
  }

  private static ResponseEntity<?> notFound(String message) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ErrorMessage(ErrorMessage.TYPE_NOT_FOUND, message));
  }
}
