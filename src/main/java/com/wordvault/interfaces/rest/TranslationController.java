package com.wordvault.interfaces.rest;

import com.wordvault.application.QueryService;
import com.wordvault.domain.ExampleTranslation;
import com.wordvault.domain.SenseTranslation;
import com.wordvault.dto.BackfillResult;
import com.wordvault.dto.ExampleBackfillRequest;
import com.wordvault.dto.IdsRequest;
import com.wordvault.dto.SenseBackfillRequest;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** Out-of-band translation read-back and fill-if-empty writes, keyed by sense/example id. */
@RestController
public class TranslationController {
  private final QueryService query;

  public TranslationController(QueryService query) {
    this.query = query;
  }

  @PostMapping("/examples/translations")
  public List<ExampleTranslation> exampleTranslations(@Valid @RequestBody IdsRequest req) {
    return query.exampleTranslations(req.ids());
  }

  @PostMapping("/examples/translations/update")
  public BackfillResult backfillExamples(@Valid @RequestBody ExampleBackfillRequest req) {
    return query.backfillExamples(req.updates());
  }

  @PostMapping("/senses/translations")
  public List<SenseTranslation> senseTranslations(@Valid @RequestBody IdsRequest req) {
    return query.senseTranslations(req.ids());
  }

  @PostMapping("/senses/translations/update")
  public BackfillResult backfillSenses(@Valid @RequestBody SenseBackfillRequest req) {
    return query.backfillSenses(req.updates());
  }
}
