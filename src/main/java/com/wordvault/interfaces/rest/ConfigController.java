package com.wordvault.interfaces.rest;

import com.wordvault.application.PageSequencer;
import com.wordvault.application.QueryService;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ConfigController {
  private final PageSequencer sequencer;
  private final QueryService query;

  public ConfigController(PageSequencer sequencer, QueryService query) {
    this.sequencer = sequencer;
    this.query = query;
  }

  @GetMapping("/config")
  public Map<String, Object> config() {
    return Map.of(
        "maxPages", sequencer.maxPages(),
        "requestDelayMs", sequencer.delayMs(),
        "maxPerPage", query.maxPerPage(),
        "protocolVersion", 1);
  }
}
