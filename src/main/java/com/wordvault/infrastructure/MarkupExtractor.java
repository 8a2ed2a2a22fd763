package com.wordvault.infrastructure;

import com.wordvault.application.port.EntryExtractor;
import com.wordvault.domain.Entry;
import com.wordvault.domain.Example;
import com.wordvault.domain.Identifiers;
import com.wordvault.domain.Idiom;
import com.wordvault.domain.Phonetics;
import com.wordvault.domain.PhrasalVerbRef;
import com.wordvault.domain.Sense;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

/**
 * Builds an {@link Entry} from one learner's-dictionary entry page.
 *
 * <p>Extraction is a CSS-selector walk over the parsed page. Missing optional blocks yield empty
 * strings and empty lists; a sense without a definition is dropped. Every sense and example gets
 * a fresh id here, and that id is never regenerated afterwards.
 */
@Component
public class MarkupExtractor implements EntryExtractor {
  private static final String PREFIX_SYNONYM = "synonym";
  private static final String PREFIX_OPPOSITE = "opposite";
  private static final String PREFIX_SEE_ALSO = "see also";

  @Override
  public Optional<Entry> extract(String markup, String pageUrl) {
    Document doc = Jsoup.parse(markup == null ? "" : markup, pageUrl == null ? "" : pageUrl);
    Element h1 = doc.selectFirst("h1.headword");
    if (h1 == null || h1.text().isBlank()) return Optional.empty();

    Elements headSiblings = h1.siblingElements();
    Element headSymbols = first(headSiblings, "div.symbols");

    Entry entry =
        new Entry(
            h1.text(),
            text(doc.selectFirst("span.pos")),
            headSymbols == null ? "" : symbolOf(headSymbols.selectFirst("span")),
            phonetics(doc, "div.phons_br"),
            phonetics(doc, "div.phons_n_am"),
            text(first(headSiblings, "span.grammar")),
            text(first(headSiblings, "span.labels")),
            text(first(headSiblings, "div.variants")),
            senses(doc),
            idioms(doc),
            phrasalVerbs(doc),
            phrasalVerbSenses(doc));
    return Optional.of(entry);
  }

  private static Phonetics phonetics(Document doc, String block) {
    Element sound = doc.selectFirst(block + " div.sound");
    return new Phonetics(
        sound == null ? "" : sound.attr("data-src-mp3"),
        text(doc.selectFirst(block + " span.phon")));
  }

  /** Senses of the entry proper: not inside idiom, phrasal-verb or collapsed extra blocks. */
  private static List<Sense> senses(Document doc) {
    List<Sense> out = new ArrayList<>();
    for (Element li : doc.select("li.sense")) {
      if (li.closest(".idioms") != null
          || li.closest(".collapse") != null
          || li.closest(".pv-g") != null) {
        continue;
      }
      Sense s = sense(li);
      if (s != null) out.add(s);
    }
    return out;
  }

  private static List<Idiom> idioms(Document doc) {
    List<Idiom> out = new ArrayList<>();
    for (Element idm : doc.select("div.idioms span.idm-g")) {
      List<Sense> senses = new ArrayList<>();
      for (Element li : idm.select("li.sense")) {
        Sense s = sense(li);
        if (s != null) senses.add(s);
      }
      out.add(
          new Idiom(
              text(idm.selectFirst("span.idm")),
              text(outsideVariants(idm.select(".webtop span.labels"))),
              text(idm.selectFirst(".webtop div.variants")),
              senses));
    }
    return out;
  }

  private static List<Sense> phrasalVerbSenses(Document doc) {
    List<Sense> out = new ArrayList<>();
    for (Element li : doc.select("span.pv-g li.sense")) {
      Sense s = sense(li);
      if (s != null) out.add(s);
    }
    return out;
  }

  private static List<PhrasalVerbRef> phrasalVerbs(Document doc) {
    List<PhrasalVerbRef> out = new ArrayList<>();
    for (Element li : doc.select(".phrasal_verb_links ul.pvrefs li")) {
      Element a = li.selectFirst("a");
      if (a == null) continue;
      String link = a.absUrl("href");
      out.add(new PhrasalVerbRef(a.text(), link.isEmpty() ? a.attr("href") : link));
    }
    return out;
  }

  /** One {@code li.sense}, or null if it carries no definition. */
  private static Sense sense(Element li) {
    Element def = li.selectFirst("span.def");
    if (def == null || def.text().isBlank()) return null;

    List<String> synonyms = new ArrayList<>();
    List<String> opposites = new ArrayList<>();
    List<String> seeAlsos = new ArrayList<>();
    for (Element xr : li.select("span.xrefs")) {
      List<String> target =
          switch (text(xr.selectFirst("span.prefix"))) {
            case PREFIX_SYNONYM -> synonyms;
            case PREFIX_OPPOSITE -> opposites;
            case PREFIX_SEE_ALSO -> seeAlsos;
            default -> null;
          };
      if (target == null) continue;
      for (Element a : xr.select("a")) target.add(a.text());
    }

    List<Example> examples = new ArrayList<>();
    for (Element ex : li.select("ul.examples li")) {
      if (ex.closest(".collapse") != null) continue;
      String cf = text(ex.selectFirst("span.cf"));
      String labels = text(outsideVariants(ex.select("span.labels")));
      String x = text(ex.selectFirst("span.x"));
      if (cf.isEmpty() && labels.isEmpty() && x.isEmpty()) continue;
      examples.add(new Example(Identifiers.newId(), cf, labels, x, ""));
    }

    Element symbol = senseTop(li, "div.symbols span");
    return new Sense(
        Identifiers.newId(),
        def.text(),
        "",
        "",
        symbol == null ? "" : symbolOf(symbol),
        text(senseTop(li, "span.labels")),
        text(senseTop(li, "span.dis-g")),
        text(senseTop(li, "span.grammar")),
        text(senseTop(li, "span.cf")),
        text(senseTop(li, "div.variants")),
        synonyms,
        opposites,
        seeAlsos,
        examples);
  }

  /**
   * Sense-level tag: inside or after the sense's {@code .sensetop} header, falling back to a direct
   * child of the sense for pages without a header.
   */
  private static Element senseTop(Element li, String query) {
    Elements hits = li.select(".sensetop > " + query + ", .sensetop ~ " + query);
    if (hits.isEmpty()) hits = li.select("> " + query);
    if (query.startsWith("div.variants")) return hits.first();
    return outsideVariants(hits);
  }

  /** First element not nested in a {@code .variants} block. */
  private static Element outsideVariants(Elements els) {
    for (Element el : els) {
      if (el.closest(".variants") == null) return el;
    }
    return null;
  }

  private static Element first(Elements els, String query) {
    for (Element el : els) {
      if (el.is(query)) return el;
    }
    return null;
  }

  /** CEFR level from a symbol class such as {@code ox3ksym_a1}. */
  private static String symbolOf(Element span) {
    if (span == null) return "";
    String[] parts = span.className().split("_");
    return parts.length > 1 ? parts[1].trim().split("\\s+")[0] : "";
  }

  private static String text(Element el) {
    return el == null ? "" : el.text();
  }
}
