package com.wordvault.infrastructure;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks the stored JSON of a record's entry list and patches nested fields in place.
 *
 * <p>Senses live in three parallel places: {@code entries[*].senses[*]},
 * {@code entries[*].idioms[*].senses[*]} and {@code entries[*].phrasalVerbSenses[*]}. Any of the
 * arrays may be missing in documents written by older versions; a missing array is treated as
 * empty.
 */
final class NestedDocuments {
  static final String ID = "id";
  static final String SENSES = "senses";
  static final String IDIOMS = "idioms";
  static final String PHRASAL_VERB_SENSES = "phrasalVerbSenses";
  static final String EXAMPLES = "examples";
  static final String TRANSLATED_TEXT = "translatedText";
  static final String DEFINITION_TRANSLATED = "definitionTranslated";
  static final String DEFINITION_TRANSLATED_SHORT = "definitionTranslatedShort";

  private NestedDocuments() {}

  /** Every sense object reachable from an entry array, in document order per location. */
  static List<ObjectNode> senses(JsonNode entries) {
    List<ObjectNode> out = new ArrayList<>();
    for (JsonNode entry : entries) {
      addObjects(entry.path(SENSES), out);
      for (JsonNode idiom : entry.path(IDIOMS)) {
        addObjects(idiom.path(SENSES), out);
      }
      addObjects(entry.path(PHRASAL_VERB_SENSES), out);
    }
    return out;
  }

  static List<ObjectNode> examples(JsonNode entries) {
    List<ObjectNode> out = new ArrayList<>();
    for (ObjectNode sense : senses(entries)) {
      addObjects(sense.path(EXAMPLES), out);
    }
    return out;
  }

  /**
   * Set {@code translatedText} on every example with the given id whose translation is empty.
   *
   * @return number of examples modified
   */
  static int fillExample(JsonNode entries, String exampleId, String text) {
    int n = 0;
    for (ObjectNode ex : examples(entries)) {
      if (exampleId.equals(ex.path(ID).asText()) && isEmpty(ex.get(TRANSLATED_TEXT))) {
        ex.put(TRANSLATED_TEXT, text);
        n++;
      }
    }
    return n;
  }

  /**
   * Set the given definition translations on every sense with the given id, each field only
   * where it is currently empty. Null arguments are left alone.
   *
   * @return number of senses with at least one field modified
   */
  static int fillSense(JsonNode entries, String senseId, String definition, String shortDef) {
    int n = 0;
    for (ObjectNode sense : senses(entries)) {
      if (!senseId.equals(sense.path(ID).asText())) continue;
      boolean touched = fillIfEmpty(sense, DEFINITION_TRANSLATED, definition);
      touched |= fillIfEmpty(sense, DEFINITION_TRANSLATED_SHORT, shortDef);
      if (touched) n++;
    }
    return n;
  }

  static boolean isEmpty(JsonNode field) {
    return field == null || field.isNull() || field.asText("").isBlank();
  }

  private static boolean fillIfEmpty(ObjectNode node, String field, String value) {
    if (value == null || !isEmpty(node.get(field))) return false;
    node.put(field, value);
    return true;
  }

  private static void addObjects(JsonNode array, List<ObjectNode> out) {
    if (!array.isArray()) return;
    for (JsonNode n : array) {
      if (n instanceof ObjectNode o) out.add(o);
    }
  }
}
