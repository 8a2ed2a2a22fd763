package com.wordvault.domain;

import java.util.UUID;
import java.util.regex.Pattern;

/** Opaque sense/example identifiers: random UUIDs in canonical textual form. */
public final class Identifiers {
  private static final Pattern WELL_FORMED =
      Pattern.compile(
          "^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$",
          Pattern.CASE_INSENSITIVE);

  private Identifiers() {}

  public static String newId() {
    return UUID.randomUUID().toString();
  }

  public static boolean isWellFormed(String id) {
    return id != null && WELL_FORMED.matcher(id).matches();
  }
}
