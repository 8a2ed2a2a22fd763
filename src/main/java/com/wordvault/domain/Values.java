package com.wordvault.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Null-to-empty coercions shared by the document records. */
final class Values {
  private Values() {}

  static String text(String s) {
    return s == null ? "" : s;
  }

  static <T> List<T> list(List<T> in) {
    if (in == null || in.isEmpty()) return List.of();
    List<T> out = new ArrayList<>(in.size());
    for (T t : in) {
      if (t != null) out.add(t);
    }
    return Collections.unmodifiableList(out);
  }

  static List<String> strings(List<String> in) {
    if (in == null || in.isEmpty()) return List.of();
    return in.stream().filter(Objects::nonNull).toList();
  }
}
