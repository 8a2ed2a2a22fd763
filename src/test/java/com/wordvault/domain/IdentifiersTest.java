package com.wordvault.domain;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IdentifiersTest {

  @Test
  @DisplayName("Fresh ids are well-formed and distinct")
  void testNewId() {
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < 100; i++) {
      String id = Identifiers.newId();
      assertTrue(Identifiers.isWellFormed(id), id);
      assertTrue(seen.add(id));
    }
  }

  @Test
  @DisplayName("Only canonical UUID text is accepted")
  void testIsWellFormed() {
    assertTrue(Identifiers.isWellFormed("3F2504E0-4F89-11D3-9A0C-0305E82C3301"));
    assertFalse(Identifiers.isWellFormed(null));
    assertFalse(Identifiers.isWellFormed(""));
    assertFalse(Identifiers.isWellFormed("3f2504e04f8911d39a0c0305e82c3301"));
    assertFalse(Identifiers.isWellFormed("3f2504e0-4f89-11d3-9a0c-0305e82c330"));
    assertFalse(Identifiers.isWellFormed("' OR 1=1 --"));
  }
}
