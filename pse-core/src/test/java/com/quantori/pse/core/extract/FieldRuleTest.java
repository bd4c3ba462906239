package com.quantori.pse.core.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

class FieldRuleTest {

  @Test
  void dropsLabelAndTrailingTokens() {
    FieldRule rule = new FieldRule("Vector backbone", 3);

    assertEquals(Optional.of("pUC19"), rule.value("Vector backbone pUC19 (Search Vector Database)"));
  }

  @Test
  void collapsesWhitespace() {
    FieldRule rule = new FieldRule("Growth instructions");

    assertEquals(Optional.of("Grow at 30 C overnight"),
        rule.value("Growth instructions \n   Grow at 30 C\t overnight  "));
  }

  @Test
  void valueShorterThanTrimIsAbsent() {
    FieldRule rule = new FieldRule("Vector backbone", 3);

    assertEquals(Optional.empty(), rule.value("Vector backbone (Search Vector Database)"));
    assertEquals(Optional.empty(), new FieldRule("Copy number").value("Copy number"));
  }

  @Test
  void matchesWholeLabelOnly() {
    Document document = Jsoup.parse("<ul>"
        + "<li class='field'><div>Vector type extra</div><div>wrong</div></li>"
        + "<li class='field'><div>Vector type</div><div>Mammalian Expression</div></li>"
        + "</ul>");

    assertEquals(Optional.of("Mammalian Expression"), new FieldRule("Vector type").apply(document, "li.field"));
  }

  @Test
  void labelWithRegexCharactersIsMatchedLiterally() {
    Document document = Jsoup.parse(
        "<ul><li class='field'><div>Bacterial Resistance(s)</div><div>Kanamycin</div></li></ul>");

    assertEquals(Optional.of("Kanamycin"),
        new FieldRule("Bacterial Resistance(s)").apply(document, "li.field"));
  }

  @Test
  void missingLabelIsAbsent() {
    Document document = Jsoup.parse("<ul><li class='field'><div>Vector type</div><div>x</div></li></ul>");

    assertTrue(new FieldRule("Copy number").apply(document, "li.field").isEmpty());
  }

  @Test
  void rejectsInvalidRules() {
    assertThrows(IllegalArgumentException.class, () -> new FieldRule(" "));
    assertThrows(IllegalArgumentException.class, () -> new FieldRule("Copy number", -1));
  }
}
