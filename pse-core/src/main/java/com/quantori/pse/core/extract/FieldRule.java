package com.quantori.pse.core.extract;

import java.util.Arrays;
import java.util.Optional;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Element;

/**
 * Locates a labeled field and turns its text into a value: the label tokens are dropped, so are
 * {@code trailingTokens} tokens at the end (a link or a unit printed after the value), the rest is
 * joined by single spaces.
 *
 * @param label          exact text of the label element
 * @param trailingTokens number of tokens to drop at the end of the field
 */
public record FieldRule(String label, int trailingTokens) {

  public FieldRule(String label) {
    this(label, 0);
  }

  public FieldRule {
    if (StringUtils.isBlank(label)) {
      throw new IllegalArgumentException("Field label must not be blank");
    }
    if (trailingTokens < 0) {
      throw new IllegalArgumentException("trailingTokens must not be negative: " + trailingTokens);
    }
  }

  /**
   * @param document      page to search
   * @param fieldSelector selector of the elements holding a label and its content
   * @return the value, empty when the label is missing or nothing is left after trimming
   */
  public Optional<String> apply(Element document, String fieldSelector) {
    Pattern labelPattern = Pattern.compile("^\\s*" + Pattern.quote(label) + "\\s*$");
    for (Element field : document.select(fieldSelector)) {
      if (!field.getElementsMatchingOwnText(labelPattern).isEmpty()) {
        return value(field.text());
      }
    }
    return Optional.empty();
  }

  Optional<String> value(String fieldText) {
    String text = StringUtils.normalizeSpace(fieldText.replace('\u00a0', ' '));
    String content = text.startsWith(label)
        ? text.substring(label.length())
        : StringUtils.replaceOnce(text, label, "");
    content = StringUtils.stripStart(content, ": ");
    String[] tokens = StringUtils.split(content);
    int end = tokens.length - trailingTokens;
    if (end <= 0) {
      return Optional.empty();
    }
    return Optional.of(String.join(" ", Arrays.copyOfRange(tokens, 0, end)));
  }
}
