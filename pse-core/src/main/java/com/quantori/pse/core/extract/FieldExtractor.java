package com.quantori.pse.core.extract;

import com.quantori.pse.api.model.PlasmidAttribute;
import com.quantori.pse.core.retry.RetryPolicy;
import com.quantori.pse.core.vendor.VendorProfile;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;

/**
 * Evaluates the field rules of a vendor profile against a detail page. Each field is extracted on
 * its own: a missing label or a value that does not parse leaves that one attribute absent and
 * never fails the record.
 */
@Slf4j
public class FieldExtractor {
  private final RetryPolicy retryPolicy;

  public FieldExtractor(RetryPolicy retryPolicy) {
    this.retryPolicy = retryPolicy;
  }

  public Optional<String> extractName(int id, VendorProfile profile, Document detail) {
    return guarded(id, "name", () -> profile.name(detail));
  }

  public Map<PlasmidAttribute, String> extractAttributes(int id, VendorProfile profile, Document detail) {
    Map<PlasmidAttribute, String> values = new EnumMap<>(PlasmidAttribute.class);
    profile.fieldRules().forEach((attribute, rule) ->
        extract(id, profile, detail, rule).ifPresent(value -> values.put(attribute, value)));
    return values;
  }

  public Optional<Integer> extractSize(int id, VendorProfile profile, Document detail) {
    return extract(id, profile, detail, profile.sizeRule()).flatMap(value -> parseSize(id, value));
  }

  Optional<String> extract(int id, VendorProfile profile, Document detail, FieldRule rule) {
    return guarded(id, rule.label(), () -> rule.apply(detail, profile.fieldSelector()));
  }

  private Optional<String> guarded(int id, String field, Supplier<Optional<String>> step) {
    try {
      Optional<String> value = retryPolicy.execute("'" + field + "' of plasmid " + id, step);
      if (value.isEmpty()) {
        log.debug("Plasmid {} has no '{}'", id, field);
      }
      return value;
    } catch (RuntimeException e) {
      log.warn("Could not extract '{}' of plasmid {}: {}", field, id, e.getMessage());
      return Optional.empty();
    }
  }

  private static Optional<Integer> parseSize(int id, String value) {
    String digits = StringUtils.remove(value, ',');
    try {
      return Optional.of(Integer.parseInt(digits));
    } catch (NumberFormatException e) {
      log.debug("Size '{}' of plasmid {} is not a number", value, id);
      return Optional.empty();
    }
  }
}
