package com.quantori.pse.core.extract;

import java.util.Optional;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * Reads the sequence length from the header line of a GenBank file, i.e.
 * {@code LOCUS  pUC19  2686 bp  DNA  circular}.
 */
@UtilityClass
public class SequenceHeader {
  private static final int LENGTH_TOKEN = 2;

  public static Optional<Integer> length(String sequenceFile) {
    if (StringUtils.isBlank(sequenceFile)) {
      return Optional.empty();
    }
    String firstLine = sequenceFile.lines().findFirst().orElse("");
    String[] tokens = StringUtils.split(firstLine);
    if (tokens.length <= LENGTH_TOKEN || !NumberUtils.isDigits(tokens[LENGTH_TOKEN])) {
      return Optional.empty();
    }
    try {
      return Optional.of(Integer.parseInt(tokens[LENGTH_TOKEN]));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }
}
