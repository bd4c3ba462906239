package com.quantori.pse.storage.file;

import com.quantori.pse.api.SinkException;
import com.quantori.pse.api.model.Plasmid;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/** Reads back records written by {@link CsvPlasmidWriter}. Empty cells become absent values. */
public class CsvPlasmidReader {
  private final PlasmidPaths paths;

  public CsvPlasmidReader(Path root) {
    this.paths = new PlasmidPaths(root);
  }

  /** @return empty if no record with this name was written */
  public Optional<Plasmid> read(String plasmidName) {
    Path csvFile = paths.csvFile(plasmidName);
    if (!Files.isRegularFile(csvFile)) {
      return Optional.empty();
    }
    try {
      var row = CsvRowMapper.toPlasmidRow(Files.readString(csvFile, StandardCharsets.UTF_8));
      Path sequenceFile = paths.sequenceFile(plasmidName);
      String sequence = Files.isRegularFile(sequenceFile)
          ? Files.readString(sequenceFile, StandardCharsets.UTF_8)
          : null;
      return Optional.of(Mapper.toPlasmid(row, sequence));
    } catch (IOException | RuntimeException e) {
      throw new SinkException("Failed to read plasmid '" + plasmidName + "' from " + csvFile, e);
    }
  }
}
