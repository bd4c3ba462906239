package com.quantori.pse.storage.file;

import com.quantori.pse.api.PlasmidWriter;
import com.quantori.pse.api.SinkException;
import com.quantori.pse.api.model.Plasmid;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes every record into its own directory: a one-row CSV file with a header and, when the
 * record has one, the sequence file beside it. A record with the same name overwrites the files of
 * the previous one.
 */
@Slf4j
public class CsvPlasmidWriter implements PlasmidWriter {
  private final PlasmidPaths paths;

  public CsvPlasmidWriter(Path root) {
    this.paths = new PlasmidPaths(root);
  }

  @Override
  public void write(Plasmid plasmid) {
    Path csvFile = paths.csvFile(plasmid.getName());
    try {
      Files.createDirectories(csvFile.getParent());
      Files.writeString(csvFile, CsvRowMapper.toCsvString(Mapper.toRow(plasmid)), StandardCharsets.UTF_8);
      Path sequenceFile = paths.sequenceFile(plasmid.getName());
      if (plasmid.getSequence().isPresent()) {
        Files.writeString(sequenceFile, plasmid.getSequence().get(), StandardCharsets.UTF_8);
      } else {
        Files.deleteIfExists(sequenceFile);
      }
      log.debug("Plasmid {} written to {}", plasmid.getId(), csvFile);
    } catch (IOException e) {
      throw new SinkException("Failed to write plasmid " + plasmid.getId() + " to " + csvFile, e);
    }
  }

  @Override
  public void close() {
    // every record is written in full by write()
  }
}
