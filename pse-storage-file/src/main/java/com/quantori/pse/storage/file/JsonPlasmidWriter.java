package com.quantori.pse.storage.file;

import com.quantori.pse.api.PlasmidWriter;
import com.quantori.pse.api.SinkException;
import com.quantori.pse.api.model.Plasmid;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/** Writes every record, sequence included, as one JSON document. Absent values are {@code null}. */
@Slf4j
public class JsonPlasmidWriter implements PlasmidWriter {
  private final PlasmidPaths paths;

  public JsonPlasmidWriter(Path root) {
    this.paths = new PlasmidPaths(root);
  }

  @Override
  public void write(Plasmid plasmid) {
    Path jsonFile = paths.jsonFile(plasmid.getName());
    try {
      Files.createDirectories(jsonFile.getParent());
      Files.writeString(jsonFile, JsonMapper.toJsonString(Mapper.toDocument(plasmid)), StandardCharsets.UTF_8);
      log.debug("Plasmid {} written to {}", plasmid.getId(), jsonFile);
    } catch (IOException e) {
      throw new SinkException("Failed to write plasmid " + plasmid.getId() + " to " + jsonFile, e);
    }
  }

  @Override
  public void close() {
    // nothing is buffered
  }
}
