package com.quantori.pse.storage.file;

import java.nio.file.Path;

/** Layout of the files written for one record: {@code <root>/Plasmids/<name>/<name>...}. */
public class PlasmidPaths {
  public static final String PLASMIDS_DIRECTORY = "Plasmids";

  private final Path root;

  public PlasmidPaths(Path root) {
    this.root = root;
  }

  public Path directory(String plasmidName) {
    return root.resolve(PLASMIDS_DIRECTORY).resolve(FileNameSanitizer.sanitize(plasmidName));
  }

  public Path csvFile(String plasmidName) {
    return file(plasmidName, "_csv.txt");
  }

  public Path sequenceFile(String plasmidName) {
    return file(plasmidName, ".txt");
  }

  public Path jsonFile(String plasmidName) {
    return file(plasmidName, ".json");
  }

  private Path file(String plasmidName, String suffix) {
    return directory(plasmidName).resolve(FileNameSanitizer.sanitize(plasmidName) + suffix);
  }
}
