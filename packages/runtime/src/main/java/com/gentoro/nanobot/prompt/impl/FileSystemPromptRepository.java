package com.gentoro.nanobot.prompt.impl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** Loads prompt YAML templates from a directory, letting operators override bundled prompts. */
public class FileSystemPromptRepository extends AbstractYamlPromptRepository {
  private final Path path;

  public FileSystemPromptRepository(Path path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  @Override
  protected String read(String id) throws IOException {
    for (String ext : new String[] {".yaml", ".yml"}) {
      Path candidate = path.resolve(id + ext);
      if (Files.isRegularFile(candidate)) {
        return Files.readString(candidate);
      }
    }
    return null;
  }
}
