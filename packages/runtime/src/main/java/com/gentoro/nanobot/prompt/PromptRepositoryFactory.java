package com.gentoro.nanobot.prompt;

import com.gentoro.nanobot.exception.ConfigException;
import com.gentoro.nanobot.prompt.impl.ClasspathPromptRepository;
import com.gentoro.nanobot.prompt.impl.FileSystemPromptRepository;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;

public final class PromptRepositoryFactory {
  private static final String DEFAULT_LOCATION = "classpath:prompts";

  private PromptRepositoryFactory() {}

  /**
   * Create a repository from the {@code prompt} configuration subset. {@code location} accepts
   * "classpath:prompts", "file:/absolute/path" or a plain filesystem path and defaults to the
   * bundled templates.
   */
  public static PromptRepository create(Configuration promptCfg) {
    String location =
        promptCfg == null ? DEFAULT_LOCATION : promptCfg.getString("location", DEFAULT_LOCATION);
    location = location.trim();

    if (location.startsWith("classpath:")) {
      String base = location.substring("classpath:".length());
      if (base.startsWith("/")) base = base.substring(1);
      if (base.isBlank()) {
        throw new ConfigException("Invalid prompt.location: classpath base path is empty");
      }
      return new ClasspathPromptRepository(base);
    }

    Path basePath;
    try {
      basePath = location.startsWith("file:") ? Path.of(URI.create(location)) : Path.of(location);
    } catch (IllegalArgumentException iae) {
      throw new ConfigException("Invalid prompt.location URI/path: " + location, iae);
    }
    if (!Files.isDirectory(basePath)) {
      throw new ConfigException("Prompt storage directory does not exist: " + basePath);
    }
    return new FileSystemPromptRepository(basePath);
  }
}
