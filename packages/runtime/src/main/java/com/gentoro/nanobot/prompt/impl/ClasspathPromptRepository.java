package com.gentoro.nanobot.prompt.impl;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Loads prompt YAML templates from the classpath under a base directory. With base "prompts",
 * template "agent" resolves to "prompts/agent.yaml" (or ".yml").
 */
public class ClasspathPromptRepository extends AbstractYamlPromptRepository {
  private final String basePath;
  private final ClassLoader classLoader;

  public ClasspathPromptRepository(String basePath) {
    this(basePath, Thread.currentThread().getContextClassLoader());
  }

  public ClasspathPromptRepository(String basePath, ClassLoader classLoader) {
    this.basePath = normalize(Objects.requireNonNull(basePath, "basePath"));
    this.classLoader =
        Objects.requireNonNullElseGet(
            classLoader, () -> ClasspathPromptRepository.class.getClassLoader());
  }

  @Override
  protected String read(String id) throws IOException {
    for (String ext : new String[] {".yaml", ".yml"}) {
      String resource = basePath + "/" + id + ext;
      try (InputStream is = classLoader.getResourceAsStream(resource)) {
        if (is != null) {
          return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
      }
    }
    return null;
  }

  private static String normalize(String p) {
    String out = p.trim();
    if (out.startsWith("/")) out = out.substring(1);
    if (out.endsWith("/")) out = out.substring(0, out.length() - 1);
    return out;
  }
}
