package com.gentoro.nanobot.prompt;

/** Source of named {@link PromptTemplate}s. */
public interface PromptRepository {

  /**
   * Load the template called {@code name}.
   *
   * @throws com.gentoro.nanobot.exception.NotFoundException when no such template exists
   * @throws com.gentoro.nanobot.exception.PromptException when it cannot be read or parsed
   */
  PromptTemplate get(String name);
}
