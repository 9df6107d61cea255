package com.gentoro.nanobot.session;

import com.gentoro.nanobot.exception.IoException;
import com.gentoro.nanobot.utility.JacksonUtility;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores one JSON document per session key under a directory. Saves write a sibling temporary
 * file and atomically move it over the previous document, so readers never see a partial
 * history. Loaded sessions are cached for the lifetime of the store; a session whose save fails
 * is evicted, and the next {@link #getOrCreate} reloads the last saved state.
 */
public class FileSessionStore implements SessionStore {
  private static final org.slf4j.Logger log =
      com.gentoro.nanobot.logging.LoggingService.getLogger(FileSessionStore.class);

  /** On-disk shape of a session. */
  record SessionDocument(String key, String createdAt, String updatedAt, List<Turn> turns) {}

  private final Path directory;
  private final Map<String, Session> cache = new ConcurrentHashMap<>();

  public FileSessionStore(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory");
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new IoException("Cannot create session directory " + directory, e);
    }
  }

  @Override
  public Session getOrCreate(String key) {
    return cache.computeIfAbsent(key, this::load);
  }

  @Override
  public void save(Session session) {
    SessionDocument document =
        new SessionDocument(
            session.key(),
            session.createdAt().toString(),
            session.updatedAt().toString(),
            session.turns());
    Path target = pathFor(session.key());
    Path temp = target.resolveSibling(target.getFileName() + ".tmp");
    synchronized (this) {
      try {
        Files.writeString(temp, JacksonUtility.toJson(document));
        Files.move(
            temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (IOException e) {
        // The cached copy holds turns that never reached disk.
        cache.remove(session.key(), session);
        IoException failure = new IoException("Failed to save session " + session.key(), e);
        try {
          Files.deleteIfExists(temp);
        } catch (IOException cleanup) {
          failure.addSuppressed(cleanup);
        }
        throw failure;
      }
    }
    cache.put(session.key(), session);
    log.trace("Saved session {} ({} turns)", session.key(), document.turns().size());
  }

  Path pathFor(String key) {
    return directory.resolve(URLEncoder.encode(key, StandardCharsets.UTF_8) + ".json");
  }

  private Session load(String key) {
    Path file = pathFor(key);
    if (!Files.isRegularFile(file)) {
      return new Session(key);
    }
    try {
      SessionDocument document =
          JacksonUtility.getJsonMapper().readValue(file.toFile(), SessionDocument.class);
      return new Session(
          key,
          parseInstant(document.createdAt()),
          parseInstant(document.updatedAt()),
          document.turns() == null ? List.of() : document.turns());
    } catch (IOException | RuntimeException e) {
      log.warn("Unreadable session file {}, starting a new history: {}", file, e.getMessage());
      return new Session(key);
    }
  }

  private static Instant parseInstant(String value) {
    return value == null ? Instant.now() : Instant.parse(value);
  }
}
