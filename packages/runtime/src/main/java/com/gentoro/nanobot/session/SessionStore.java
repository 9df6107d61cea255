package com.gentoro.nanobot.session;

/** Maps session keys to {@link Session}s. */
public interface SessionStore {

  /** Existing session for {@code key}, or a fresh empty one. Never fails. */
  Session getOrCreate(String key);

  /**
   * Persist the full history of {@code session}, replacing whatever was stored for its key. When
   * persisting fails the store drops its copy of {@code session}, so later reads return the last
   * state that was saved.
   */
  void save(Session session);
}
