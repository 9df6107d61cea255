package com.gentoro.nanobot.session;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Process-local store used when no session directory is configured, and in tests. */
public class InMemorySessionStore implements SessionStore {
  private final Map<String, Session> sessions = new ConcurrentHashMap<>();

  @Override
  public Session getOrCreate(String key) {
    return sessions.computeIfAbsent(key, Session::new);
  }

  @Override
  public void save(Session session) {
    sessions.put(session.key(), session);
  }
}
