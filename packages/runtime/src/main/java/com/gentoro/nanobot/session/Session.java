package com.gentoro.nanobot.session;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only conversation history of one session key. Turns are appended in pairs by the
 * orchestrator once a cycle finalizes; concurrent cycles on the same key interleave whole pairs.
 */
public class Session {
  private final String key;
  private final Instant createdAt;
  private final List<Turn> turns = new ArrayList<>();
  private Instant updatedAt;

  public Session(String key) {
    this(key, Instant.now(), Instant.now(), List.of());
  }

  Session(String key, Instant createdAt, Instant updatedAt, List<Turn> turns) {
    this.key = Objects.requireNonNull(key, "key");
    this.createdAt = createdAt;
    this.updatedAt = updatedAt;
    this.turns.addAll(turns);
  }

  public String key() {
    return key;
  }

  public Instant createdAt() {
    return createdAt;
  }

  public synchronized Instant updatedAt() {
    return updatedAt;
  }

  /** Append a user turn followed by the assistant's reply as one unit. */
  public synchronized void appendExchange(String userContent, String assistantContent) {
    Instant now = Clock.systemUTC().instant();
    turns.add(new Turn(Turn.Role.USER, userContent, now.toString()));
    turns.add(new Turn(Turn.Role.ASSISTANT, assistantContent, now.toString()));
    updatedAt = now;
  }

  public synchronized List<Turn> turns() {
    return List.copyOf(turns);
  }

  /** The most recent {@code maxTurns} turns, oldest first. */
  public synchronized List<Turn> history(int maxTurns) {
    if (maxTurns <= 0) return List.of();
    int from = Math.max(0, turns.size() - maxTurns);
    return List.copyOf(turns.subList(from, turns.size()));
  }

  public synchronized int size() {
    return turns.size();
  }
}
