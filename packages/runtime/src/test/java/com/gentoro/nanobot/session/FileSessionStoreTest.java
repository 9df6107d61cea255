package com.gentoro.nanobot.session;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.nanobot.exception.IoException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSessionStoreTest {

  @TempDir Path dir;

  @Test
  void unknownKeyYieldsEmptySession() {
    Session session = new FileSessionStore(dir).getOrCreate("telegram:42");
    assertEquals("telegram:42", session.key());
    assertEquals(0, session.size());
  }

  @Test
  void savedHistorySurvivesANewStore() {
    FileSessionStore store = new FileSessionStore(dir);
    Session session = store.getOrCreate("telegram:42");
    session.appendExchange("hello", "hi there");
    session.appendExchange("how are you?", "fine");
    store.save(session);

    Session reloaded = new FileSessionStore(dir).getOrCreate("telegram:42");
    List<Turn> turns = reloaded.turns();
    assertEquals(4, turns.size());
    assertEquals(Turn.Role.USER, turns.get(0).role());
    assertEquals("hello", turns.get(0).content());
    assertEquals("fine", turns.get(3).content());
    assertEquals(session.createdAt(), reloaded.createdAt());
  }

  @Test
  void saveReplacesPreviousDocumentWithoutLeftovers() throws Exception {
    FileSessionStore store = new FileSessionStore(dir);
    Session session = store.getOrCreate("cli:direct");
    session.appendExchange("a", "b");
    store.save(session);
    session.appendExchange("c", "d");
    store.save(session);

    try (Stream<Path> files = Files.list(dir)) {
      List<String> names = files.map(p -> p.getFileName().toString()).toList();
      assertEquals(List.of("cli%3Adirect.json"), names);
    }
    assertEquals(4, new FileSessionStore(dir).getOrCreate("cli:direct").size());
  }

  @Test
  void failedSaveLeavesTheStoredSessionUnchanged() throws Exception {
    FileSessionStore store = new FileSessionStore(dir);
    Session session = store.getOrCreate("telegram:1");
    session.appendExchange("first", "one");
    store.save(session);

    Path blocker = store.pathFor("telegram:1").resolveSibling("telegram%3A1.json.tmp");
    Files.createDirectories(blocker);
    Files.writeString(blocker.resolve("occupied"), "x");

    session.appendExchange("second", "two");
    assertThrows(IoException.class, () -> store.save(session));

    Session current = store.getOrCreate("telegram:1");
    assertNotSame(session, current);
    assertEquals(2, current.size());
    assertEquals("one", current.turns().get(1).content());
  }

  @Test
  void keysThatSanitizeAlikeStayDistinct() {
    FileSessionStore store = new FileSessionStore(dir);
    assertNotEquals(store.pathFor("telegram:42"), store.pathFor("telegram_42"));
  }

  @Test
  void corruptFileStartsANewHistory() throws Exception {
    FileSessionStore store = new FileSessionStore(dir);
    Files.writeString(store.pathFor("slack:C1"), "{not json");

    Session session = store.getOrCreate("slack:C1");
    assertEquals(0, session.size());
  }

  @Test
  void historyReturnsMostRecentTurns() {
    Session session = new Session("k");
    session.appendExchange("1", "2");
    session.appendExchange("3", "4");

    assertEquals(
        List.of("3", "4"), session.history(2).stream().map(Turn::content).toList());
    assertEquals(4, session.history(10).size());
    assertTrue(session.history(0).isEmpty());
  }
}
