package com.gentoro.nanobot;

import com.gentoro.nanobot.agent.AgentLoop;
import com.gentoro.nanobot.utility.StdoutUtility;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Objects;
import java.util.Set;

/** Read-eval-print loop feeding console lines to {@link AgentLoop#processDirect(String, String)}. */
public class InteractiveConsole {
  private static final org.slf4j.Logger log =
      com.gentoro.nanobot.logging.LoggingService.getLogger(InteractiveConsole.class);

  static final Set<String> EXIT_COMMANDS = Set.of("exit", "quit", "/exit", "/quit", ":q");

  private final AgentLoop agentLoop;
  private final String sessionKey;
  private final BufferedReader in;
  private final PrintStream out;

  public InteractiveConsole(
      AgentLoop agentLoop, String sessionKey, BufferedReader in, PrintStream out) {
    this.agentLoop = Objects.requireNonNull(agentLoop, "agentLoop");
    this.sessionKey = Objects.requireNonNull(sessionKey, "sessionKey");
    this.in = Objects.requireNonNull(in, "in");
    this.out = Objects.requireNonNull(out, "out");
  }

  /** Loop until an exit command or end of input. */
  public void run() throws IOException {
    StdoutUtility.printNewLine(out, "Interactive mode (type exit or Ctrl+D to quit)");
    while (true) {
      out.print("You: ");
      out.flush();
      String line = in.readLine();
      if (line == null) {
        break;
      }
      String input = line.trim();
      if (input.isEmpty()) {
        continue;
      }
      if (EXIT_COMMANDS.contains(input.toLowerCase())) {
        break;
      }
      try {
        StdoutUtility.printReply(out, agentLoop.processDirect(input, sessionKey));
      } catch (RuntimeException e) {
        log.error("Error handling console input", e);
        StdoutUtility.printError(out, "Could not process the message", e);
      }
    }
    StdoutUtility.printNewLine(out, "Goodbye!");
  }
}
