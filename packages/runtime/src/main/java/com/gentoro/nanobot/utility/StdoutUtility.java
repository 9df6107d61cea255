package com.gentoro.nanobot.utility;

import com.gentoro.nanobot.exception.ExceptionUtil;
import java.io.PrintStream;

/** Console output for the interactive and one-shot modes. */
public class StdoutUtility {
  private static final String green = "\u001B[32m";
  private static final String red = "\u001B[31m";
  private static final String reset = "\u001B[0m";

  public static void printReply(PrintStream out, String message) {
    out.print("\r🐈 ");
    for (String line : message.split("\n")) {
      out.printf("%s%s%s%n", green, line, reset);
    }
  }

  public static void printNewLine(PrintStream out, String message) {
    out.printf("\r%s%n", message);
  }

  public static void printError(PrintStream out, String message, Throwable cause) {
    out.printf("\r❌ %s%s%s%n", red, message, reset);
    if (cause != null) {
      for (String line : ExceptionUtil.formatCompactStackTrace(cause, 5).split("\n")) {
        out.printf("  %s%s%s%n", red, line, reset);
      }
    }
  }
}
