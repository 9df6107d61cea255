package com.gentoro.nanobot.utility;

public class StringUtility {

  /** Shorten {@code input} to at most {@code max} characters, marking the cut with an ellipsis. */
  public static String preview(String input, int max) {
    if (input == null) return "";
    String singleLine = input.replace('\n', ' ');
    return singleLine.length() > max ? singleLine.substring(0, max) + "…" : singleLine;
  }
}
