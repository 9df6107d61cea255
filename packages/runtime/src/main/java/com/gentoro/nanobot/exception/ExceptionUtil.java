package com.gentoro.nanobot.exception;

import java.util.function.Function;

/** Utility helpers for dealing with exceptions. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, joining the top
   * frames in call order.
   *
   * <p>Example output: {@code com.example.Foo.bar (Foo.java:42) > com.example.App.main (App.java:10)}
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  public static String formatCompactStackTrace(Throwable t) {
    return formatCompactStackTrace(t, 10);
  }

  /**
   * Short human-readable description of a failure: the message when there is one, otherwise the
   * exception's simple class name.
   */
  public static String describe(Throwable t) {
    if (t == null) return "";
    String message = t.getMessage();
    return (message == null || message.isBlank()) ? t.getClass().getSimpleName() : message;
  }

  /**
   * True for errors the process cannot recover from. {@link StackOverflowError} unwinds cleanly and
   * is not treated as fatal.
   */
  public static boolean isFatal(Throwable t) {
    return t instanceof VirtualMachineError && !(t instanceof StackOverflowError);
  }

  /** Rethrow {@code t} when {@link #isFatal(Throwable)}; otherwise return normally. */
  public static void rethrowIfFatal(Throwable t) {
    if (isFatal(t)) {
      throw (VirtualMachineError) t;
    }
  }

  public static NanobotException rethrowIfUnchecked(
      Throwable t, Function<Throwable, NanobotException> supplier) {
    if (t instanceof NanobotException) {
      return (NanobotException) t;
    } else {
      return supplier.apply(t);
    }
  }
}
