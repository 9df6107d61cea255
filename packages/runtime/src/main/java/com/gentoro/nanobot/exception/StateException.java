package com.gentoro.nanobot.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends NanobotException {
  public StateException(String message) {
    super(NanobotErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(NanobotErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
