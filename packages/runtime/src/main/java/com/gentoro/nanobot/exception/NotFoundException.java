package com.gentoro.nanobot.exception;

/** A named resource (prompt, session file, provider) does not exist. */
public class NotFoundException extends NanobotException {
  public NotFoundException(String message) {
    super(NanobotErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(NanobotErrorCode.NOT_FOUND, message, cause);
  }
}
