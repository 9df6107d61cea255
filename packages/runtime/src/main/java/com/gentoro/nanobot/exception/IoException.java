package com.gentoro.nanobot.exception;

/** Filesystem access failed. */
public class IoException extends NanobotException {
  public IoException(String message) {
    super(NanobotErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(NanobotErrorCode.IO_ERROR, message, cause);
  }
}
