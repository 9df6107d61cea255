package com.gentoro.nanobot.exception;

/** Input failed validation. */
public class ValidationException extends NanobotException {
  public ValidationException(String message) {
    super(NanobotErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(NanobotErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
