package com.gentoro.nanobot.exception;

/** JSON or YAML could not be read or written. */
public class SerializationException extends NanobotException {
  public SerializationException(String message) {
    super(NanobotErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(NanobotErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
