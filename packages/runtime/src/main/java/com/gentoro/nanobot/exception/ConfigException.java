package com.gentoro.nanobot.exception;

/** Configuration could not be loaded or is invalid. */
public class ConfigException extends NanobotException {
  public ConfigException(String message) {
    super(NanobotErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(NanobotErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
