package com.gentoro.nanobot.exception;

/** A prompt template could not be loaded or rendered. */
public class PromptException extends NanobotException {
  public PromptException(String message) {
    super(NanobotErrorCode.PROMPT_ERROR, message);
  }

  public PromptException(String message, Throwable cause) {
    super(NanobotErrorCode.PROMPT_ERROR, message, cause);
  }
}
