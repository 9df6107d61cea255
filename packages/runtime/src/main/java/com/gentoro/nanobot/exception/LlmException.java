package com.gentoro.nanobot.exception;

/** Errors raised while talking to a reasoning engine provider or decoding its replies. */
public class LlmException extends NanobotException {
  public LlmException(String message) {
    super(NanobotErrorCode.LLM_ERROR, message);
  }

  public LlmException(String message, Throwable cause) {
    super(NanobotErrorCode.LLM_ERROR, message, cause);
  }
}
