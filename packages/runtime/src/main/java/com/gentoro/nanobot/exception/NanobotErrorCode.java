package com.gentoro.nanobot.exception;

/**
 * Canonical error codes for the nanobot runtime. Codes are stable and suitable for logs and
 * user-facing diagnostics. Prefer the most specific code that reflects where the failure started.
 */
public enum NanobotErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,

  // Domain specific
  PROMPT_ERROR,
  LLM_ERROR,
}
