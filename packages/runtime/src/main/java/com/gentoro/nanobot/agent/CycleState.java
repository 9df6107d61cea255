package com.gentoro.nanobot.agent;

/** Phases of one orchestration cycle. REASONING and ACTING alternate within the iteration budget. */
public enum CycleState {
  IDLE,
  ASSEMBLING,
  REASONING,
  ACTING,
  FINALIZING
}
