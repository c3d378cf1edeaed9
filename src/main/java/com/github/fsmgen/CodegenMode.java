package com.github.fsmgen;

/**
 * This represents how much of the timer apparatus the generator emits.
 */
public enum CodegenMode {
  // timer enum, timer prototypes and start/stop calls in every state
  FULL,
  // no timer code anywhere; timer events still exist as plain events
  STUBS;
}
