package com.github.fsmgen;

/**
 * What to do when a state is reachable from more than one entry state.
 */
public enum OverlapPolicy {
  // fail the run and name the shared state
  REJECT,
  // generate the shared state once per machine that reaches it
  DUPLICATE;
}
