package com.github.fsmgen;

/**
 * The three shapes a canonicalized edge label can take.
 */
public enum EventKind {
  // empty label, the transition fires without waiting for an event
  UNCONDITIONAL,
  // <duration>(T<id>), fired by an expiring timer
  TIMER,
  // any identifier label
  NAMED;
}
