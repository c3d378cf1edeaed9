package com.github.fsmgen;

import java.util.Locale;
import java.util.Objects;

/**
 * The canonical identity derived from an edge label. Two events are the same event iff their
 * identifiers are equal; timer metadata rides along for the timer start/stop emission.
 */
public final class CanonicalEvent {
  static final String eventSuffix = "_EVENT";
  static final String unconditionalId = "UNCONDITIONAL";

  public static final CanonicalEvent UNCONDITIONAL =
      new CanonicalEvent(unconditionalId, EventKind.UNCONDITIONAL, null, 0L);

  private final String id;
  private final EventKind kind;
  private final String timerId;
  private final long durationMillis;

  private CanonicalEvent(final String id, final EventKind kind, final String timerId,
      final long durationMillis) {
    this.id = id;
    this.kind = kind;
    this.timerId = timerId;
    this.durationMillis = durationMillis;
  }

  static CanonicalEvent named(final String normalizedLabel) {
    return new CanonicalEvent(normalizedLabel.toUpperCase(Locale.ROOT) + eventSuffix,
        EventKind.NAMED, null, 0L);
  }

  static CanonicalEvent timer(final String timerId, final long durationMillis) {
    return new CanonicalEvent("TIMER_" + timerId + eventSuffix, EventKind.TIMER, timerId,
        durationMillis);
  }

  public String getId() {
    return id;
  }

  public EventKind getKind() {
    return kind;
  }

  public boolean isUnconditional() {
    return kind == EventKind.UNCONDITIONAL;
  }

  public boolean isTimer() {
    return kind == EventKind.TIMER;
  }

  /**
   * Name of the backing timer, eg. TIMER_1. Only meaningful for timer events.
   */
  public String getTimerName() {
    return isTimer() ? "TIMER_" + timerId : null;
  }

  public String getTimerId() {
    return timerId;
  }

  public long getDurationMillis() {
    return durationMillis;
  }

  /**
   * Enumerator used for this event in the serialized fifo tag enum.
   */
  public String getTag() {
    return id + "_INDEX";
  }

  public String getSingleton() {
    return id + "_SINGLETON";
  }

  @Override
  public int hashCode() {
    return Objects.hash(id);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CanonicalEvent)) {
      return false;
    }
    return id.equals(((CanonicalEvent) obj).id);
  }

  @Override
  public String toString() {
    return isTimer() ? id + "[" + durationMillis + "ms]" : id;
  }
}
