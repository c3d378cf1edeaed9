package com.github.fsmgen;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.github.fsmgen.FsmGenException.Code;

/**
 * Maps a raw edge label to its {@link CanonicalEvent}. The mapping is pure: the same label yields
 * the same event no matter which edge or graph it came from.
 * 
 * Recognized forms, tried in this order after trimming and turning whitespace into underscores:
 * <ul>
 * <li>{@code 500(T1)}: timer event {@code TIMER_1_EVENT}, 500ms on timer {@code TIMER_1}</li>
 * <li>{@code button_press}: named event {@code BUTTON_PRESS_EVENT}</li>
 * <li>empty: {@link CanonicalEvent#UNCONDITIONAL}</li>
 * </ul>
 */
public final class EventNamer {
  private static final Pattern whitespace = Pattern.compile("\\s");
  private static final Pattern timerLabel = Pattern.compile("(\\d+)\\(T(\\d+)\\)");
  private static final Pattern identifierLabel = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  public static CanonicalEvent canonicalize(final String label) throws FsmGenException {
    final String normalized = normalize(label);
    final Matcher timer = timerLabel.matcher(normalized);
    if (timer.matches()) {
      // the generated start_timer takes an int
      final int durationMillis;
      try {
        durationMillis = Integer.parseInt(timer.group(1));
      } catch (NumberFormatException overflow) {
        throw new FsmGenException(Code.INVALID_EVENT_LABEL,
            "Invalid event name: " + label + " (timer duration out of range)", overflow);
      }
      return CanonicalEvent.timer(timer.group(2), durationMillis);
    }
    if (identifierLabel.matcher(normalized).matches()) {
      return CanonicalEvent.named(normalized);
    }
    if (normalized.isEmpty()) {
      return CanonicalEvent.UNCONDITIONAL;
    }
    throw new FsmGenException(Code.INVALID_EVENT_LABEL, "Invalid event name: " + label);
  }

  static String normalize(final String label) {
    if (label == null) {
      return "";
    }
    return whitespace.matcher(label.trim()).replaceAll("_");
  }

  private EventNamer() {}
}
