package com.github.fsmgen;

import java.util.List;

/**
 * Emits Inc/Events.hpp: the event type catalog shared by every machine and, unless running in stub
 * mode, the timer enumeration and the timer functions the user has to provide.
 */
public final class EventsHeaderEmitter {
  static final String fileName = "Events.hpp";
  private static final String guard = "EVENTS_HPP_";

  private final GeneratorConfiguration config;

  public EventsHeaderEmitter(final GeneratorConfiguration config) {
    this.config = config;
  }

  public String emit(final EventCatalog catalog) {
    final StringBuilder code = new StringBuilder();
    code.append(CppSource.headerComment()).append('\n');
    code.append(CppSource.startGuard(guard)).append('\n');
    code.append(CppSource.include(CppSource.runtimeHeaderName)).append('\n');
    if (config.emitTimers()) {
      code.append(timerEnum(catalog.timerEvents())).append('\n');
      code.append(timerPrototypes()).append('\n');
    }
    code.append("struct BASE_EVENT : tinyfsm::Event {};\n");
    for (final CanonicalEvent event : catalog.events()) {
      code.append("struct ").append(event.getId()).append(" : BASE_EVENT {};\n");
    }
    code.append('\n').append(CppSource.endGuard(guard));
    return code.toString();
  }

  static String timerEnum(final List<CanonicalEvent> timers) {
    final StringBuilder code = new StringBuilder("typedef enum {\n");
    for (int iter = 0; iter < timers.size(); iter++) {
      code.append("    ").append(timers.get(iter).getTimerName()).append(" = ").append(iter)
          .append(",\n");
    }
    code.append("    NUM_TIMERS = ").append(timers.size()).append('\n');
    return code.append("} Timer;\n").toString();
  }

  static String timerPrototypes() {
    return "/* Implement these functions in a user file */\n"
        + "void start_timer(Timer timer, int ms);\n" + "void stop_timer(Timer timer);\n";
  }
}
