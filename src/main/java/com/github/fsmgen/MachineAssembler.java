package com.github.fsmgen;

import java.util.List;
import java.util.Locale;

/**
 * Emits Inc/FSMi.hpp and Src/FSMi.cpp for one machine.
 * 
 * The machine base declares a no-op reaction for every event of the global catalog, not just the
 * ones its own states react to, so every machine accepts every event the driver broadcasts.
 */
public final class MachineAssembler {
  private final StateEmitter stateEmitter;

  public MachineAssembler(final GeneratorConfiguration config) {
    this.stateEmitter = new StateEmitter(config);
  }

  public static String headerName(final Partition partition) {
    return partition.getName() + ".hpp";
  }

  public static String sourceName(final Partition partition) {
    return partition.getName() + ".cpp";
  }

  public String emitHeader(final Partition partition, final EventCatalog catalog) {
    final String machine = partition.getName();
    final String guard = machine.toUpperCase(Locale.ROOT) + "_HPP_";
    final StringBuilder code = new StringBuilder();
    code.append(CppSource.headerComment()).append('\n');
    code.append(CppSource.startGuard(guard)).append('\n');
    code.append(CppSource.include(EventsHeaderEmitter.fileName));
    code.append(CppSource.include(CppSource.runtimeHeaderName));
    code.append(CppSource.include(UserStatesEmitter.headerName)).append('\n');

    code.append("class ").append(machine).append(" : public tinyfsm::Fsm<").append(machine)
        .append("> {\n");
    code.append("public:\n");
    code.append("    void react(tinyfsm::Event const &) {};\n");
    code.append("    virtual void entry(void) {};\n");
    code.append("    virtual void exit(void) {};\n\n");
    for (final CanonicalEvent event : catalog.events()) {
      code.append("    virtual void react(").append(event.getId()).append(" const &) {};\n");
    }
    code.append("};\n\n");
    code.append(CppSource.endGuard(guard));
    return code.toString();
  }

  public String emitSource(final Partition partition, final List<StatePlan> plans) {
    final StringBuilder code = new StringBuilder();
    code.append(CppSource.headerComment()).append('\n');
    code.append(CppSource.include(headerName(partition))).append('\n');
    for (final StatePlan plan : plans) {
      code.append("class ").append(plan.getStateName()).append(";    /* ")
          .append(CppSource.commentSafe(plan.getNode().getLabel())).append(" */\n");
    }
    code.append('\n');
    for (final StatePlan plan : plans) {
      code.append(stateEmitter.emit(plan)).append('\n');
    }
    code.append(initialState(partition));
    return code.toString();
  }

  static String initialState(final Partition partition) {
    return "FSM_INITIAL_STATE(" + partition.getName() + ", "
        + partition.stateName(partition.getEntry()) + ");\n";
  }
}
