package com.github.fsmgen;

/**
 * Emits the per-node behavior hooks: prototypes in Inc/user_states.hpp and empty bodies, labelled
 * with the node's label, in Src/user_states.cpp. Every node of the graph gets a hook, reachable
 * from an entry or not.
 */
public final class UserStatesEmitter {
  static final String headerName = "user_states.hpp";
  static final String sourceName = "user_states.cpp";
  private static final String guard = "USER_STATES_HPP_";

  private final GeneratorConfiguration config;

  public UserStatesEmitter(final GeneratorConfiguration config) {
    this.config = config;
  }

  public String emitHeader(final StateGraph graph) {
    final StringBuilder code = new StringBuilder();
    code.append(CppSource.headerComment()).append('\n');
    code.append(CppSource.startGuard(guard)).append('\n');
    code.append(CppSource.include(config.getPlatformHeader()));
    code.append(CppSource.include(EventsHeaderEmitter.fileName));
    code.append(CppSource.include(DriverAssembler.fifoHeaderName)).append('\n');
    for (final GraphNode node : graph.nodes()) {
      code.append(CppSource.hookPrototype(node)).append(";\n");
    }
    code.append('\n').append(CppSource.endGuard(guard));
    return code.toString();
  }

  public String emitSource(final StateGraph graph) {
    final StringBuilder code = new StringBuilder();
    code.append(CppSource.headerComment()).append('\n');
    code.append(CppSource.include(headerName)).append('\n');
    for (final GraphNode node : graph.nodes()) {
      code.append("/* ").append(CppSource.commentSafe(node.getLabel())).append(" */\n");
      code.append(CppSource.hookPrototype(node)).append(" {\n");
      code.append("    // TODO\n");
      code.append("}\n\n");
    }
    return code.toString();
  }
}
