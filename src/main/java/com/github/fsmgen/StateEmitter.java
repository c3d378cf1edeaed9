package com.github.fsmgen;

/**
 * Renders a {@link StatePlan} as a tinyfsm state class.
 */
public final class StateEmitter {
  private static final String indent = "    ";

  private final GeneratorConfiguration config;

  public StateEmitter(final GeneratorConfiguration config) {
    this.config = config;
  }

  public String emit(final StatePlan plan) {
    final Partition partition = plan.getPartition();
    final StringBuilder code = new StringBuilder();
    code.append("class ").append(plan.getStateName()).append(" : public ")
        .append(partition.getName()).append(" {\n");
    code.append(entryAction(plan));
    for (final StatePlan.Reaction reaction : plan.getReactions()) {
      code.append('\n').append(reaction(plan, reaction));
    }
    return code.append("};\n").toString();
  }

  String entryAction(final StatePlan plan) {
    final StringBuilder code = new StringBuilder();
    code.append(indent).append("void entry() {\n");
    if (config.emitTimers()) {
      for (final CanonicalEvent timer : plan.getStartedTimers()) {
        code.append(indent).append(indent).append("start_timer(").append(timer.getTimerName())
            .append(", ").append(timer.getDurationMillis()).append(");\n");
      }
    }
    code.append(indent).append(indent).append(plan.getHookName()).append("();\n");
    if (plan.getUnconditionalTarget().isPresent()) {
      code.append(indent).append(indent)
          .append(transit(plan.getPartition(), plan.getUnconditionalTarget().get()));
    }
    return code.append(indent).append("}\n").toString();
  }

  String reaction(final StatePlan plan, final StatePlan.Reaction reaction) {
    final StringBuilder code = new StringBuilder();
    code.append(indent).append("void react(").append(reaction.getEvent().getId())
        .append(" const &) override {\n");
    if (config.emitTimers()) {
      for (final CanonicalEvent timer : plan.getStartedTimers()) {
        code.append(indent).append(indent).append("stop_timer(").append(timer.getTimerName())
            .append(");\n");
      }
    }
    code.append(indent).append(indent).append(transit(plan.getPartition(), reaction.getTarget()));
    return code.append(indent).append("}\n").toString();
  }

  private static String transit(final Partition partition, final GraphNode target) {
    return "transit<" + partition.stateName(target) + ">();\n";
  }
}
