package com.github.fsmgen;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * What a single state does, independent of how it is rendered: the timers its entry action
 * starts, the hook it calls, where an unconditional sole exit leads, and its reaction table.
 */
public final class StatePlan {
  private final Partition partition;
  private final GraphNode node;
  private final List<CanonicalEvent> startedTimers;
  private final Optional<GraphNode> unconditionalTarget;
  private final List<Reaction> reactions;

  StatePlan(final Partition partition, final GraphNode node,
      final List<CanonicalEvent> startedTimers, final Optional<GraphNode> unconditionalTarget,
      final List<Reaction> reactions) {
    this.partition = partition;
    this.node = node;
    this.startedTimers = Collections.unmodifiableList(startedTimers);
    this.unconditionalTarget = unconditionalTarget;
    this.reactions = Collections.unmodifiableList(reactions);
  }

  public Partition getPartition() {
    return partition;
  }

  public GraphNode getNode() {
    return node;
  }

  public String getStateName() {
    return partition.stateName(node);
  }

  public String getHookName() {
    return CppSource.hookName(node);
  }

  /**
   * Timer events whose timers the entry action starts, in discovery order, one per timer.
   */
  public List<CanonicalEvent> getStartedTimers() {
    return startedTimers;
  }

  public Optional<GraphNode> getUnconditionalTarget() {
    return unconditionalTarget;
  }

  public List<Reaction> getReactions() {
    return reactions;
  }

  public boolean isTerminal() {
    return reactions.isEmpty() && !unconditionalTarget.isPresent();
  }

  @Override
  public String toString() {
    return "StatePlan [state=" + getStateName() + ", timers=" + startedTimers
        + ", unconditionalTarget=" + unconditionalTarget.map(GraphNode::getId).orElse(null)
        + ", reactions=" + reactions + "]";
  }

  /**
   * One reaction handler: on {@code event}, stop the started timers and transit to
   * {@code target}.
   */
  public static final class Reaction {
    private final CanonicalEvent event;
    private final GraphEdge edge;

    Reaction(final CanonicalEvent event, final GraphEdge edge) {
      this.event = event;
      this.edge = edge;
    }

    public CanonicalEvent getEvent() {
      return event;
    }

    public GraphEdge getEdge() {
      return edge;
    }

    public GraphNode getTarget() {
      return edge.getTarget();
    }

    @Override
    public String toString() {
      return event.getId() + "->" + edge.getTarget().getId();
    }
  }
}
