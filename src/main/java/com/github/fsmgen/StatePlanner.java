package com.github.fsmgen;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmgen.FsmGenException.Code;

/**
 * Turns the outgoing edges of each state into a {@link StatePlan}. Edges are walked in discovery
 * order and their events come from the shared {@link EventCatalog}, so every plan pairs labels
 * with edges exactly as the catalog did.
 */
public final class StatePlanner {
  private static final Logger logger = LogManager.getLogger(StatePlanner.class.getSimpleName());

  private final EventCatalog catalog;

  public StatePlanner(final EventCatalog catalog) {
    this.catalog = catalog;
  }

  public List<StatePlan> plan(final Partition partition) throws FsmGenException {
    final List<StatePlan> plans = new ArrayList<>(partition.getNodes().size());
    for (final GraphNode node : partition.getNodes()) {
      plans.add(plan(partition, node));
    }
    return plans;
  }

  public StatePlan plan(final Partition partition, final GraphNode node) throws FsmGenException {
    CppSource.checkNodeId(node);
    final List<GraphEdge> outgoing = partition.outgoing(node);

    // K=timer name, V=first timer event seen for it
    final Map<String, CanonicalEvent> timers = new LinkedHashMap<>();
    // K=event id, V=reaction
    final Map<String, StatePlan.Reaction> reactions = new LinkedHashMap<>();
    Optional<GraphNode> unconditionalTarget = Optional.empty();

    for (final GraphEdge edge : outgoing) {
      final CanonicalEvent event = catalog.eventOf(edge);
      if (event.isUnconditional()) {
        if (outgoing.size() == 1) {
          unconditionalTarget = Optional.of(edge.getTarget());
        } else {
          logger.warn(String.format(
              "%s: unconditional edge to %s ignored, only a sole exit may be unconditional",
              partition.stateName(node), edge.getTarget().getId()));
        }
        continue;
      }
      if (event.isTimer()) {
        timers.putIfAbsent(event.getTimerName(), event);
      }
      final StatePlan.Reaction previous =
          reactions.putIfAbsent(event.getId(), new StatePlan.Reaction(event, edge));
      if (previous != null) {
        throw new FsmGenException(Code.AMBIGUOUS_REACTION,
            String.format("State %s reacts to %s twice: to %s (label '%s') and to %s (label '%s')",
                node.getId(), event.getId(), previous.getTarget().getId(),
                previous.getEdge().getLabel(), edge.getTarget().getId(), edge.getLabel()));
      }
    }

    final StatePlan plan = new StatePlan(partition, node, new ArrayList<>(timers.values()),
        unconditionalTarget, new ArrayList<>(reactions.values()));
    if (logger.isDebugEnabled()) {
      logger.debug("Planned " + plan);
    }
    return plan;
  }
}
