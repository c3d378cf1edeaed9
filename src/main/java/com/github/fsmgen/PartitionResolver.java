package com.github.fsmgen;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jgrapht.traverse.BreadthFirstIterator;

import com.github.fsmgen.FsmGenException.Code;

/**
 * Finds the entry nodes of a graph and splits it into one machine per entry. Entry order, and hence
 * machine numbering, follows node discovery order.
 */
public final class PartitionResolver {
  private static final Logger logger =
      LogManager.getLogger(PartitionResolver.class.getSimpleName());

  private final OverlapPolicy overlapPolicy;

  public PartitionResolver(final OverlapPolicy overlapPolicy) {
    this.overlapPolicy = overlapPolicy;
  }

  public static List<GraphNode> entries(final StateGraph graph) {
    final List<GraphNode> entries = new ArrayList<>();
    for (final GraphNode node : graph.nodes()) {
      if (node.isEntry()) {
        entries.add(node);
      }
    }
    return entries;
  }

  /**
   * Breadth-first forward closure of {@code start}, every node visited once, edges followed
   * regardless of their label. Result is in visit order and starts with {@code start}.
   */
  public static List<GraphNode> reachable(final StateGraph graph, final GraphNode start) {
    final List<GraphNode> visited = new ArrayList<>();
    final BreadthFirstIterator<GraphNode, GraphEdge> closure =
        new BreadthFirstIterator<>(graph.asGraph(), start);
    while (closure.hasNext()) {
      visited.add(closure.next());
    }
    return visited;
  }

  public List<Partition> resolve(final StateGraph graph) throws FsmGenException {
    final List<GraphNode> entries = entries(graph);
    final List<Partition> partitions = new ArrayList<>(entries.size());
    // K=node, V=first machine that claimed it
    final Map<GraphNode, Partition> owners = new LinkedHashMap<>();

    for (int iter = 0; iter < entries.size(); iter++) {
      final GraphNode entry = entries.get(iter);
      final Set<GraphNode> members = new HashSet<>(reachable(graph, entry));
      final List<GraphNode> ordered = new ArrayList<>(members.size());
      for (final GraphNode node : graph.nodes()) {
        if (members.contains(node)) {
          ordered.add(node);
        }
      }
      final Partition partition = new Partition(iter + 1, entry, ordered, members, graph);

      for (final GraphNode node : ordered) {
        final Partition owner = owners.putIfAbsent(node, partition);
        if (owner == null) {
          continue;
        }
        final String message = String.format("State %s is reachable from both %s (%s) and %s (%s)",
            node.getId(), owner.getName(), owner.getEntry().getId(), partition.getName(),
            entry.getId());
        if (overlapPolicy == OverlapPolicy.REJECT) {
          throw new FsmGenException(Code.OVERLAPPING_PARTITIONS, message);
        }
        logger.warn(message + "; generating it in both machines");
      }

      partitions.add(partition);
      logger.info("Resolved " + partition);
      if (logger.isDebugEnabled()) {
        logger.debug(partition.getName() + " states: " + ordered);
      }
    }
    if (partitions.isEmpty()) {
      logger.warn("No " + GraphNode.entryMarker
          + " state found; only the shared catalog, queue and driver will be generated");
    }
    return partitions;
  }
}
