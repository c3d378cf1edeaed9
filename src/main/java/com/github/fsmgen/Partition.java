package com.github.fsmgen;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * One independent machine: the nodes reachable from a single entry node, plus the edges between
 * them. Nodes are listed in graph order.
 */
public final class Partition {
  private final String name;
  private final GraphNode entry;
  private final List<GraphNode> nodes;
  private final Set<GraphNode> members;
  private final StateGraph graph;

  Partition(final int number, final GraphNode entry, final List<GraphNode> nodes,
      final Set<GraphNode> members, final StateGraph graph) {
    this.name = "FSM" + number;
    this.entry = entry;
    this.nodes = Collections.unmodifiableList(nodes);
    this.members = Collections.unmodifiableSet(members);
    this.graph = graph;
  }

  /**
   * Machine name, FSM1 .. FSMk.
   */
  public String getName() {
    return name;
  }

  public GraphNode getEntry() {
    return entry;
  }

  public List<GraphNode> getNodes() {
    return nodes;
  }

  public boolean contains(final GraphNode node) {
    return members.contains(node);
  }

  /**
   * Outgoing edges of a member node. The reachable closure is closed under successors, so these
   * are exactly the induced edges leaving that node.
   */
  public List<GraphEdge> outgoing(final GraphNode node) {
    if (!contains(node)) {
      return Collections.emptyList();
    }
    return graph.outgoing(node);
  }

  /**
   * Generated class name of a node within this machine.
   */
  public String stateName(final GraphNode node) {
    return name + "_" + node.getId();
  }

  @Override
  public String toString() {
    return "Partition [name=" + name + ", entry=" + entry.getId() + ", states=" + nodes.size()
        + "]";
  }
}
