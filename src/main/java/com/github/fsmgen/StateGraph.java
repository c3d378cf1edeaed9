package com.github.fsmgen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jgrapht.Graph;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.DirectedPseudograph;

/**
 * An immutable directed labeled multigraph. Nodes, and each node's outgoing edges, are kept in the
 * order they were discovered so that every pass over the graph sees the same sequence.
 * 
 * The (label, key) pairing of parallel edges is fixed once, at build time. Every algorithm that
 * revisits the edges of a node goes through {@link #outgoing(GraphNode)}, or through the JGraphT
 * view holding the same edge objects, and therefore agrees on which label belongs to which edge.
 */
public final class StateGraph {
  private final Map<String, GraphNode> nodes;
  private final Map<GraphNode, List<GraphEdge>> outgoingEdges;
  private final List<GraphEdge> edges;
  private final Graph<GraphNode, GraphEdge> view;

  private StateGraph(final Map<String, GraphNode> nodes,
      final Map<GraphNode, List<GraphEdge>> outgoingEdges, final List<GraphEdge> edges,
      final Graph<GraphNode, GraphEdge> view) {
    this.nodes = nodes;
    this.outgoingEdges = outgoingEdges;
    this.edges = edges;
    this.view = view;
  }

  public List<GraphNode> nodes() {
    return Collections.unmodifiableList(new ArrayList<>(nodes.values()));
  }

  public GraphNode node(final String id) {
    return nodes.get(id);
  }

  public int nodeCount() {
    return nodes.size();
  }

  /**
   * All edges in node order, then per node in discovery order.
   */
  public List<GraphEdge> edges() {
    return edges;
  }

  public List<GraphEdge> outgoing(final GraphNode node) {
    final List<GraphEdge> out = outgoingEdges.get(node);
    return out == null ? Collections.emptyList() : out;
  }

  /**
   * Read-only JGraphT view of this graph. Vertices and each vertex's outgoing edges iterate in
   * discovery order.
   */
  Graph<GraphNode, GraphEdge> asGraph() {
    return view;
  }

  @Override
  public String toString() {
    return "StateGraph [nodes=" + nodes.size() + ", edges=" + edges.size() + "]";
  }

  /**
   * A simple builder to let readers populate graphs with fluent APIs. Nodes referenced by an edge
   * before being declared are created with their id as label.
   */
  public final static class StateGraphBuilder {
    private final Map<String, String> labels = new LinkedHashMap<>();
    private final List<String[]> pendingEdges = new ArrayList<>();

    public static StateGraphBuilder newBuilder() {
      return new StateGraphBuilder();
    }

    public StateGraphBuilder node(final String id) {
      labels.putIfAbsent(id, id);
      return this;
    }

    public StateGraphBuilder node(final String id, final String label) {
      labels.put(id, label == null ? id : label);
      return this;
    }

    public StateGraphBuilder edge(final String sourceId, final String targetId) {
      return edge(sourceId, targetId, "");
    }

    public StateGraphBuilder edge(final String sourceId, final String targetId,
        final String label) {
      node(sourceId);
      node(targetId);
      pendingEdges.add(new String[] {sourceId, targetId, label == null ? "" : label});
      return this;
    }

    public StateGraph build() {
      final Map<String, GraphNode> nodes = new LinkedHashMap<>();
      final Map<GraphNode, List<GraphEdge>> outgoing = new LinkedHashMap<>();
      final Graph<GraphNode, GraphEdge> view = new DirectedPseudograph<>(GraphEdge.class);
      for (final Map.Entry<String, String> entry : labels.entrySet()) {
        final GraphNode node = new GraphNode(entry.getKey(), entry.getValue());
        nodes.put(node.getId(), node);
        outgoing.put(node, new ArrayList<>());
        view.addVertex(node);
      }

      // K=source id + target id, V=next free key for that ordered pair
      final Map<List<String>, Integer> nextKey = new LinkedHashMap<>();
      for (final String[] pending : pendingEdges) {
        final GraphNode source = nodes.get(pending[0]);
        final GraphNode target = nodes.get(pending[1]);
        final List<String> pair = List.of(pending[0], pending[1]);
        final int key = nextKey.merge(pair, 1, Integer::sum) - 1;
        final GraphEdge edge = new GraphEdge(source, target, pending[2], key);
        outgoing.get(source).add(edge);
        view.addEdge(source, target, edge);
      }

      final List<GraphEdge> edges = new ArrayList<>();
      for (final Map.Entry<GraphNode, List<GraphEdge>> entry : outgoing.entrySet()) {
        entry.setValue(Collections.unmodifiableList(entry.getValue()));
        edges.addAll(entry.getValue());
      }
      return new StateGraph(Collections.unmodifiableMap(nodes), outgoing,
          Collections.unmodifiableList(edges), new AsUnmodifiableGraph<>(view));
    }

    private StateGraphBuilder() {}
  }

}
