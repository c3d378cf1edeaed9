package com.github.fsmgen;

/**
 * A labeled edge between an ordered pair of nodes. Parallel edges between the same ordered pair
 * are told apart by {@link #getKey()}, their discovery index within that pair.
 */
public final class GraphEdge {
  private final GraphNode source;
  private final GraphNode target;
  private final String label;
  private final int key;

  GraphEdge(final GraphNode source, final GraphNode target, final String label, final int key) {
    this.source = source;
    this.target = target;
    this.label = label;
    this.key = key;
  }

  public GraphNode getSource() {
    return source;
  }

  public GraphNode getTarget() {
    return target;
  }

  public String getLabel() {
    return label;
  }

  public int getKey() {
    return key;
  }

  @Override
  public String toString() {
    return "GraphEdge [" + source.getId() + "->" + target.getId() + "#" + key + ", label=" + label
        + "]";
  }
}
