package com.github.fsmgen;

import java.util.Objects;

/**
 * This object represents immutable metadata about a node of the input graph. A node becomes a
 * state in every machine whose entry reaches it.
 */
public final class GraphNode {
  static final String entryMarker = "(ENTRY)";

  private final String id;
  private final String label;

  GraphNode(final String id, final String label) {
    this.id = id;
    this.label = label;
  }

  public String getId() {
    return id;
  }

  public String getLabel() {
    return label;
  }

  public boolean isEntry() {
    return label.startsWith(entryMarker);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof GraphNode)) {
      return false;
    }
    return id.equals(((GraphNode) obj).id);
  }

  @Override
  public String toString() {
    return "GraphNode [id=" + id + ", label=" + label + "]";
  }
}
