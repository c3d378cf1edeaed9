package com.github.fsmgen;

/**
 * Holder of statistics for one compiler run.
 */
public final class CompilationStatistics {
  private final long startMillis = System.currentTimeMillis();
  int nodes;
  int edges;
  int machines;
  int states;
  int events;
  int timers;
  int artifacts;
  long elapsedMillis;

  void stop() {
    elapsedMillis = System.currentTimeMillis() - startMillis;
  }

  public int getNodes() {
    return nodes;
  }

  public int getEdges() {
    return edges;
  }

  public int getMachines() {
    return machines;
  }

  /**
   * Generated state classes across all machines; a node shared by two machines counts twice.
   */
  public int getStates() {
    return states;
  }

  public int getEvents() {
    return events;
  }

  public int getTimers() {
    return timers;
  }

  public int getArtifacts() {
    return artifacts;
  }

  public long getElapsedMillis() {
    return elapsedMillis;
  }

  @Override
  public String toString() {
    return "CompilationStatistics [nodes=" + nodes + ", edges=" + edges + ", machines=" + machines
        + ", states=" + states + ", events=" + events + ", timers=" + timers + ", artifacts="
        + artifacts + ", elapsedMillis=" + elapsedMillis + "]";
  }
}
