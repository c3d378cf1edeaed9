package com.github.fsmgen;

import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import com.github.fsmgen.GeneratorConfiguration.GeneratorConfigurationBuilder;
import com.github.fsmgen.StateGraph.StateGraphBuilder;

/**
 * Graphs shared by the tests.
 */
final class SampleGraphs {
  static final String liveDemoResource = "/graphs/live_demo.dot";
  static final String badLabelResource = "/graphs/bad_label.dot";
  static final String runtimeResource = "/runtime/tinyfsm.hpp";

  /**
   * A(entry) --500(T1)--> B, A --go--> C, B --> C (sole unconditional), C terminal.
   */
  static StateGraph timerAndUnconditional() {
    return StateGraphBuilder.newBuilder().node("A", "(ENTRY)A").node("B", "B").node("C", "C")
        .edge("A", "B", "500(T1)").edge("A", "C", "go").edge("B", "C").build();
  }

  /**
   * Two disjoint machines plus an unreachable node D.
   * 
   * <pre>
   * FSM1: P(entry) --ping--> Q --pong--> P
   * FSM2: R(entry) --tick--> S
   * D --ping--> P
   * </pre>
   */
  static StateGraph twoMachines() {
    return StateGraphBuilder.newBuilder().node("P", "(ENTRY)Ping").node("Q", "Pong")
        .node("R", "(ENTRY)Clock").node("S", "Stopped").node("D", "Detached")
        .edge("P", "Q", "ping").edge("Q", "P", "pong").edge("R", "S", "tick")
        .edge("D", "P", "ping").build();
  }

  /**
   * Two parallel edges A->B labeled X then Y.
   */
  static StateGraph parallelEdges() {
    return StateGraphBuilder.newBuilder().node("A", "(ENTRY)A").node("B", "B")
        .edge("A", "B", "X").edge("A", "B", "Y").build();
  }

  /**
   * Two entries that both reach M.
   */
  static StateGraph overlapping() {
    return StateGraphBuilder.newBuilder().node("E1", "(ENTRY)first").node("E2", "(ENTRY)second")
        .node("M", "shared").edge("E1", "M", "go").edge("E2", "M", "go").build();
  }

  static Path runtimeHeader() {
    try {
      return Paths.get(SampleGraphs.class.getResource(runtimeResource).toURI());
    } catch (URISyntaxException problem) {
      throw new IllegalStateException(problem);
    }
  }

  /**
   * Defaults plus the test runtime header, which every compile needs.
   */
  static GeneratorConfigurationBuilder config() {
    return GeneratorConfigurationBuilder.newBuilder().runtimeHeader(runtimeHeader());
  }

  /**
   * Parallel edges from source to target, in key order.
   */
  static List<GraphEdge> between(final StateGraph graph, final String source,
      final String target) {
    final List<GraphEdge> edges = new ArrayList<>();
    for (final GraphEdge edge : graph.outgoing(graph.node(source))) {
      if (edge.getTarget().getId().equals(target)) {
        edges.add(edge);
      }
    }
    return edges;
  }

  static String resource(final String name) throws IOException {
    try (InputStream in = SampleGraphs.class.getResourceAsStream(name)) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  private SampleGraphs() {}
}
