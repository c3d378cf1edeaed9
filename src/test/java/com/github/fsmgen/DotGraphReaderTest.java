package com.github.fsmgen;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.github.fsmgen.FsmGenException.Code;

/**
 * Tests for reading DOT descriptions into the graph model.
 */
public class DotGraphReaderTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private final DotGraphReader reader = new DotGraphReader();

  @Test
  public void testLabelsAndOrder() throws Exception {
    final StateGraph graph = reader.read(SampleGraphs.resource(SampleGraphs.liveDemoResource));

    assertEquals(5, graph.nodeCount());
    final String[] ids = {"S01", "S02", "S03", "S04", "S05"};
    for (int iter = 0; iter < ids.length; iter++) {
      assertEquals(ids[iter], graph.nodes().get(iter).getId());
    }
    assertEquals("(ENTRY)One", graph.node("S01").getLabel());
    assertTrue(graph.node("S01").isEntry());
    assertTrue(graph.node("S03").isEntry());
    assertFalse(graph.node("S02").isEntry());
    assertEquals(7, graph.edges().size());
  }

  @Test
  public void testParallelEdgesKeepTheirLabels() throws Exception {
    final StateGraph graph = reader.read(SampleGraphs.resource(SampleGraphs.liveDemoResource));
    final List<GraphEdge> parallel = SampleGraphs.between(graph, "S02", "S01");

    assertEquals(2, parallel.size());
    assertEquals("button", parallel.get(0).getLabel());
    assertEquals(0, parallel.get(0).getKey());
    assertEquals("reset", parallel.get(1).getLabel());
    assertEquals(1, parallel.get(1).getKey());
  }

  @Test
  public void testMissingLabels() throws FsmGenException {
    final StateGraph graph = reader.read("digraph G { A -> B; B [label=\"(ENTRY)B\"]; }");

    assertEquals("A", graph.node("A").getLabel());
    assertTrue(graph.node("B").isEntry());
    assertEquals("", graph.outgoing(graph.node("A")).get(0).getLabel());
  }

  @Test
  public void testMissingFile() throws IOException {
    final Path missing = folder.getRoot().toPath().resolve("nope.dot");
    try {
      reader.read(missing);
      fail("Expected missing input to be rejected");
    } catch (FsmGenException expected) {
      assertEquals(Code.INPUT_NOT_FOUND, expected.getCode());
      assertTrue(expected.getMessage().contains("nope.dot"));
    }
  }

  @Test
  public void testUnparseableGraph() {
    try {
      reader.read("this is { not dot");
      fail("Expected garbage input to be rejected");
    } catch (FsmGenException expected) {
      assertEquals(Code.GRAPH_READ_FAILURE, expected.getCode());
    }
  }
}
