package com.github.fsmgen;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jgrapht.Graph;
import org.jgrapht.graph.DirectedPseudograph;
import org.jgrapht.nio.ImportException;
import org.jgrapht.nio.dot.DOTImporter;

import com.github.fsmgen.FsmGenException.Code;
import com.github.fsmgen.StateGraph.StateGraphBuilder;

/**
 * Reads a Graphviz DOT description into a {@link StateGraph}. Parsing itself is delegated to the
 * JGraphT DOT importer; this class only carries the node and edge labels across and preserves
 * discovery order.
 */
public final class DotGraphReader {
  private static final Logger logger = LogManager.getLogger(DotGraphReader.class.getSimpleName());

  private static final String labelAttribute = "label";

  public StateGraph read(final Path dotFile) throws FsmGenException {
    if (dotFile == null || !Files.isRegularFile(dotFile)) {
      throw new FsmGenException(Code.INPUT_NOT_FOUND, "Input file not found: " + dotFile);
    }
    try (Reader reader = Files.newBufferedReader(dotFile, StandardCharsets.UTF_8)) {
      final StateGraph graph = read(reader, dotFile.toString());
      logger.info("Loaded " + graph + " from " + dotFile);
      return graph;
    } catch (IOException problem) {
      throw new FsmGenException(Code.GRAPH_READ_FAILURE,
          "Failed to read graph description " + dotFile, problem);
    }
  }

  public StateGraph read(final String dot) throws FsmGenException {
    return read(new StringReader(dot), "<string>");
  }

  private StateGraph read(final Reader reader, final String source) throws FsmGenException {
    final EdgeSupplier edgeSupplier = new EdgeSupplier();
    final Graph<String, DotEdge> graph = new DirectedPseudograph<>(null, edgeSupplier, false);

    final Set<String> vertexOrder = new LinkedHashSet<>();
    final Map<String, String> vertexLabels = new HashMap<>();

    final DOTImporter<String, DotEdge> importer = new DOTImporter<>();
    importer.setVertexFactory(id -> {
      vertexOrder.add(id);
      return id;
    });
    importer.addVertexAttributeConsumer((vertexKey, attribute) -> {
      if (labelAttribute.equals(vertexKey.getSecond())) {
        vertexLabels.put(vertexKey.getFirst(), attribute.getValue());
      }
    });
    importer.addEdgeAttributeConsumer((edgeKey, attribute) -> {
      if (labelAttribute.equals(edgeKey.getSecond())) {
        edgeKey.getFirst().label = attribute.getValue();
      }
    });

    try {
      importer.importGraph(graph, reader);
    } catch (ImportException problem) {
      throw new FsmGenException(Code.GRAPH_READ_FAILURE,
          "Failed to parse graph description " + source + ": " + problem.getMessage(), problem);
    } catch (RuntimeException problem) {
      // the importer surfaces some grammar errors as plain runtime exceptions
      throw new FsmGenException(Code.GRAPH_READ_FAILURE,
          "Failed to parse graph description " + source + ": " + problem, problem);
    }

    // vertices the factory never saw still belong to the graph
    vertexOrder.addAll(graph.vertexSet());

    final StateGraphBuilder builder = StateGraphBuilder.newBuilder();
    for (final String vertex : vertexOrder) {
      builder.node(vertex, vertexLabels.getOrDefault(vertex, vertex));
    }
    final List<DotEdge> edges = new ArrayList<>(graph.edgeSet());
    edges.sort(Comparator.comparingInt(edge -> edge.ordinal));
    for (final DotEdge edge : edges) {
      builder.edge(graph.getEdgeSource(edge), graph.getEdgeTarget(edge), edge.label);
    }
    return builder.build();
  }

  /**
   * Importer-side edge; identity-compared so parallel edges stay distinct.
   */
  static final class DotEdge {
    private final int ordinal;
    private String label = "";

    private DotEdge(final int ordinal) {
      this.ordinal = ordinal;
    }

    @Override
    public String toString() {
      return "DotEdge [ordinal=" + ordinal + ", label=" + label + "]";
    }
  }

  private static final class EdgeSupplier implements Supplier<DotEdge> {
    private int created;

    @Override
    public DotEdge get() {
      return new DotEdge(created++);
    }
  }

}
