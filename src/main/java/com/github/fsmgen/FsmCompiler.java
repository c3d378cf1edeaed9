package com.github.fsmgen;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmgen.FsmGenException.Code;

/**
 * Compiles a {@link StateGraph} into the full tinyfsm source tree.
 * 
 * Pipeline, leaves first:<br>
 * 1. canonicalize every edge label into the graph-wide {@link EventCatalog}<br>
 * 2. split the graph into one {@link Partition} per entry state<br>
 * 3. plan and render every state of every partition<br>
 * 4. assemble machine files, then the shared catalog, queue, driver and user hooks<br>
 * 
 * Compilation is pure and deterministic: identical graphs and configurations produce identical
 * trees. Nothing is written until {@link GeneratedTree#commit(Path)}, so any input error aborts
 * the run before the output directory is touched.
 */
public final class FsmCompiler {
  private static final Logger logger = LogManager.getLogger(FsmCompiler.class.getSimpleName());

  private final GeneratorConfiguration config;
  private final EventsHeaderEmitter eventsEmitter;
  private final UserStatesEmitter userStatesEmitter;
  private final MachineAssembler machineAssembler;
  private final DriverAssembler driverAssembler;

  public FsmCompiler(final GeneratorConfiguration config) {
    this.config = config;
    this.eventsEmitter = new EventsHeaderEmitter(config);
    this.userStatesEmitter = new UserStatesEmitter(config);
    this.machineAssembler = new MachineAssembler(config);
    this.driverAssembler = new DriverAssembler(config);
  }

  public GeneratorConfiguration getConfiguration() {
    return config;
  }

  /**
   * Read {@code infile}, compile it and commit the result under {@code outputDir}.
   */
  public GeneratedTree generate(final Path infile, final Path outputDir) throws FsmGenException {
    if (infile == null || !Files.exists(infile)) {
      throw new FsmGenException(Code.INPUT_NOT_FOUND, "Input file not found: " + infile);
    }
    final StateGraph graph = new DotGraphReader().read(infile);
    final GeneratedTree tree = compile(graph);
    tree.commit(outputDir);
    return tree;
  }

  public GeneratedTree compile(final StateGraph graph) throws FsmGenException {
    logger.info("Compiling " + graph + " with " + config);
    final CompilationStatistics stats = new CompilationStatistics();
    final GeneratedTree tree = new GeneratedTree(stats);

    for (final GraphNode node : graph.nodes()) {
      CppSource.checkNodeId(node);
    }
    final EventCatalog catalog = EventCatalog.build(graph);
    final List<Partition> partitions =
        new PartitionResolver(config.getOverlapPolicy()).resolve(graph);
    final StatePlanner planner = new StatePlanner(catalog);

    tree.addHeader(CppSource.runtimeHeaderName, RuntimeSupport.load(config.getRuntimeHeader()));
    tree.addHeader(EventsHeaderEmitter.fileName, eventsEmitter.emit(catalog));
    tree.addHeader(DriverAssembler.fifoHeaderName, driverAssembler.emitFifoHeader(catalog));
    tree.addSource(DriverAssembler.fifoSourceName, driverAssembler.emitFifoSource());
    tree.addHeader(DriverAssembler.driverHeaderName, driverAssembler.emitDriverHeader());
    tree.addSource(DriverAssembler.driverSourceName,
        driverAssembler.emitDriverSource(partitions, catalog));
    tree.addHeader(UserStatesEmitter.headerName, userStatesEmitter.emitHeader(graph));
    tree.addSource(UserStatesEmitter.sourceName, userStatesEmitter.emitSource(graph));

    for (final Partition partition : partitions) {
      final List<StatePlan> plans = planner.plan(partition);
      tree.addHeader(MachineAssembler.headerName(partition),
          machineAssembler.emitHeader(partition, catalog));
      tree.addSource(MachineAssembler.sourceName(partition),
          machineAssembler.emitSource(partition, plans));
      stats.states += plans.size();
      logger.info("Assembled " + partition.getName() + " with " + plans.size() + " states");
    }

    stats.nodes = graph.nodeCount();
    stats.edges = graph.edges().size();
    stats.machines = partitions.size();
    stats.events = catalog.size();
    stats.timers = catalog.timerEvents().size();
    stats.artifacts = tree.size();
    stats.stop();
    logger.info(stats);
    return tree;
  }
}
