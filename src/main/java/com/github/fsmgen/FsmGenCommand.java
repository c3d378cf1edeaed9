package com.github.fsmgen;

import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsmgen.GeneratorConfiguration.GeneratorConfigurationBuilder;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Command line entry point.
 * 
 * <pre>
 * fsm-gen [-hsV] [--allow-overlap] [--fifo-size=&lt;n&gt;] [--platform-header=&lt;file&gt;]
 *         --runtime-header=&lt;file&gt; &lt;infile&gt; &lt;outdir&gt;
 * </pre>
 * 
 * Exit status is 0 on success and 1 for every generator failure, eg. a missing input file or an
 * unparseable edge label.
 */
@Command(name = "fsm-gen", mixinStandardHelpOptions = true, version = "fsm-gen 1.0.0",
    description = "Generate C++ state machines from a DOT graph.")
public final class FsmGenCommand implements Callable<Integer> {
  private static final Logger logger = LogManager.getLogger(FsmGenCommand.class.getSimpleName());

  static final int exitFailure = 1;

  @Parameters(index = "0", paramLabel = "infile", description = "a *.dot file to be converted.")
  private Path infile;

  @Parameters(index = "1", paramLabel = "outdir",
      description = "directory to output generated code; Inc/ and Src/ are created inside it.")
  private Path outdir;

  @Option(names = {"-s", "--stubs"},
      description = "forces stub generation: no timer enum, prototypes or start/stop calls.")
  private boolean stubs;

  @Option(names = "--allow-overlap",
      description = "generate states reachable from several entries once per machine instead of failing.")
  private boolean allowOverlap;

  @Option(names = "--fifo-size", paramLabel = "<n>",
      description = "capacity of the generated event fifo (default: ${DEFAULT-VALUE}).")
  private int fifoSize = GeneratorConfiguration.defaultFifoSize;

  @Option(names = "--platform-header", paramLabel = "<file>",
      description = "header providing __disable_irq/__enable_irq (default: ${DEFAULT-VALUE}).")
  private String platformHeader = GeneratorConfiguration.defaultPlatformHeader;

  @Option(names = "--runtime-header", paramLabel = "<file>", required = true,
      description = "the tinyfsm.hpp to copy to Inc/tinyfsm.hpp.")
  private Path runtimeHeader;

  @Override
  public Integer call() {
    try {
      final GeneratorConfiguration config = GeneratorConfigurationBuilder.newBuilder()
          .stubs(stubs)
          .overlapPolicy(allowOverlap ? OverlapPolicy.DUPLICATE : OverlapPolicy.REJECT)
          .fifoSize(fifoSize).platformHeader(platformHeader).runtimeHeader(runtimeHeader).build();
      final GeneratedTree tree = new FsmCompiler(config).generate(infile, outdir);
      System.out.println("Generated " + tree.size() + " files in " + outdir);
      return CommandLine.ExitCode.OK;
    } catch (FsmGenException problem) {
      System.err.println(problem.getMessage());
      logger.error("Generation failed with " + problem.getCode(), problem);
      return exitFailure;
    }
  }

  public static int run(final String... args) {
    return new CommandLine(new FsmGenCommand()).execute(args);
  }

  public static void main(String[] args) {
    System.exit(run(args));
  }
}
